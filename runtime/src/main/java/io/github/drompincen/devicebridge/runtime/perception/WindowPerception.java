package io.github.drompincen.devicebridge.runtime.perception;

import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures a window as an accessibility tree or a screenshot. In {@link PerceptionMode#AUTO}
 * the tree is preferred and the screenshot is the fallback; the returned capture's diagnostic
 * says which was chosen and why.
 */
public class WindowPerception {

    private static final Logger log = LoggerFactory.getLogger(WindowPerception.class);

    private final AutomationDriver driver;

    public WindowPerception(AutomationDriver driver) {
        this.driver = driver;
    }

    public ScreenCapture capture(long handle, PerceptionMode mode) throws AutomationException {
        switch (mode) {
            case PIXEL:
                return ScreenCapture.windowRaster(handle, driver.captureWindow(handle), "pixel mode requested");
            case ACCESSIBILITY: {
                TreeSnapshot snapshot = driver.captureWindowTree(handle);
                AccessibilityTree tree = AccessibilityTreeParser.parse(snapshot.text());
                TreeAcceptance acceptance = TreeAcceptance.evaluate(tree);
                return ScreenCapture.windowTree(handle, tree, snapshot, acceptance.reason());
            }
            default:
                return captureAuto(handle);
        }
    }

    private ScreenCapture captureAuto(long handle) throws AutomationException {
        String fallbackReason;
        try {
            TreeSnapshot snapshot = driver.captureWindowTree(handle);
            AccessibilityTree tree = AccessibilityTreeParser.parse(snapshot.text());
            TreeAcceptance acceptance = TreeAcceptance.evaluate(tree);
            if (acceptance.accepted()) {
                log.debug("[perception] window {} tree accepted: {}", handle, acceptance.reason());
                return ScreenCapture.windowTree(handle, tree, snapshot, "accessibility tree used: " + acceptance.reason());
            }
            fallbackReason = "accessibility tree rejected: " + acceptance.reason();
        } catch (AutomationException e) {
            fallbackReason = "accessibility capture failed: " + e.getMessage();
        }
        log.debug("[perception] window {} falling back to screenshot ({})", handle, fallbackReason);
        return ScreenCapture.windowRaster(handle, driver.captureWindow(handle), fallbackReason);
    }
}
