package io.github.drompincen.devicebridge.tools;

import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationResult;
import io.github.drompincen.devicebridge.runtime.desktop.MouseButton;
import io.github.drompincen.devicebridge.runtime.desktop.ScrollDirection;
import io.github.drompincen.devicebridge.runtime.desktop.WindowInfo;
import io.github.drompincen.devicebridge.runtime.desktop.WindowState;
import io.github.drompincen.devicebridge.runtime.perception.RasterImage;
import io.github.drompincen.devicebridge.runtime.perception.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AWTException;
import java.awt.HeadlessException;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Input and capture through {@link Robot}; window operations go to a {@link WindowControl}.
 * The robot is created on first use so a headless process can start without a display.
 */
public class RobotAutomationDriver implements AutomationDriver {

    private static final Logger log = LoggerFactory.getLogger(RobotAutomationDriver.class);
    private static final int INPUT_DELAY_MS = 30;

    private final WindowControl windows;
    private Robot robot;

    public RobotAutomationDriver(WindowControl windows) {
        this.windows = windows;
    }

    RobotAutomationDriver(WindowControl windows, Robot robot) {
        this.windows = windows;
        this.robot = robot;
    }

    private synchronized Robot robot() throws AutomationException {
        if (robot == null) {
            try {
                robot = new Robot();
                robot.setAutoDelay(INPUT_DELAY_MS);
            } catch (AWTException | HeadlessException e) {
                throw new AutomationException("Desktop input is not available: " + e.getMessage(), e);
            }
        }
        return robot;
    }

    @Override
    public AutomationResult click(Integer x, Integer y, MouseButton button, boolean doubleClick) {
        try {
            Robot r = robot();
            if (x != null && y != null) {
                r.mouseMove(x, y);
            }
            int mask = buttonMask(button);
            int clicks = doubleClick ? 2 : 1;
            for (int i = 0; i < clicks; i++) {
                r.mousePress(mask);
                r.mouseRelease(mask);
            }
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    @Override
    public AutomationResult moveMouse(int x, int y) {
        try {
            robot().mouseMove(x, y);
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    /** Pastes through the clipboard so any character survives, independent of keyboard layout. */
    @Override
    public AutomationResult typeText(String text) {
        try {
            Robot r = robot();
            Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
            int paste = isMac() ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
            r.keyPress(paste);
            r.keyPress(KeyEvent.VK_V);
            r.keyRelease(KeyEvent.VK_V);
            r.keyRelease(paste);
            return AutomationResult.ok("Typed " + text.length() + " character(s)");
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        } catch (IllegalStateException | HeadlessException e) {
            return AutomationResult.failure("Clipboard unavailable: " + e.getMessage());
        }
    }

    @Override
    public AutomationResult pressKey(String key, List<String> modifiers) {
        List<Integer> modifierCodes = new ArrayList<>();
        for (String modifier : modifiers) {
            OptionalInt code = KeyNames.modifier(modifier);
            if (code.isEmpty()) {
                return AutomationResult.failure("Unknown modifier: " + modifier);
            }
            modifierCodes.add(code.getAsInt());
        }
        OptionalInt keyCode = KeyNames.key(key);
        if (keyCode.isEmpty()) {
            return AutomationResult.failure("Unknown key: " + key);
        }
        try {
            Robot r = robot();
            List<Integer> pressed = new ArrayList<>();
            try {
                for (int code : modifierCodes) {
                    r.keyPress(code);
                    pressed.add(code);
                }
                r.keyPress(keyCode.getAsInt());
                r.keyRelease(keyCode.getAsInt());
            } finally {
                // modifiers must never stay held on the host
                for (int i = pressed.size() - 1; i >= 0; i--) {
                    r.keyRelease(pressed.get(i));
                }
            }
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        } catch (IllegalArgumentException e) {
            return AutomationResult.failure("Key not supported on this keyboard: " + key);
        }
    }

    @Override
    public AutomationResult scroll(Integer x, Integer y, ScrollDirection direction, int notches) {
        try {
            Robot r = robot();
            if (x != null && y != null) {
                r.mouseMove(x, y);
            }
            r.mouseWheel(direction == ScrollDirection.UP ? -notches : notches);
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    @Override
    public List<WindowInfo> listWindows() throws AutomationException {
        return windows.listWindows();
    }

    @Override
    public AutomationResult focusWindow(Long handle, String title) {
        try {
            long focused = windows.focus(handle, title);
            return AutomationResult.ok("Focused window " + focused);
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    @Override
    public AutomationResult resizeWindow(long handle, Integer x, Integer y, Integer width, Integer height) {
        try {
            windows.resize(handle, x, y, width, height);
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    @Override
    public AutomationResult setWindowState(long handle, WindowState state) {
        try {
            windows.setState(handle, state);
            return AutomationResult.ok();
        } catch (AutomationException e) {
            return AutomationResult.failure(e.getMessage());
        }
    }

    @Override
    public RasterImage captureDesktop() throws AutomationException {
        Rectangle area;
        try {
            area = new Rectangle(Toolkit.getDefaultToolkit().getScreenSize());
        } catch (HeadlessException e) {
            throw new AutomationException("No display available for capture", e);
        }
        return capture(area);
    }

    @Override
    public RasterImage captureWindow(long handle) throws AutomationException {
        Rectangle bounds = windows.bounds(handle);
        if (bounds.width <= 0 || bounds.height <= 0) {
            throw new AutomationException("Window " + handle + " has no visible area (minimized?)");
        }
        return capture(bounds);
    }

    @Override
    public TreeSnapshot captureWindowTree(long handle) throws AutomationException {
        return windows.accessibilityTree(handle);
    }

    private RasterImage capture(Rectangle area) throws AutomationException {
        BufferedImage image = robot().createScreenCapture(area);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new AutomationException("PNG encoding failed: " + e.getMessage(), e);
        }
        log.debug("[desktop] captured {}x{} at {},{}", area.width, area.height, area.x, area.y);
        return new RasterImage(Base64.getEncoder().encodeToString(out.toByteArray()),
                image.getWidth(), image.getHeight(), area.x, area.y);
    }

    private static int buttonMask(MouseButton button) {
        switch (button) {
            case RIGHT: return InputEvent.BUTTON3_DOWN_MASK;
            case MIDDLE: return InputEvent.BUTTON2_DOWN_MASK;
            default: return InputEvent.BUTTON1_DOWN_MASK;
        }
    }

    private static boolean isMac() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }
}
