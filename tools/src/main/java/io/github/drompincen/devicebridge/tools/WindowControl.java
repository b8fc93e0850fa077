package io.github.drompincen.devicebridge.tools;

import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import io.github.drompincen.devicebridge.runtime.desktop.WindowInfo;
import io.github.drompincen.devicebridge.runtime.desktop.WindowState;
import io.github.drompincen.devicebridge.runtime.perception.TreeSnapshot;

import java.awt.Rectangle;
import java.util.List;

/** Operating-system window management, separate from pointer and keyboard input. */
public interface WindowControl {

    List<WindowInfo> listWindows() throws AutomationException;

    /** Brings the window to the foreground, restoring it if minimized; returns its handle. */
    long focus(Long handle, String title) throws AutomationException;

    void resize(long handle, Integer x, Integer y, Integer width, Integer height) throws AutomationException;

    void setState(long handle, WindowState state) throws AutomationException;

    Rectangle bounds(long handle) throws AutomationException;

    TreeSnapshot accessibilityTree(long handle) throws AutomationException;

    static WindowControl unsupported(String platform) {
        return new WindowControl() {
            private AutomationException unavailable() {
                return new AutomationException("Window management is not available on " + platform);
            }

            @Override public List<WindowInfo> listWindows() throws AutomationException { throw unavailable(); }
            @Override public long focus(Long handle, String title) throws AutomationException { throw unavailable(); }
            @Override public void resize(long handle, Integer x, Integer y, Integer width, Integer height)
                    throws AutomationException { throw unavailable(); }
            @Override public void setState(long handle, WindowState state) throws AutomationException { throw unavailable(); }
            @Override public Rectangle bounds(long handle) throws AutomationException { throw unavailable(); }
            @Override public TreeSnapshot accessibilityTree(long handle) throws AutomationException { throw unavailable(); }
        };
    }
}
