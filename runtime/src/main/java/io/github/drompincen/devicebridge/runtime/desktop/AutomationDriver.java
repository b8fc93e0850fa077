package io.github.drompincen.devicebridge.runtime.desktop;

import io.github.drompincen.devicebridge.runtime.perception.RasterImage;
import io.github.drompincen.devicebridge.runtime.perception.TreeSnapshot;

import java.util.List;

/**
 * Native input and capture primitives. All coordinates are absolute desktop pixels.
 * Input actions report failure through {@link AutomationResult}; captures and queries throw.
 */
public interface AutomationDriver {

    /** Clicks at (x, y), or at the current pointer position when both are null. */
    AutomationResult click(Integer x, Integer y, MouseButton button, boolean doubleClick);

    AutomationResult moveMouse(int x, int y);

    AutomationResult typeText(String text);

    AutomationResult pressKey(String key, List<String> modifiers);

    /** Scrolls by {@code notches} wheel notches, after moving to (x, y) when given. */
    AutomationResult scroll(Integer x, Integer y, ScrollDirection direction, int notches);

    List<WindowInfo> listWindows() throws AutomationException;

    AutomationResult focusWindow(Long handle, String title);

    AutomationResult resizeWindow(long handle, Integer x, Integer y, Integer width, Integer height);

    AutomationResult setWindowState(long handle, WindowState state);

    RasterImage captureDesktop() throws AutomationException;

    RasterImage captureWindow(long handle) throws AutomationException;

    TreeSnapshot captureWindowTree(long handle) throws AutomationException;
}
