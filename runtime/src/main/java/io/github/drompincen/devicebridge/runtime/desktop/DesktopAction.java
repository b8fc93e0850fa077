package io.github.drompincen.devicebridge.runtime.desktop;

import io.github.drompincen.devicebridge.runtime.perception.PerceptionMode;

import java.util.List;
import java.util.Set;

/**
 * Validated arguments of one desktop tool call, one variant per action. Coordinates on
 * pointer actions are grid values (0-999), window geometry is in pixels.
 */
public sealed interface DesktopAction {

    /** Actions that change what is on screen and are followed by an automatic capture. */
    Set<String> AUTO_CAPTURE = Set.of(
            "click", "scroll", "type", "key_press", "mouse_move",
            "focus_window", "resize_window", "maximize_window", "restore_window");

    String actionName();

    default boolean triggersAutoCapture() {
        return AUTO_CAPTURE.contains(actionName());
    }

    record Click(Integer x, Integer y, MouseButton button, boolean doubleClick) implements DesktopAction {
        public String actionName() { return "click"; }
    }

    record MouseMove(int x, int y) implements DesktopAction {
        public String actionName() { return "mouse_move"; }
    }

    record TypeText(String text) implements DesktopAction {
        public String actionName() { return "type"; }
    }

    record KeyPress(String key, List<String> modifiers) implements DesktopAction {
        public String actionName() { return "key_press"; }
    }

    record Scroll(Integer x, Integer y, ScrollDirection direction, int amount) implements DesktopAction {
        public String actionName() { return "scroll"; }
    }

    record ListWindows() implements DesktopAction {
        public String actionName() { return "list_windows"; }
    }

    record FocusWindow(Long handle, String title) implements DesktopAction {
        public String actionName() { return "focus_window"; }
    }

    record ResizeWindow(long handle, Integer x, Integer y, Integer width, Integer height) implements DesktopAction {
        public String actionName() { return "resize_window"; }
    }

    record ChangeWindowState(long handle, WindowState state) implements DesktopAction {
        public String actionName() {
            return switch (state) {
                case MINIMIZED -> "minimize_window";
                case MAXIMIZED -> "maximize_window";
                case RESTORED -> "restore_window";
            };
        }
    }

    record WindowScreenshot(long handle, PerceptionMode mode) implements DesktopAction {
        public String actionName() { return "window_screenshot"; }
    }

    record Screenshot() implements DesktopAction {
        public String actionName() { return "screenshot"; }
    }
}
