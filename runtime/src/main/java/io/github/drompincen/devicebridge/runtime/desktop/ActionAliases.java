package io.github.drompincen.devicebridge.runtime.desktop;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the action names models actually produce onto the canonical desktop actions.
 */
public final class ActionAliases {

    public static final Set<String> CANONICAL = Set.of(
            "click", "mouse_move", "type", "key_press", "scroll", "list_windows", "focus_window",
            "resize_window", "minimize_window", "maximize_window", "restore_window",
            "window_screenshot", "screenshot");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("left_click", "click"),
            Map.entry("press_key", "key_press"),
            Map.entry("keypress", "key_press"),
            Map.entry("key", "key_press"),
            Map.entry("hotkey", "key_press"),
            Map.entry("move", "mouse_move"),
            Map.entry("move_mouse", "mouse_move"),
            Map.entry("mousemove", "mouse_move"),
            Map.entry("hover", "mouse_move"),
            Map.entry("type_text", "type"),
            Map.entry("write", "type"),
            Map.entry("activate", "focus_window"),
            Map.entry("activate_window", "focus_window"),
            Map.entry("focus", "focus_window"),
            Map.entry("switch_window", "focus_window"),
            Map.entry("windows", "list_windows"),
            Map.entry("get_windows", "list_windows"),
            Map.entry("resize", "resize_window"),
            Map.entry("move_window", "resize_window"),
            Map.entry("minimize", "minimize_window"),
            Map.entry("maximize", "maximize_window"),
            Map.entry("restore", "restore_window"),
            Map.entry("capture_window", "window_screenshot"),
            Map.entry("screenshot_window", "window_screenshot"),
            Map.entry("take_screenshot", "screenshot"),
            Map.entry("capture_screen", "screenshot"));

    private static final Set<String> DOUBLE_CLICK = Set.of("double_click", "doubleclick", "dblclick");

    private ActionAliases() {}

    /** Canonical action name plus what the alias itself implies about the click. */
    public record Resolved(String action, boolean doubleClick, MouseButton button) {}

    /** Returns null when the name is neither canonical nor a known alias. */
    public static Resolved resolve(String raw) {
        if (raw == null) return null;
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (DOUBLE_CLICK.contains(key)) return new Resolved("click", true, null);
        if (key.equals("right_click")) return new Resolved("click", false, MouseButton.RIGHT);
        if (key.equals("middle_click")) return new Resolved("click", false, MouseButton.MIDDLE);
        if (CANONICAL.contains(key)) return new Resolved(key, false, null);
        String canonical = ALIASES.get(key);
        return canonical == null ? null : new Resolved(canonical, false, null);
    }
}
