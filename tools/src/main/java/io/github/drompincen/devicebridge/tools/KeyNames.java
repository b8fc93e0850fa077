package io.github.drompincen.devicebridge.tools;

import java.awt.event.KeyEvent;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/** Model-facing key and modifier names to AWT virtual key codes. */
final class KeyNames {

    private static final Map<String, Integer> KEYS = new HashMap<>();
    private static final Map<String, Integer> MODIFIERS = new HashMap<>();

    static {
        KEYS.put("enter", KeyEvent.VK_ENTER);
        KEYS.put("return", KeyEvent.VK_ENTER);
        KEYS.put("tab", KeyEvent.VK_TAB);
        KEYS.put("escape", KeyEvent.VK_ESCAPE);
        KEYS.put("esc", KeyEvent.VK_ESCAPE);
        KEYS.put("space", KeyEvent.VK_SPACE);
        KEYS.put("backspace", KeyEvent.VK_BACK_SPACE);
        KEYS.put("delete", KeyEvent.VK_DELETE);
        KEYS.put("del", KeyEvent.VK_DELETE);
        KEYS.put("insert", KeyEvent.VK_INSERT);
        KEYS.put("home", KeyEvent.VK_HOME);
        KEYS.put("end", KeyEvent.VK_END);
        KEYS.put("pageup", KeyEvent.VK_PAGE_UP);
        KEYS.put("pagedown", KeyEvent.VK_PAGE_DOWN);
        KEYS.put("up", KeyEvent.VK_UP);
        KEYS.put("down", KeyEvent.VK_DOWN);
        KEYS.put("left", KeyEvent.VK_LEFT);
        KEYS.put("right", KeyEvent.VK_RIGHT);
        KEYS.put("printscreen", KeyEvent.VK_PRINTSCREEN);
        KEYS.put("capslock", KeyEvent.VK_CAPS_LOCK);
        for (int i = 1; i <= 12; i++) {
            KEYS.put("f" + i, KeyEvent.VK_F1 + i - 1);
        }

        MODIFIERS.put("ctrl", KeyEvent.VK_CONTROL);
        MODIFIERS.put("control", KeyEvent.VK_CONTROL);
        MODIFIERS.put("alt", KeyEvent.VK_ALT);
        MODIFIERS.put("shift", KeyEvent.VK_SHIFT);
        MODIFIERS.put("win", KeyEvent.VK_WINDOWS);
        MODIFIERS.put("windows", KeyEvent.VK_WINDOWS);
        MODIFIERS.put("meta", KeyEvent.VK_META);
        MODIFIERS.put("cmd", KeyEvent.VK_META);
    }

    private KeyNames() {}

    static OptionalInt key(String name) {
        String normalized = normalize(name);
        Integer code = KEYS.get(normalized);
        if (code != null) return OptionalInt.of(code);
        if (normalized.length() == 1) {
            char c = normalized.charAt(0);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                return OptionalInt.of(Character.toUpperCase(c));
            }
        }
        return OptionalInt.empty();
    }

    static OptionalInt modifier(String name) {
        Integer code = MODIFIERS.get(normalize(name));
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
    }
}
