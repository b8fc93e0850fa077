package io.github.drompincen.devicebridge.runtime.perception;

import java.util.Locale;

public enum PerceptionMode {
    AUTO,
    ACCESSIBILITY,
    PIXEL;

    public static PerceptionMode fromName(String name) {
        if (name == null || name.isBlank()) return AUTO;
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
