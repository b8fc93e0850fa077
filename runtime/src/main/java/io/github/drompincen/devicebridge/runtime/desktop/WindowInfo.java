package io.github.drompincen.devicebridge.runtime.desktop;

public record WindowInfo(
        long handle,
        String title,
        String processName,
        int left,
        int top,
        int width,
        int height,
        boolean minimized
) {}
