package io.github.drompincen.devicebridge.runtime.perception;

/** Raw accessibility tree text of a window and the window's on-screen origin. */
public record TreeSnapshot(String text, int left, int top) {}
