package io.github.drompincen.devicebridge.runtime.perception;

/** PNG image as returned by the automation layer; left/top is the on-screen origin. */
public record RasterImage(String base64Png, int width, int height, int left, int top) {}
