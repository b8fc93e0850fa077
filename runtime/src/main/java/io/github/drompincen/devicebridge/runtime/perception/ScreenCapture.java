package io.github.drompincen.devicebridge.runtime.perception;

/**
 * A capture as handed to the agent: either a PNG (base64) or accessibility tree text, plus the
 * geometry it was taken with. {@code windowHandle} is null for desktop-wide captures.
 */
public record ScreenCapture(
        Kind kind,
        String imageBase64,
        String tree,
        int width,
        int height,
        Long windowHandle,
        int left,
        int top,
        String diagnostic
) {
    public enum Kind { RASTER, TREE }

    public static ScreenCapture desktopRaster(RasterImage image) {
        return new ScreenCapture(Kind.RASTER, image.base64Png(), null, image.width(), image.height(),
                null, 0, 0, null);
    }

    public static ScreenCapture windowRaster(long handle, RasterImage image, String diagnostic) {
        return new ScreenCapture(Kind.RASTER, image.base64Png(), null, image.width(), image.height(),
                handle, image.left(), image.top(), diagnostic);
    }

    public static ScreenCapture windowTree(long handle, AccessibilityTree tree, TreeSnapshot snapshot, String diagnostic) {
        return new ScreenCapture(Kind.TREE, null, tree.text(), tree.width(), tree.height(),
                handle, snapshot.left(), snapshot.top(), diagnostic);
    }

    public String describe() {
        String scope = windowHandle == null ? "desktop" : "window " + windowHandle;
        String what = kind == Kind.TREE ? "accessibility tree" : "screenshot";
        return what + " of " + scope + " " + width + "x" + height;
    }
}
