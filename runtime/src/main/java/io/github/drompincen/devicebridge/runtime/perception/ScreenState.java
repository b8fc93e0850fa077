package io.github.drompincen.devicebridge.runtime.perception;

/**
 * What the agent last saw. Coordinates from the model are always interpreted against the
 * current value; {@code offsetLeft/offsetTop} are the captured window's on-screen origin and
 * are zero for desktop-wide captures.
 */
public record ScreenState(
        Kind kind,
        int width,
        int height,
        boolean windowScoped,
        Long windowHandle,
        int offsetLeft,
        int offsetTop
) {
    public enum Kind { NONE, RASTER, TREE }

    public static final ScreenState EMPTY = new ScreenState(Kind.NONE, 0, 0, false, null, 0, 0);

    public static ScreenState desktop(Kind kind, int width, int height) {
        return new ScreenState(kind, width, height, false, null, 0, 0);
    }

    public static ScreenState window(Kind kind, int width, int height, long handle, int left, int top) {
        return new ScreenState(kind, width, height, true, handle, left, top);
    }

    public static ScreenState of(ScreenCapture capture) {
        ScreenState.Kind kind = capture.kind() == ScreenCapture.Kind.TREE ? Kind.TREE : Kind.RASTER;
        if (capture.windowHandle() == null) {
            return desktop(kind, capture.width(), capture.height());
        }
        return window(kind, capture.width(), capture.height(), capture.windowHandle(), capture.left(), capture.top());
    }

    /** Same dimensions, but later auto-captures target the given window. */
    public ScreenState scopedTo(long handle) {
        return new ScreenState(kind, width, height, true, handle, offsetLeft, offsetTop);
    }

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }
}
