package io.github.drompincen.devicebridge.runtime.perception;

/**
 * Conversion between the model's 0-999 grid and pixels. Pure functions, no state.
 */
public final class CoordinateMapper {

    public static final int GRID_MAX = 999;
    private static final double GRID_SIZE = 1000.0;

    private CoordinateMapper() {}

    public static Point normalize(int px, int py, int width, int height) {
        requireDimensions(width, height);
        return new Point(toGrid(px, width), toGrid(py, height));
    }

    public static Point pixel(int nx, int ny, int width, int height) {
        requireDimensions(width, height);
        return new Point((int) Math.round(nx / GRID_SIZE * width), (int) Math.round(ny / GRID_SIZE * height));
    }

    public static boolean inRange(int n) {
        return n >= 0 && n <= GRID_MAX;
    }

    public static void checkRange(int nx, int ny) throws CoordinateRangeException {
        if (!inRange(nx) || !inRange(ny)) {
            throw new CoordinateRangeException(nx, ny);
        }
    }

    /**
     * Grid point to absolute desktop pixel: scaled to the captured area, then shifted by the
     * captured window's origin.
     */
    public static Point toDesktop(int nx, int ny, ScreenState state) throws CoordinateRangeException {
        checkRange(nx, ny);
        if (!state.hasDimensions()) {
            throw new IllegalStateException("No screen dimensions known");
        }
        Point local = pixel(nx, ny, state.width(), state.height());
        return new Point(local.x() + state.offsetLeft(), local.y() + state.offsetTop());
    }

    private static int toGrid(int p, int size) {
        long n = Math.round(p * GRID_SIZE / size);
        return (int) Math.max(0, Math.min(GRID_MAX, n));
    }

    private static void requireDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
    }
}
