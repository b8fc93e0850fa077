package io.github.drompincen.devicebridge.runtime.perception;

public class CoordinateRangeException extends Exception {

    private final int x;
    private final int y;

    public CoordinateRangeException(int x, int y) {
        super("coordinates out of range. x=" + x + ", y=" + y + ". Use values 0-" + CoordinateMapper.GRID_MAX + ".");
        this.x = x;
        this.y = y;
    }

    public int getX() { return x; }
    public int getY() { return y; }
}
