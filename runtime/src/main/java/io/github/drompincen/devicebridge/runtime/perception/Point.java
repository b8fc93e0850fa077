package io.github.drompincen.devicebridge.runtime.perception;

public record Point(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
