package io.github.drompincen.devicebridge.runtime.perception;

/** The single mutable screen slot of one agent session. */
public class ScreenStateHolder {

    private volatile ScreenState current = ScreenState.EMPTY;

    public ScreenState current() {
        return current;
    }

    public void update(ScreenState state) {
        this.current = state;
    }

    public void clear() {
        this.current = ScreenState.EMPTY;
    }
}
