package io.github.drompincen.devicebridge.runtime.desktop;

/** A capture or query primitive could not produce its data. */
public class AutomationException extends Exception {

    public AutomationException(String message) {
        super(message);
    }

    public AutomationException(String message, Throwable cause) {
        super(message, cause);
    }
}
