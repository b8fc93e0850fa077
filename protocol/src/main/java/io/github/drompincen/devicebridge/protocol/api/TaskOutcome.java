package io.github.drompincen.devicebridge.protocol.api;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Result of sending a task to a device: either the device's response text or a hub error.
 */
public record TaskOutcome(String response, BridgeError error, String errorMessage) {

    public static TaskOutcome response(String content) {
        return new TaskOutcome(content, null, null);
    }

    public static TaskOutcome notConnected(String deviceName) {
        return new TaskOutcome(null, BridgeError.NOT_CONNECTED,
                "Device \"" + deviceName + "\" is not connected.");
    }

    public static TaskOutcome timeout(String deviceName, Duration timeout) {
        return new TaskOutcome(null, BridgeError.TIMEOUT,
                "Device \"" + deviceName + "\" did not respond within " + seconds(timeout) + "s.");
    }

    public static TaskOutcome disconnected(String deviceName) {
        return new TaskOutcome(null, BridgeError.DISCONNECTED,
                "Device \"" + deviceName + "\" disconnected before responding.");
    }

    public boolean isError() {
        return error != null;
    }

    /** Exact seconds, e.g. {@code 120} or {@code 1.5}. */
    static String seconds(Duration duration) {
        return BigDecimal.valueOf(duration.toNanos(), 9).stripTrailingZeros().toPlainString();
    }
}
