package io.github.drompincen.devicebridge.runtime.desktop;

public record AutomationResult(boolean success, String error, String message) {

    public static AutomationResult ok() {
        return new AutomationResult(true, null, null);
    }

    public static AutomationResult ok(String message) {
        return new AutomationResult(true, null, message);
    }

    public static AutomationResult failure(String error) {
        return new AutomationResult(false, error, null);
    }
}
