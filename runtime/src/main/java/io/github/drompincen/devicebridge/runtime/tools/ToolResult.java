package io.github.drompincen.devicebridge.runtime.tools;

import io.github.drompincen.devicebridge.runtime.perception.ScreenCapture;

/**
 * Outcome of one tool call. {@code output} is what the model reads; a result may also carry a
 * screen capture, which the agent loop injects into history as a separate user message.
 */
public record ToolResult(
        boolean success,
        String output,
        String error,
        ScreenCapture capture,
        boolean autoCapture
) {
    public static ToolResult success(String output) {
        return new ToolResult(true, output, null, null, false);
    }

    public static ToolResult success(String output, ScreenCapture capture, boolean autoCapture) {
        return new ToolResult(true, output, null, capture, autoCapture);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null, false);
    }

    public static ToolResult failure(String output, String error) {
        return new ToolResult(false, output, error, null, false);
    }

    public String modelText() {
        if (output != null) return output;
        return "Error: " + error;
    }
}
