package io.github.drompincen.devicebridge.runtime.tools;

import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import io.github.drompincen.devicebridge.runtime.perception.ScreenStateHolder;

/** Per-session state a tool may read or update while executing one call. */
public record ToolContext(
        String sessionId,
        ScreenStateHolder screen,
        AgentRunListener listener
) {
    public void log(String line) {
        listener.onLog(line);
    }
}
