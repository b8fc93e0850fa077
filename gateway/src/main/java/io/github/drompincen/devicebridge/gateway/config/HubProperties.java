package io.github.drompincen.devicebridge.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bridge.hub")
public class HubProperties {

    /** How long a task caller waits for the device's response. */
    private Duration taskTimeout = Duration.ofSeconds(120);
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    public Duration getTaskTimeout() { return taskTimeout; }
    public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
}
