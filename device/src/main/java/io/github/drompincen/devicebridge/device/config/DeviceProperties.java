package io.github.drompincen.devicebridge.device.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bridge.device")
public class DeviceProperties {

    private String hubUrl = "ws://localhost:8080/ws/bridge";
    /** Name the orchestrator addresses this device by. Defaults to the host name. */
    private String deviceName;
    private String userId = "default";
    private Duration reconnectDelay = Duration.ofSeconds(3);
    private Duration shellTimeout = Duration.ofSeconds(60);

    public String getHubUrl() { return hubUrl; }
    public void setHubUrl(String hubUrl) { this.hubUrl = hubUrl; }

    public String getDeviceName() { return deviceName; }
    public void setDeviceName(String deviceName) { this.deviceName = deviceName; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Duration getReconnectDelay() { return reconnectDelay; }
    public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }

    public Duration getShellTimeout() { return shellTimeout; }
    public void setShellTimeout(Duration shellTimeout) { this.shellTimeout = shellTimeout; }
}
