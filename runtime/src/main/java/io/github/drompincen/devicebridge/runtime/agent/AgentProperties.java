package io.github.drompincen.devicebridge.runtime.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bridge.agent")
public class AgentProperties {

    private int maxSteps = 20;
    private Duration modelCallTimeout = Duration.ofSeconds(90);
    private int modelCallRetries = 2;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private Duration settleDelay = Duration.ofMillis(300);

    public int getMaxSteps() { return maxSteps; }
    public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }

    public Duration getModelCallTimeout() { return modelCallTimeout; }
    public void setModelCallTimeout(Duration modelCallTimeout) { this.modelCallTimeout = modelCallTimeout; }

    public int getModelCallRetries() { return modelCallRetries; }
    public void setModelCallRetries(int modelCallRetries) { this.modelCallRetries = modelCallRetries; }

    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

    /** Wait between a screen-changing action and its automatic re-capture. */
    public Duration getSettleDelay() { return settleDelay; }
    public void setSettleDelay(Duration settleDelay) { this.settleDelay = settleDelay; }
}
