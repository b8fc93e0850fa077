package io.github.drompincen.devicebridge.runtime.tools;

import io.github.drompincen.devicebridge.runtime.agent.AgentProperties;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.runtime.shell.ShellExecutor;

import java.util.Optional;

/**
 * The device collaborators a tool may need. Any of them can be absent, e.g. a process without
 * a display has no automation driver.
 */
public record ToolBindings(ShellExecutor shellExecutor, AutomationDriver automationDriver, AgentProperties agentProperties) {

    public static ToolBindings none() {
        return new ToolBindings(null, null, null);
    }

    public Optional<ShellExecutor> shell() {
        return Optional.ofNullable(shellExecutor);
    }

    public Optional<AutomationDriver> automation() {
        return Optional.ofNullable(automationDriver);
    }

    public Optional<AgentProperties> agent() {
        return Optional.ofNullable(agentProperties);
    }
}
