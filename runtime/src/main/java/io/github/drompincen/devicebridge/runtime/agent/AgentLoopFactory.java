package io.github.drompincen.devicebridge.runtime.agent;

import io.github.drompincen.devicebridge.runtime.agent.llm.LlmService;
import io.github.drompincen.devicebridge.runtime.tools.ToolRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/** Creates one {@link AgentLoop} per session; loops share the model and tools. */
@Component
@EnableConfigurationProperties(AgentProperties.class)
public class AgentLoopFactory {

    private final LlmService llmService;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    public AgentLoopFactory(LlmService llmService, ToolRegistry toolRegistry, AgentProperties properties) {
        this.llmService = llmService;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    public AgentLoop create(String sessionId) {
        return new AgentLoop(sessionId, llmService, toolRegistry, properties);
    }
}
