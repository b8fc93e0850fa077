package io.github.drompincen.devicebridge.runtime.agent.llm;

import io.github.drompincen.devicebridge.protocol.api.ToolDescriptor;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a tool to the model without letting Spring AI execute it; execution stays in
 * the agent loop so every call can be checked against the current screen state.
 */
class DeclaredToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    DeclaredToolCallback(ToolDescriptor descriptor) {
        this.definition = ToolDefinition.builder()
                .name(descriptor.name())
                .description(descriptor.description())
                .inputSchema(descriptor.inputSchema().toString())
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the agent loop");
    }
}
