package io.github.drompincen.devicebridge.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    ToolResult execute(ToolContext ctx, JsonNode input);

    /** Called once when the registry adopts the tool. */
    default void bind(ToolBindings bindings) {
    }
}
