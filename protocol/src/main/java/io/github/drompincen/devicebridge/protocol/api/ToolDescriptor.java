package io.github.drompincen.devicebridge.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/** A tool as advertised to the model: name, description and JSON schema of its arguments. */
public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema
) {}
