package io.github.drompincen.devicebridge.runtime.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface LlmEvent permits LlmEvent.TextDelta, LlmEvent.ToolCallRequested {

    record TextDelta(String text) implements LlmEvent {}

    record ToolCallRequested(String id, String name, JsonNode arguments) implements LlmEvent {}
}
