package io.github.drompincen.devicebridge.runtime.agent.llm;

import io.github.drompincen.devicebridge.protocol.api.ToolDescriptor;
import io.github.drompincen.devicebridge.runtime.agent.history.ChatMessage;

import java.util.List;

/** An empty tool list means the model must answer in text. */
public record LlmRequest(
        String systemPrompt,
        List<ChatMessage> messages,
        List<ToolDescriptor> tools
) {}
