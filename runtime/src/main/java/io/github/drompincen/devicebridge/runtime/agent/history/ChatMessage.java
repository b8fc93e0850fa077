package io.github.drompincen.devicebridge.runtime.agent.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record ChatMessage(Role role, List<ContentPart> parts) {

    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public ChatMessage {
        parts = List.copyOf(parts);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(Role.SYSTEM, List.of(new ContentPart.Text(text)));
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, List.of(new ContentPart.Text(text)));
    }

    public static ChatMessage user(List<ContentPart> parts) {
        return new ChatMessage(Role.USER, parts);
    }

    public static ChatMessage assistant(String text, List<ContentPart.ToolCall> toolCalls) {
        List<ContentPart> parts = new ArrayList<>();
        if (text != null && !text.isEmpty()) parts.add(new ContentPart.Text(text));
        parts.addAll(toolCalls);
        return new ChatMessage(Role.ASSISTANT, parts);
    }

    public static ChatMessage toolResult(String callId, String toolName, String content) {
        return new ChatMessage(Role.TOOL, List.of(new ContentPart.ToolResult(callId, toolName, content)));
    }

    /** Text and tree blocks joined with newlines; tool calls and images are skipped. */
    public String text() {
        return parts.stream()
                .map(p -> {
                    if (p instanceof ContentPart.Text t) return t.text();
                    if (p instanceof ContentPart.Tree t) return t.render();
                    return null;
                })
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
    }

    public List<ContentPart.ToolCall> toolCalls() {
        return parts.stream()
                .filter(ContentPart.ToolCall.class::isInstance)
                .map(ContentPart.ToolCall.class::cast)
                .toList();
    }

    public boolean hasScreenPayload() {
        return parts.stream().anyMatch(ContentPart::isScreenPayload);
    }
}
