package io.github.drompincen.devicebridge.runtime.agent.history;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One block of message content. Image and tree blocks are the screen payloads that
 * {@link HistoryCompactor} replaces with placeholders once a newer capture arrives.
 */
public sealed interface ContentPart
        permits ContentPart.Text, ContentPart.Image, ContentPart.Tree, ContentPart.ToolCall, ContentPart.ToolResult {

    default boolean isScreenPayload() {
        return false;
    }

    record Text(String text) implements ContentPart {}

    record Image(String mediaType, String base64Data) implements ContentPart {
        @Override
        public boolean isScreenPayload() {
            return true;
        }
    }

    record Tree(String label, String tree) implements ContentPart {
        @Override
        public boolean isScreenPayload() {
            return true;
        }

        public String render() {
            return label + "\n" + tree;
        }
    }

    record ToolCall(String id, String name, JsonNode arguments) implements ContentPart {}

    record ToolResult(String callId, String toolName, String content) implements ContentPart {}
}
