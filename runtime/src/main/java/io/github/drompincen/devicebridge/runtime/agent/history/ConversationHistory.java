package io.github.drompincen.devicebridge.runtime.agent.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only message log of one agent session. Entries are only ever replaced
 * in place by compaction, never removed, except by {@link #clear()}.
 */
public class ConversationHistory {

    private final List<ChatMessage> messages = new ArrayList<>();

    public void append(ChatMessage message) {
        messages.add(message);
    }

    public void replace(int index, ChatMessage message) {
        messages.set(index, message);
    }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public void clear() {
        messages.clear();
    }

    public long materializedScreenPayloads() {
        return messages.stream()
                .flatMap(m -> m.parts().stream())
                .filter(ContentPart::isScreenPayload)
                .count();
    }
}
