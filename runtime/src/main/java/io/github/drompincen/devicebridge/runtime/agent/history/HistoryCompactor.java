package io.github.drompincen.devicebridge.runtime.agent.history;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces old screenshots and accessibility trees with short placeholders. Run it right
 * before appending a new capture so history never carries more than one screen payload.
 */
public class HistoryCompactor {

    public static final String SCREENSHOT_PLACEHOLDER = "[Previous screenshot removed]";
    public static final String TREE_PLACEHOLDER = "[Previous accessibility tree removed]";

    /** Returns the number of payload blocks replaced. */
    public int strip(ConversationHistory history) {
        int replaced = 0;
        List<ChatMessage> messages = history.messages();
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message.role() != ChatMessage.Role.USER || !message.hasScreenPayload()) continue;

            List<ContentPart> parts = new ArrayList<>(message.parts().size());
            for (ContentPart part : message.parts()) {
                if (part instanceof ContentPart.Image) {
                    parts.add(new ContentPart.Text(SCREENSHOT_PLACEHOLDER));
                    replaced++;
                } else if (part instanceof ContentPart.Tree) {
                    parts.add(new ContentPart.Text(TREE_PLACEHOLDER));
                    replaced++;
                } else {
                    parts.add(part);
                }
            }
            history.replace(i, ChatMessage.user(parts));
        }
        return replaced;
    }
}
