package io.github.drompincen.devicebridge.runtime.agent.llm;

import io.github.drompincen.devicebridge.runtime.agent.history.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;

/**
 * Offline model for running the bridge without an API key. It never calls tools and answers
 * every task with a short acknowledgement.
 *
 * Activate with: bridge.llm.provider=fake
 */
@Service
@ConditionalOnProperty(name = "bridge.llm.provider", havingValue = "fake")
public class FakeLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmService.class);

    @Override
    public Flux<LlmEvent> streamResponse(LlmRequest request) {
        String response = generateResponse(request.messages());
        log.debug("[FAKE LLM] tools={}, response length={}", request.tools().size(), response.length());
        String[] words = response.split("(?<=\\s)");
        return Flux.fromArray(words)
                .delayElements(Duration.ofMillis(20))
                .map(LlmEvent.TextDelta::new);
    }

    private String generateResponse(List<ChatMessage> messages) {
        String lastUser = lastUserText(messages);
        if (lastUser.startsWith("Summarize what you did")) {
            return "No actions were taken; this device runs the offline model.";
        }
        return "Received task: \"" + truncate(lastUser, 200) + "\". The offline model does not control the desktop.";
    }

    private String lastUserText(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage m = messages.get(i);
            if (m.role() == ChatMessage.Role.USER) return m.text();
        }
        return "";
    }

    private static String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
