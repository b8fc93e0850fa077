package io.github.drompincen.devicebridge.runtime.agent.llm;

import io.github.drompincen.devicebridge.runtime.agent.history.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FakeLlmServiceTest {

    private final FakeLlmService service = new FakeLlmService();

    @Test
    void echoesTaskWithoutToolCalls() {
        List<LlmEvent> events = service.streamResponse(
                new LlmRequest("sys", List.of(ChatMessage.user("open notepad")), List.of())).collectList().block();

        assertThat(events).allMatch(e -> e instanceof LlmEvent.TextDelta);
        String text = events.stream().map(e -> ((LlmEvent.TextDelta) e).text()).collect(Collectors.joining());
        assertThat(text).startsWith("Received task: \"open notepad\"");
    }
}
