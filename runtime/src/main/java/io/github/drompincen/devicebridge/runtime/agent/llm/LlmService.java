package io.github.drompincen.devicebridge.runtime.agent.llm;

import reactor.core.publisher.Flux;

public interface LlmService {

    /**
     * One model turn: text deltas followed by any tool calls the model wants executed.
     * Each subscription issues a new request.
     */
    Flux<LlmEvent> streamResponse(LlmRequest request);

    default boolean isAvailable() { return true; }
}
