package io.github.drompincen.devicebridge.runtime.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.drompincen.devicebridge.runtime.agent.history.ChatMessage;
import io.github.drompincen.devicebridge.runtime.agent.history.ContentPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmService} backed by whichever Spring AI {@link ChatModel} is configured
 * ({@code spring.ai.model.chat}). Tool calls are returned to the caller instead of being
 * executed by Spring AI.
 */
@Service
@ConditionalOnProperty(name = "bridge.llm.provider", havingValue = "spring-ai", matchIfMissing = true)
public class SpringAiLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmService.class);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public SpringAiLlmService(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        log.info("SpringAiLlmService initialized with {}", chatModel.getClass().getSimpleName());
    }

    @Override
    public Flux<LlmEvent> streamResponse(LlmRequest request) {
        // Tool-call arguments are only complete in the aggregated response, so this uses call().
        return Flux.defer(() -> Flux.fromIterable(toEvents(chatModel.call(buildPrompt(request)))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    Prompt buildPrompt(LlmRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(request.systemPrompt()));

        List<ToolResponseMessage.ToolResponse> pendingResponses = new ArrayList<>();
        for (ChatMessage msg : request.messages()) {
            if (msg.role() == ChatMessage.Role.TOOL) {
                for (ContentPart part : msg.parts()) {
                    if (part instanceof ContentPart.ToolResult r) {
                        pendingResponses.add(new ToolResponseMessage.ToolResponse(r.callId(), r.toolName(), r.content()));
                    }
                }
                continue;
            }
            flushToolResponses(messages, pendingResponses);
            switch (msg.role()) {
                case SYSTEM -> messages.add(new SystemMessage(msg.text()));
                case ASSISTANT -> messages.add(toAssistantMessage(msg));
                default -> messages.add(toUserMessage(msg));
            }
        }
        flushToolResponses(messages, pendingResponses);

        List<ToolCallback> callbacks = request.tools().stream()
                .map(DeclaredToolCallback::new)
                .map(ToolCallback.class::cast)
                .toList();
        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .build();
        return new Prompt(messages, options);
    }

    List<LlmEvent> toEvents(ChatResponse response) {
        List<LlmEvent> events = new ArrayList<>();
        if (response == null) return events;
        for (Generation generation : response.getResults()) {
            AssistantMessage output = generation.getOutput();
            if (output == null) continue;
            String text = output.getText();
            if (text != null && !text.isEmpty()) {
                events.add(new LlmEvent.TextDelta(text));
            }
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                events.add(new LlmEvent.ToolCallRequested(call.id(), call.name(), parseArguments(call)));
            }
        }
        return events;
    }

    private void flushToolResponses(List<Message> messages, List<ToolResponseMessage.ToolResponse> pending) {
        if (pending.isEmpty()) return;
        messages.add(new ToolResponseMessage(List.copyOf(pending)));
        pending.clear();
    }

    private AssistantMessage toAssistantMessage(ChatMessage msg) {
        List<AssistantMessage.ToolCall> calls = msg.toolCalls().stream()
                .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(), c.arguments().toString()))
                .toList();
        return new AssistantMessage(msg.text(), Map.of(), calls);
    }

    private UserMessage toUserMessage(ChatMessage msg) {
        List<Media> media = new ArrayList<>();
        for (ContentPart part : msg.parts()) {
            if (part instanceof ContentPart.Image image) {
                media.add(Media.builder()
                        .mimeType(MimeType.valueOf(image.mediaType()))
                        .data(Base64.getDecoder().decode(image.base64Data()))
                        .build());
            }
        }
        String text = msg.text();
        if (media.isEmpty()) {
            return new UserMessage(text);
        }
        return UserMessage.builder().text(text.isEmpty() ? " " : text).media(media).build();
    }

    private JsonNode parseArguments(AssistantMessage.ToolCall call) {
        String arguments = call.arguments();
        if (arguments == null || arguments.isBlank()) return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[llm] Unparseable arguments for tool call {} ({}): {}", call.id(), call.name(), e.getOriginalMessage());
            return NullNode.getInstance();
        }
    }
}
