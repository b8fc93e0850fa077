package io.github.drompincen.devicebridge.runtime.agent;

import io.github.drompincen.devicebridge.protocol.api.ToolDescriptor;
import io.github.drompincen.devicebridge.runtime.agent.history.ChatMessage;
import io.github.drompincen.devicebridge.runtime.agent.history.ContentPart;
import io.github.drompincen.devicebridge.runtime.agent.history.ConversationHistory;
import io.github.drompincen.devicebridge.runtime.agent.history.HistoryCompactor;
import io.github.drompincen.devicebridge.runtime.agent.llm.LlmEvent;
import io.github.drompincen.devicebridge.runtime.agent.llm.LlmRequest;
import io.github.drompincen.devicebridge.runtime.agent.llm.LlmService;
import io.github.drompincen.devicebridge.runtime.perception.ScreenCapture;
import io.github.drompincen.devicebridge.runtime.perception.ScreenState;
import io.github.drompincen.devicebridge.runtime.perception.ScreenStateHolder;
import io.github.drompincen.devicebridge.runtime.tools.Tool;
import io.github.drompincen.devicebridge.runtime.tools.ToolContext;
import io.github.drompincen.devicebridge.runtime.tools.ToolRegistry;
import io.github.drompincen.devicebridge.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one task through a bounded tool-calling conversation. An instance owns the history
 * and screen state of one session and must not run two tasks at once.
 */
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);

    static final String SUMMARY_PROMPT = "Summarize what you did and the result.";
    static final String NO_OUTPUT = "[Agent completed without text output]";
    static final String ABORTED = "[Agent aborted]";
    static final String SKIPPED = "Skipped: agent aborted before this call ran.";

    private final String sessionId;
    private final LlmService llmService;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final HistoryCompactor compactor = new HistoryCompactor();
    private final ConversationHistory history = new ConversationHistory();
    private final ScreenStateHolder screen = new ScreenStateHolder();

    public AgentLoop(String sessionId, LlmService llmService, ToolRegistry toolRegistry, AgentProperties properties) {
        this.sessionId = sessionId;
        this.llmService = llmService;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    public AgentRunResult run(String task, AgentRunListener listener, AbortSignal abort) {
        history.append(ChatMessage.user(task));
        List<ToolDescriptor> tools = toolRegistry.descriptors();
        ToolContext ctx = new ToolContext(sessionId, screen, listener);

        String finalText = "";
        int modelCalls = 0;
        for (int step = 1; step <= properties.getMaxSteps(); step++) {
            if (abort.isAborted()) {
                return aborted(finalText, modelCalls, listener);
            }
            listener.onLog("[agent] step " + step + "...");
            ModelTurn turn = callModel(tools);
            modelCalls++;
            if (!turn.text().isBlank()) {
                finalText = turn.text();
            }
            history.append(ChatMessage.assistant(turn.text(), turn.toolCalls()));

            if (turn.toolCalls().isEmpty()) {
                log.debug("[agent] session {} finished after {} model call(s)", sessionId, modelCalls);
                break;
            }

            List<ToolResult> captures = new ArrayList<>();
            for (int i = 0; i < turn.toolCalls().size(); i++) {
                ContentPart.ToolCall call = turn.toolCalls().get(i);
                if (abort.isAborted()) {
                    skipRemaining(turn.toolCalls().subList(i, turn.toolCalls().size()));
                    return aborted(finalText, modelCalls, listener);
                }
                ToolResult result = executeTool(call, ctx);
                history.append(ChatMessage.toolResult(call.id(), call.name(), result.modelText()));
                if (result.capture() != null) {
                    captures.add(result);
                }
            }
            for (ToolResult result : captures) {
                injectCapture(step, result, listener);
            }
        }

        if (abort.isAborted()) {
            return aborted(finalText, modelCalls, listener);
        }
        if (!finalText.isBlank()) {
            return new AgentRunResult(finalText, AgentRunResult.Outcome.COMPLETED, modelCalls);
        }

        listener.onLog("[agent] no final text, requesting summary");
        history.append(ChatMessage.user(SUMMARY_PROMPT));
        ModelTurn summary = callModel(List.of());
        modelCalls++;
        history.append(ChatMessage.assistant(summary.text(), List.of()));
        String text = summary.text().isBlank() ? NO_OUTPUT : summary.text();
        return new AgentRunResult(text, AgentRunResult.Outcome.SUMMARIZED, modelCalls);
    }

    /** Clears history and screen state. Only call between runs. */
    public void reset() {
        history.clear();
        screen.clear();
        log.info("[agent] session {} reset", sessionId);
    }

    public String getSessionId() { return sessionId; }

    ConversationHistory history() {
        return history;
    }

    ScreenState screenState() {
        return screen.current();
    }

    private ToolResult executeTool(ContentPart.ToolCall call, ToolContext ctx) {
        Optional<Tool> tool = toolRegistry.get(call.name());
        if (tool.isEmpty()) {
            log.warn("[tool] Unknown tool requested: {}", call.name());
            return ToolResult.failure("Unknown tool: " + call.name());
        }
        log.info("[tool] Executing: {} with args: {}", call.name(), truncate(String.valueOf(call.arguments()), 300));
        try {
            ToolResult result = tool.get().execute(ctx, call.arguments());
            log.debug("[tool] {} -> success={} {}", call.name(), result.success(), truncate(result.modelText(), 300));
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to execute tool {}: {}", call.name(), e.getMessage(), e);
            return ToolResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void injectCapture(int step, ToolResult result, AgentRunListener listener) {
        ScreenCapture capture = result.capture();
        int stripped = compactor.strip(history);
        if (stripped > 0) {
            log.debug("[agent] replaced {} old screen payload(s) with placeholders", stripped);
        }
        String action = result.autoCapture() ? "auto-capture" : "capture";
        if (capture.kind() == ScreenCapture.Kind.TREE) {
            String label = result.autoCapture()
                    ? "Here is the updated accessibility tree after the action:"
                    : "Here is the window accessibility tree:";
            history.append(ChatMessage.user(List.of(new ContentPart.Tree(label, capture.tree()))));
            listener.onTree(step, action, capture.tree());
        } else {
            String label;
            if (result.autoCapture()) {
                label = "Here is the screenshot after the action:";
            } else {
                label = capture.windowHandle() != null ? "Here is the window screenshot:" : "Here is the screenshot:";
            }
            history.append(ChatMessage.user(List.of(
                    new ContentPart.Text(label),
                    new ContentPart.Image("image/png", capture.imageBase64()))));
            listener.onScreenshot(step, action, capture.imageBase64());
        }
        if (capture.diagnostic() != null) {
            listener.onLog("[agent] a11y: " + capture.diagnostic());
        }
    }

    private void skipRemaining(List<ContentPart.ToolCall> calls) {
        for (ContentPart.ToolCall call : calls) {
            history.append(ChatMessage.toolResult(call.id(), call.name(), SKIPPED));
        }
    }

    private AgentRunResult aborted(String finalText, int modelCalls, AgentRunListener listener) {
        listener.onLog("[agent] aborted");
        String text = finalText.isBlank() ? ABORTED : finalText;
        return new AgentRunResult(text, AgentRunResult.Outcome.ABORTED, modelCalls);
    }

    private ModelTurn callModel(List<ToolDescriptor> tools) {
        LlmRequest request = new LlmRequest(SystemPrompt.TEXT, history.snapshot(), tools);
        int retries = properties.getModelCallRetries();
        List<LlmEvent> events;
        try {
            events = Mono.defer(() -> llmService.streamResponse(request).collectList())
                    .timeout(properties.getModelCallTimeout())
                    .retryWhen(Retry.backoff(retries, properties.getRetryBackoff())
                            .doBeforeRetry(s -> log.warn("[agent] model call failed (attempt {}): {}",
                                    s.totalRetries() + 1, s.failure().toString())))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelCallException("Model call failed after " + (retries + 1) + " attempt(s): "
                    + cause.getMessage(), e);
        }

        StringBuilder text = new StringBuilder();
        List<ContentPart.ToolCall> toolCalls = new ArrayList<>();
        if (events != null) {
            for (LlmEvent event : events) {
                if (event instanceof LlmEvent.TextDelta delta) {
                    text.append(delta.text());
                } else if (event instanceof LlmEvent.ToolCallRequested call) {
                    toolCalls.add(new ContentPart.ToolCall(call.id(), call.name(), call.arguments()));
                }
            }
        }
        return new ModelTurn(text.toString(), toolCalls);
    }

    private record ModelTurn(String text, List<ContentPart.ToolCall> toolCalls) {}

    public static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
