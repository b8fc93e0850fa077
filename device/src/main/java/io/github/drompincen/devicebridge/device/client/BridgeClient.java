package io.github.drompincen.devicebridge.device.client;

import io.github.drompincen.devicebridge.device.agent.DeviceAgentService;
import io.github.drompincen.devicebridge.device.config.DeviceProperties;
import io.github.drompincen.devicebridge.protocol.ws.BridgeCodec;
import io.github.drompincen.devicebridge.protocol.ws.BridgeMessage;
import io.github.drompincen.devicebridge.protocol.ws.ProtocolException;
import io.github.drompincen.devicebridge.runtime.agent.AbortSignal;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Keeps this device connected to the hub: registers on open, runs incoming tasks one at a
 * time, relays agent logs, and reconnects after the connection drops.
 */
@Component
public class BridgeClient {

    private static final Logger log = LoggerFactory.getLogger(BridgeClient.class);

    static final String USER_HEADER = "X-User-Id";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final DeviceProperties properties;
    private final DeviceAgentService agent;
    private final BridgeCodec codec;
    private final ThreadPoolTaskScheduler scheduler;
    private final WebSocketClient webSocketClient;
    private final ExecutorService taskExecutor;

    private volatile WebSocketSession session;
    private volatile AbortSignal currentRun;
    private volatile boolean running;

    @Autowired
    public BridgeClient(DeviceProperties properties, DeviceAgentService agent, BridgeCodec codec,
                        ThreadPoolTaskScheduler scheduler, WebSocketClient webSocketClient) {
        this(properties, agent, codec, scheduler, webSocketClient, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "device-task");
            t.setDaemon(true);
            return t;
        }));
    }

    BridgeClient(DeviceProperties properties, DeviceAgentService agent, BridgeCodec codec,
                 ThreadPoolTaskScheduler scheduler, WebSocketClient webSocketClient, ExecutorService taskExecutor) {
        this.properties = properties;
        this.agent = agent;
        this.codec = codec;
        this.scheduler = scheduler;
        this.webSocketClient = webSocketClient;
        this.taskExecutor = taskExecutor;
    }

    public void start() {
        running = true;
        connect();
    }

    @PreDestroy
    public void stop() {
        running = false;
        abortCurrentRun();
        WebSocketSession s = session;
        if (s != null && s.isOpen()) {
            try {
                s.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.debug("[device] close failed: {}", e.getMessage());
            }
        }
        taskExecutor.shutdownNow();
    }

    public boolean isConnected() {
        WebSocketSession s = session;
        return s != null && s.isOpen();
    }

    void connect() {
        if (!running) return;
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(USER_HEADER, properties.getUserId());
        log.info("[device] connecting to {} as '{}'", properties.getHubUrl(), agent.getDeviceName());
        webSocketClient.execute(new Handler(), headers, URI.create(properties.getHubUrl()))
                .whenComplete((s, error) -> {
                    if (error != null) {
                        log.warn("[device] connection failed: {}", error.getMessage());
                        scheduleReconnect();
                    }
                });
    }

    void onOpen(WebSocketSession raw) {
        session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        send(BridgeMessage.register(agent.getDeviceName()));
    }

    void onFrame(String payload) {
        BridgeMessage message;
        try {
            message = codec.decode(payload);
        } catch (ProtocolException e) {
            log.warn("[device] dropping frame: {}", e.getMessage());
            return;
        }
        switch (message.type()) {
            case REGISTERED -> log.info("[device] registered with hub as '{}'", message.deviceName());
            case TASK -> submitTask(message.messageId(), message.content());
            case PING -> send(BridgeMessage.pong());
            case RESET -> taskExecutor.execute(() -> {
                agent.reset();
                send(BridgeMessage.log("Agent state reset"));
            });
            case DEVICES, DEVICE_LOG -> log.trace("[device] ignoring viewer frame {}", message.type().wireName());
            default -> log.warn("[device] unexpected '{}' frame", message.type().wireName());
        }
    }

    void onClose(CloseStatus status) {
        session = null;
        log.info("[device] disconnected from hub: {}", status);
        abortCurrentRun();
        scheduleReconnect();
    }

    private void submitTask(String messageId, String content) {
        log.info("[device] task {} received", messageId);
        taskExecutor.execute(() -> {
            AbortSignal abort = new AbortSignal();
            currentRun = abort;
            AgentRunListener relay = new AgentRunListener() {
                @Override public void onLog(String line) { send(BridgeMessage.log(line)); }
            };
            try {
                String text = agent.runTask(content, relay, abort);
                send(BridgeMessage.response(messageId, text));
            } finally {
                currentRun = null;
            }
        });
    }

    private void abortCurrentRun() {
        AbortSignal run = currentRun;
        if (run != null) {
            log.info("[device] aborting running task");
            run.abort();
        }
    }

    private void scheduleReconnect() {
        if (!running) return;
        log.info("[device] reconnecting in {}s", properties.getReconnectDelay().toSeconds());
        scheduler.schedule(this::connect, Instant.now().plus(properties.getReconnectDelay()));
    }

    void send(BridgeMessage message) {
        WebSocketSession s = session;
        if (s == null || !s.isOpen()) {
            log.debug("[device] not connected, dropping '{}' frame", message.type().wireName());
            return;
        }
        try {
            s.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException | IllegalStateException e) {
            log.warn("[device] send '{}' failed: {}", message.type().wireName(), e.getMessage());
        }
    }

    private class Handler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession s) {
            onOpen(s);
        }

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) {
            onFrame(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession s, Throwable exception) {
            log.warn("[device] transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
            onClose(status);
        }
    }
}
