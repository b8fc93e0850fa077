package io.github.drompincen.devicebridge.gateway.websocket;

import io.github.drompincen.devicebridge.gateway.hub.HubConnection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.UUID;

/** A WebSocket session as the hub sees it, identified by a generated UUID. */
class WebSocketHubConnection implements HubConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final String id;
    private final WebSocketSession session;

    WebSocketHubConnection(WebSocketSession session) {
        this(UUID.randomUUID().toString(), session);
    }

    WebSocketHubConnection(String id, WebSocketSession session) {
        this.id = id;
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }
}
