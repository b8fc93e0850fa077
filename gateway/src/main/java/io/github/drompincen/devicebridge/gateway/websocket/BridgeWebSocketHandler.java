package io.github.drompincen.devicebridge.gateway.websocket;

import io.github.drompincen.devicebridge.gateway.hub.DeviceHubRegistry;
import io.github.drompincen.devicebridge.protocol.ws.BridgeCodec;
import io.github.drompincen.devicebridge.protocol.ws.BridgeMessage;
import io.github.drompincen.devicebridge.protocol.ws.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Bridge endpoint shared by devices and viewers. A connection becomes a device by sending
 * {@code register} and a viewer by sending {@code subscribe}; frames are handed to the hub of
 * the user the connection was opened for.
 */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(BridgeWebSocketHandler.class);

    public static final String USER_HEADER = "X-User-Id";
    public static final String USER_QUERY_PARAM = "user";
    public static final String DEFAULT_USER = "default";

    static final String CONNECTION_ATTR = "bridge.connectionId";
    static final String USER_ATTR = "bridge.userId";

    private final DeviceHubRegistry registry;
    private final BridgeCodec codec;

    public BridgeWebSocketHandler(DeviceHubRegistry registry, BridgeCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String userId = resolveUser(session);
        WebSocketHubConnection connection = new WebSocketHubConnection(session);
        session.getAttributes().put(CONNECTION_ATTR, connection.id());
        session.getAttributes().put(USER_ATTR, userId);
        registry.withHub(userId, hub -> hub.connect(connection));
        log.debug("[ws] {} connected as {} for user {}", session.getRemoteAddress(), connection.id(), userId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = (String) session.getAttributes().get(CONNECTION_ATTR);
        String userId = (String) session.getAttributes().get(USER_ATTR);
        if (connectionId == null || userId == null) {
            log.warn("[ws] frame on unknown session {}", session.getId());
            return;
        }

        BridgeMessage frame;
        try {
            frame = codec.decode(message.getPayload());
        } catch (ProtocolException e) {
            log.warn("[ws] dropping frame from {}: {}", connectionId, e.getMessage());
            return;
        }

        switch (frame.type()) {
            case REGISTER -> registry.withHub(userId, hub -> hub.register(connectionId, frame.deviceName()));
            case SUBSCRIBE -> registry.withHub(userId, hub -> hub.subscribe(connectionId));
            case LOG -> registry.withHub(userId, hub -> hub.relayLog(connectionId, frame.message()));
            case RESPONSE -> registry.withHub(userId, hub -> hub.onResponse(frame.messageId(), frame.content()));
            case PONG -> log.trace("[ws] pong from {}", connectionId);
            default -> log.warn("[ws] unexpected '{}' frame from {}", frame.type().wireName(), connectionId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[ws] transport error on {}: {}", session.getAttributes().get(CONNECTION_ATTR), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = (String) session.getAttributes().get(CONNECTION_ATTR);
        String userId = (String) session.getAttributes().get(USER_ATTR);
        if (connectionId == null || userId == null) return;
        log.debug("[ws] {} closed: {}", connectionId, status);
        registry.withHub(userId, hub -> hub.onDisconnect(connectionId));
    }

    static String resolveUser(WebSocketSession session) {
        String header = session.getHandshakeHeaders().getFirst(USER_HEADER);
        if (header != null && !header.isBlank()) return header.trim();
        URI uri = session.getUri();
        if (uri != null) {
            String param = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(USER_QUERY_PARAM);
            if (param != null && !param.isBlank()) return param.trim();
        }
        return DEFAULT_USER;
    }
}
