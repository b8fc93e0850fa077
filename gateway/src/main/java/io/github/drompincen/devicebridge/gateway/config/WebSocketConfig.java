package io.github.drompincen.devicebridge.gateway.config;

import io.github.drompincen.devicebridge.gateway.websocket.BridgeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String BRIDGE_PATH = "/ws/bridge";

    private final BridgeWebSocketHandler handler;

    public WebSocketConfig(BridgeWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, BRIDGE_PATH).setAllowedOrigins("*");
    }
}
