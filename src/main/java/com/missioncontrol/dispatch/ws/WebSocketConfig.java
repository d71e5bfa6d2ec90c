package com.missioncontrol.dispatch.ws;

import com.missioncontrol.core.config.RealtimeProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the subscription transport. Only present when the servlet container runs ({@code serve}).
 */
@Configuration
@EnableWebSocket
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class WebSocketConfig implements WebSocketConfigurer {

    private final TaskSocketHandler handler;
    private final RealtimeProperties properties;

    public WebSocketConfig(TaskSocketHandler handler, RealtimeProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getSocketPath())
                .setAllowedOriginPatterns(properties.getAllowedOrigins());
    }
}
