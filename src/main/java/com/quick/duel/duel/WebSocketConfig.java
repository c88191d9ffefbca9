package com.quick.duel.duel;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DuelWebSocketHandler handler;
    private final DuelProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        DuelProperties.Ws ws = properties.getWs();
        registry.addHandler(handler, ws.getPath())
                .setAllowedOriginPatterns(ws.getAllowedOrigins().toArray(new String[0]));
    }
}
