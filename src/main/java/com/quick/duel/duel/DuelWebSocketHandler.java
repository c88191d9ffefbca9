package com.quick.duel.duel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Клиент подключается к ws://host:8080/ws и шлёт JSON-сообщения текстовыми фреймами.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuelWebSocketHandler extends TextWebSocketHandler {

    private final StateStore store;
    private final MessageCodec codec;
    private final DuelProperties properties;
    private final Map<String, PlayerSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        DuelProperties.Ws ws = properties.getWs();
        WebSocketSession transport = new ConcurrentWebSocketSessionDecorator(
                session, ws.getSendTimeLimitMs(), ws.getBufferSizeLimit());
        PlayerSession playerSession = new PlayerSession(transport, codec, store);
        sessions.put(session.getId(), playerSession);
        playerSession.start();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PlayerSession playerSession = sessions.get(session.getId());
        if (playerSession == null) {
            log.warn("payload-dropped session={} reason=unknown-session", session.getId());
            return;
        }
        playerSession.onText(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("transport-error session={}", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PlayerSession playerSession = sessions.remove(session.getId());
        if (playerSession != null) {
            playerSession.onClose();
        }
    }

    int openSessions() {
        return sessions.size();
    }
}
