package com.quick.duel.duel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Optional;

/**
 * Одна сессия на одно WebSocket-соединение. Пересылает входящий текст в {@link StateStore}
 * и пишет в транспорт то, что хранилище публикует для этой сессии.
 * Состояния: Initializing -> Active(playerId) -> Closed.
 */
public class PlayerSession implements SessionRef {

    private static final Logger log = LoggerFactory.getLogger(PlayerSession.class);

    public sealed interface State permits Initializing, Active, Closed {
    }

    public record Initializing() implements State {
    }

    public record Active(int playerId) implements State {
    }

    public record Closed() implements State {
    }

    private final WebSocketSession transport;
    private final MessageCodec codec;
    private final StateStore store;
    private State state = new Initializing();

    public PlayerSession(WebSocketSession transport, MessageCodec codec, StateStore store) {
        this.transport = transport;
        this.codec = codec;
        this.store = store;
    }

    public void start() {
        store.create(this);
    }

    public void onText(String payload) {
        State current = state();
        if (current instanceof Active active) {
            store.receive(active.playerId(), payload);
        } else {
            log.warn("payload-dropped session={} state={}", sessionId(), current);
        }
    }

    public void onClose() {
        State previous;
        synchronized (this) {
            previous = state;
            state = new Closed();
        }
        if (previous instanceof Active active) {
            store.delete(active.playerId());
        }
    }

    @Override
    public String sessionId() {
        return transport.getId();
    }

    @Override
    public void publish(OutgoingMessage message) {
        if (message instanceof OutgoingMessage.Connected connected && !activate(connected.id())) {
            // соединение закрылось раньше, чем пришёл id
            store.delete(connected.id());
            return;
        }
        send(message);
    }

    public synchronized State state() {
        return state;
    }

    public Optional<Integer> playerId() {
        return state() instanceof Active active ? Optional.of(active.playerId()) : Optional.empty();
    }

    private synchronized boolean activate(int playerId) {
        if (state instanceof Closed) {
            return false;
        }
        state = new Active(playerId);
        return true;
    }

    private void send(OutgoingMessage message) {
        if (!transport.isOpen()) {
            log.debug("send-skipped session={} reason=closed", sessionId());
            return;
        }
        try {
            transport.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException e) {
            log.warn("send-failed session={} type={}", sessionId(), message.getClass().getSimpleName(), e);
        }
    }
}
