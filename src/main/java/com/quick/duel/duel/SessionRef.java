package com.quick.duel.duel;

/**
 * Куда хранилище отправляет исходящие сообщения. Реализация сама кодирует и пишет в транспорт.
 */
public interface SessionRef {

    String sessionId();

    void publish(OutgoingMessage message);
}
