package com.quick.duel.duel;

/**
 * Базовая ошибка правил игры. Никогда не фатальна: сообщение уходит только отправителю запроса.
 */
public class DuelException extends RuntimeException {

    public DuelException(String message) {
        super(message);
    }

    public DuelException(String message, Throwable cause) {
        super(message, cause);
    }
}
