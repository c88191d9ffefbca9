package com.quick.duel.duel;

public class MessageUndecodableException extends DuelException {

    public MessageUndecodableException(String message, Throwable cause) {
        super(message, cause);
    }
}
