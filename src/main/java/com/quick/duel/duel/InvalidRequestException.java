package com.quick.duel.duel;

public class InvalidRequestException extends DuelException {

    public InvalidRequestException(String reason) {
        super(reason);
    }
}
