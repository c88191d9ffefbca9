package com.quick.duel.duel;

import lombok.Getter;

@Getter
public class IdNotFoundException extends DuelException {

    private final int id;

    public IdNotFoundException(String kind, int id) {
        super(kind + " " + id + " not found");
        this.id = id;
    }
}
