package com.quick.duel.duel;

public enum Card {
    ATTACK,
    COUNTER,
    REST
}
