package com.quick.duel.duel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Фаза игрока в лобби: свободен / бросил вызов / в матче.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(GamePhase.Idle.class),
        @JsonSubTypes.Type(GamePhase.Challenging.class),
        @JsonSubTypes.Type(GamePhase.InMatch.class)
})
public sealed interface GamePhase permits GamePhase.Idle, GamePhase.Challenging, GamePhase.InMatch {

    GamePhase IDLE = new Idle();

    @JsonTypeName("idle")
    record Idle() implements GamePhase {
    }

    @JsonTypeName("challenging")
    record Challenging(int targetPlayerId) implements GamePhase {
    }

    @JsonTypeName("in_match")
    record InMatch(int matchId) implements GamePhase {
    }
}
