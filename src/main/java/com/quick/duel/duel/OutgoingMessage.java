package com.quick.duel.duel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Сообщения сервера клиенту.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(OutgoingMessage.Connected.class),
        @JsonSubTypes.Type(OutgoingMessage.Err.class),
        @JsonSubTypes.Type(OutgoingMessage.PhaseUpdate.class),
        @JsonSubTypes.Type(OutgoingMessage.Direct.class),
        @JsonSubTypes.Type(OutgoingMessage.Challenge.class),
        @JsonSubTypes.Type(OutgoingMessage.ChallengeAccepted.class),
        @JsonSubTypes.Type(OutgoingMessage.RoundUpdate.class)
})
public sealed interface OutgoingMessage permits
        OutgoingMessage.Connected,
        OutgoingMessage.Err,
        OutgoingMessage.PhaseUpdate,
        OutgoingMessage.Direct,
        OutgoingMessage.Challenge,
        OutgoingMessage.ChallengeAccepted,
        OutgoingMessage.RoundUpdate {

    /** Сервер выдал игроку id. Первое сообщение в каждой сессии. */
    @JsonTypeName("connected")
    record Connected(int id) implements OutgoingMessage {
    }

    @JsonTypeName("error")
    record Err(String message) implements OutgoingMessage {
    }

    @JsonTypeName("phase_update")
    record PhaseUpdate(GamePhase phase) implements OutgoingMessage {
    }

    @JsonTypeName("direct")
    record Direct(int from, String text) implements OutgoingMessage {
    }

    /** Игрок from бросил вызов получателю. */
    @JsonTypeName("challenge")
    record Challenge(int from) implements OutgoingMessage {
    }

    @JsonTypeName("challenge_accepted")
    record ChallengeAccepted() implements OutgoingMessage {
    }

    @JsonTypeName("round_result")
    record RoundUpdate(RoundResult result) implements OutgoingMessage {
    }
}
