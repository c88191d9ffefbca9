package com.quick.duel.duel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Сообщения от клиента. Клиент шлёт JSON с полем type, например {"type":"play_card","card":"ATTACK"}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(IncomingMessage.Chat.class),
        @JsonSubTypes.Type(IncomingMessage.ChallengeRequest.class),
        @JsonSubTypes.Type(IncomingMessage.ChallengeResponse.class),
        @JsonSubTypes.Type(IncomingMessage.PlayCard.class),
        @JsonSubTypes.Type(IncomingMessage.PickCard.class)
})
public sealed interface IncomingMessage permits
        IncomingMessage.Chat,
        IncomingMessage.ChallengeRequest,
        IncomingMessage.ChallengeResponse,
        IncomingMessage.PlayCard,
        IncomingMessage.PickCard {

    @JsonTypeName("chat")
    record Chat(@JsonProperty(value = "to", required = true) int to,
                @JsonProperty("text") String text) implements IncomingMessage {
    }

    @JsonTypeName("challenge_request")
    record ChallengeRequest(@JsonProperty(value = "target", required = true) int target) implements IncomingMessage {
    }

    @JsonTypeName("challenge_response")
    record ChallengeResponse(@JsonProperty(value = "challenger", required = true) int challenger,
                             @JsonProperty(value = "accepted", required = true) boolean accepted) implements IncomingMessage {
    }

    @JsonTypeName("play_card")
    record PlayCard(@JsonProperty(value = "card", required = true) Card card) implements IncomingMessage {
    }

    @JsonTypeName("pick_card")
    record PickCard(@JsonProperty(value = "card", required = true) Card card) implements IncomingMessage {
    }
}
