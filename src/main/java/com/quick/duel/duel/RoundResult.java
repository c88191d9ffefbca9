package com.quick.duel.duel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(RoundResult.MatchEnded.class),
        @JsonSubTypes.Type(RoundResult.NextRound.class)
})
public sealed interface RoundResult permits RoundResult.MatchEnded, RoundResult.NextRound {

    @JsonTypeName("match_ended")
    record MatchEnded(EndState endState) implements RoundResult {
    }

    @JsonTypeName("next_round")
    record NextRound(PlayerMatchState own, OpponentView opponent) implements RoundResult {
    }
}
