package com.quick.duel.duel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(EndState.Draw.class),
        @JsonSubTypes.Type(EndState.Victory.class)
})
public sealed interface EndState permits EndState.Draw, EndState.Victory {

    @JsonTypeName("draw")
    record Draw() implements EndState {
    }

    @JsonTypeName("victory")
    record Victory(int winnerId) implements EndState {
    }
}
