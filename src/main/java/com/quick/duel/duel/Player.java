package com.quick.duel.duel;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Player {
    private final int id;
    private final SessionRef session;
    private GamePhase phase;
}
