package com.quick.duel.duel;

import java.util.List;

public sealed interface MatchState permits MatchState.ResolvingRound, MatchState.Finished {

    record ResolvingRound(List<PlayerMatchState> players) implements MatchState {
        public ResolvingRound {
            players = List.copyOf(players);
            if (players.size() != 2) {
                throw new IllegalArgumentException("A round needs exactly 2 players");
            }
        }
    }

    record Finished(List<Integer> playerIds, EndState endState) implements MatchState {
        public Finished {
            playerIds = List.copyOf(playerIds);
        }
    }
}
