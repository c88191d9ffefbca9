package com.quick.duel.duel;

import java.util.List;

public record CardResolution(int healthDelta, List<Reward> rewards) {
    public CardResolution {
        rewards = List.copyOf(rewards);
    }
}
