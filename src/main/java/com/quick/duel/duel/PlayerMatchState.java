package com.quick.duel.duel;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerMatchState {
    private int playerId;
    private Hand hand;
    private Card chosenCard;                 // скрытый выбор текущего раунда
    private int health;
    private List<Card> pendingRewardChoice;  // null, пока не нужно выбирать награду

    public static PlayerMatchState fresh(int playerId, MatchRules rules) {
        return new PlayerMatchState(playerId, rules.startingHand().copy(), null, rules.startingHealth(), null);
    }

    public boolean hasPendingChoice() {
        return pendingRewardChoice != null;
    }

    public int cardCount() {
        return hand.total() + (chosenCard != null ? 1 : 0);
    }

    public OpponentView redacted() {
        return new OpponentView(cardCount(), health);
    }

    public PlayerMatchState copy() {
        return new PlayerMatchState(playerId, hand.copy(), chosenCard, health, pendingRewardChoice);
    }
}
