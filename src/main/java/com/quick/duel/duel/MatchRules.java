package com.quick.duel.duel;

/**
 * Стартовые условия матча.
 */
public record MatchRules(int startingHealth, Hand startingHand) {

    public static final int MAX_HEALTH = 5;

    public static MatchRules defaults() {
        return new MatchRules(MAX_HEALTH, new Hand(2, 1, 1));
    }

    public MatchRules {
        if (startingHealth <= 0 || startingHealth > MAX_HEALTH) {
            throw new IllegalArgumentException("startingHealth must be within 1.." + MAX_HEALTH);
        }
        if (startingHand.getAttacks() < 0 || startingHand.getCounters() < 0 || startingHand.getRests() < 0) {
            throw new IllegalArgumentException("startingHand must not hold negative counts: " + startingHand);
        }
        startingHand = startingHand.copy();
    }

    @Override
    public Hand startingHand() {
        return startingHand.copy();
    }
}
