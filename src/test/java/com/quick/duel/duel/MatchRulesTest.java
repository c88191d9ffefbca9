package com.quick.duel.duel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatchRulesTest {

    @ParameterizedTest
    @CsvSource({
            "0, 2, 1, 1",
            "6, 2, 1, 1",
            "5, -1, 1, 1",
            "5, 2, -1, 1",
            "5, 2, 1, -1"
    })
    void shouldRejectOutOfRangeRules(int health, int attacks, int counters, int rests) {
        Hand hand = new Hand(attacks, counters, rests);
        assertThrows(IllegalArgumentException.class, () -> new MatchRules(health, hand));
    }

    @Test
    void shouldAcceptBoundaryRules() {
        MatchRules rules = new MatchRules(MatchRules.MAX_HEALTH, new Hand(0, 0, 0));

        assertEquals(new Hand(0, 0, 0), rules.startingHand());
    }

    @Test
    void takeShouldRefuseNegativeCount() {
        Hand hand = new Hand(-1, 0, 0);

        assertThrows(IllegalStateException.class, () -> hand.take(Card.ATTACK));
        assertEquals(-1, hand.getAttacks());
    }
}
