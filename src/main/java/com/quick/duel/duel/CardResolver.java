package com.quick.duel.duel;

import java.util.List;

/**
 * Таблица взаимодействия карт. Строка - своя карта, столбец - карта соперника.
 *
 * <pre>
 *            ATTACK  COUNTER  REST
 * ATTACK       -1      -1      0
 * COUNTER       0       0      0
 * REST         -1       0      0
 * </pre>
 */
public final class CardResolver {

    private static final Reward ATTACK_OR_COUNTER = new Reward.Choice(List.of(Card.ATTACK, Card.COUNTER));

    private CardResolver() {
    }

    public static CardResolution resolve(Card own, Card opponent) {
        return new CardResolution(healthDelta(own, opponent), rewards(own, opponent));
    }

    static int healthDelta(Card own, Card opponent) {
        return switch (own) {
            case ATTACK -> opponent == Card.REST ? 0 : -1;
            case COUNTER -> 0;
            case REST -> opponent == Card.ATTACK ? -1 : 0;
        };
    }

    static List<Reward> rewards(Card own, Card opponent) {
        return switch (own) {
            case ATTACK -> List.of();
            case COUNTER -> opponent == Card.ATTACK
                    ? List.of(new Reward.Fixed(Card.COUNTER))
                    : List.of();
            case REST -> switch (opponent) {
                case ATTACK -> List.of(new Reward.Fixed(Card.ATTACK), new Reward.Fixed(Card.REST));
                case COUNTER, REST -> List.of(ATTACK_OR_COUNTER, new Reward.Fixed(Card.REST));
            };
        };
    }
}
