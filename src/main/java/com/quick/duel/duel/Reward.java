package com.quick.duel.duel;

import java.util.List;

/**
 * Награда за раунд: либо конкретная карта, либо выбор из нескольких.
 */
public sealed interface Reward permits Reward.Fixed, Reward.Choice {

    record Fixed(Card card) implements Reward {
    }

    record Choice(List<Card> options) implements Reward {
        public Choice {
            options = List.copyOf(options);
            if (options.size() != 2) {
                throw new IllegalArgumentException("Choice must offer exactly 2 cards");
            }
        }
    }
}
