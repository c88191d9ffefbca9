package com.quick.duel.duel;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Hand {
    private int attacks;
    private int counters;
    private int rests;

    public int count(Card card) {
        return switch (card) {
            case ATTACK -> attacks;
            case COUNTER -> counters;
            case REST -> rests;
        };
    }

    public void add(Card card) {
        switch (card) {
            case ATTACK -> attacks++;
            case COUNTER -> counters++;
            case REST -> rests++;
        }
    }

    /**
     * Убирает одну карту из руки. Вызывающий обязан проверить {@link #count(Card)} заранее.
     */
    public void take(Card card) {
        if (count(card) <= 0) {
            throw new IllegalStateException("No " + card + " left in hand");
        }
        switch (card) {
            case ATTACK -> attacks--;
            case COUNTER -> counters--;
            case REST -> rests--;
        }
    }

    public int total() {
        return attacks + counters + rests;
    }

    public Hand copy() {
        return new Hand(attacks, counters, rests);
    }
}
