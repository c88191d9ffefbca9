package com.quick.duel.duel;

/**
 * То, что можно показать сопернику: ни состава руки, ни выбранной карты.
 */
public record OpponentView(int cardCount, int health) {
}
