package com.quick.duel.duel;

public record PlayerSummary(int id, GamePhase phase) {
}
