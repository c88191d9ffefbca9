package com.quick.duel.duel;

public record Outbound(SessionRef target, OutgoingMessage message) {
}
