package com.quick.duel.duel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Подключённые игроки и их фазы. Не потокобезопасен: живёт внутри {@link GameState}.
 */
public class PlayerRegistry {

    private final Map<Integer, Player> players = new TreeMap<>();
    private int nextId = 1;

    public Player register(SessionRef session) {
        Player player = new Player(nextId++, session, GamePhase.IDLE);
        players.put(player.getId(), player);
        return player;
    }

    public Optional<Player> remove(int playerId) {
        return Optional.ofNullable(players.remove(playerId));
    }

    public Optional<Player> find(int playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    public Player require(int playerId) {
        return find(playerId).orElseThrow(() -> new IdNotFoundException("Player", playerId));
    }

    public List<Player> all() {
        return new ArrayList<>(players.values());
    }

    public List<Player> challengersOf(int targetId) {
        GamePhase challenging = new GamePhase.Challenging(targetId);
        return players.values().stream()
                .filter(p -> challenging.equals(p.getPhase()))
                .toList();
    }

    /**
     * Idle -> Challenging(target). Фаза цели не меняется до её ответа.
     *
     * @return игрок, которому брошен вызов
     */
    public Player challenge(int challengerId, int targetId) {
        Player challenger = require(challengerId);
        if (!(challenger.getPhase() instanceof GamePhase.Idle)) {
            throw new InvalidRequestException("Cannot challenge while " + describe(challenger.getPhase()));
        }
        if (challengerId == targetId) {
            throw new InvalidRequestException("Cannot challenge yourself");
        }
        Player target = require(targetId);
        challenger.setPhase(new GamePhase.Challenging(targetId));
        return target;
    }

    /**
     * Проверяет, что challengerId действительно бросил вызов responderId. Ничего не меняет.
     */
    public Player requireChallenger(int responderId, int challengerId) {
        Player challenger = require(challengerId);
        if (!new GamePhase.Challenging(responderId).equals(challenger.getPhase())) {
            throw new InvalidRequestException("Player " + challengerId + " has not challenged you");
        }
        return challenger;
    }

    static String describe(GamePhase phase) {
        if (phase instanceof GamePhase.Challenging challenging) {
            return "challenging player " + challenging.targetPlayerId();
        }
        if (phase instanceof GamePhase.InMatch inMatch) {
            return "in match " + inMatch.matchId();
        }
        return "idle";
    }
}
