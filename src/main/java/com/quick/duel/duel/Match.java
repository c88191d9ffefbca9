package com.quick.duel.duel;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Матч двух игроков. Раунд разрешается одновременно, когда оба выбрали карту.
 * Все проверки выполняются до изменения состояния: при ошибке матч остаётся как был.
 */
@Getter
public class Match {

    private static final Logger log = LoggerFactory.getLogger(Match.class);

    private final int id;
    private final List<Integer> playerIds;
    private MatchState state;
    private int round = 1;

    public Match(int id, int firstPlayerId, int secondPlayerId, MatchRules rules) {
        if (firstPlayerId == secondPlayerId) {
            throw new IllegalArgumentException("A match needs two distinct players");
        }
        this.id = id;
        this.playerIds = List.of(firstPlayerId, secondPlayerId);
        this.state = new MatchState.ResolvingRound(List.of(
                PlayerMatchState.fresh(firstPlayerId, rules),
                PlayerMatchState.fresh(secondPlayerId, rules)
        ));
    }

    public boolean isFinished() {
        return state instanceof MatchState.Finished;
    }

    public boolean hasParticipant(int playerId) {
        return playerIds.contains(playerId);
    }

    public int opponentOf(int playerId) {
        if (!hasParticipant(playerId)) {
            throw new InvalidRequestException("Player " + playerId + " is not part of match " + id);
        }
        return playerIds.get(0) == playerId ? playerIds.get(1) : playerIds.get(0);
    }

    /**
     * Игрок выбирает карту на текущий раунд. Уже выбранная карта сначала возвращается в руку.
     *
     * @return true, если этот выбор завершил раунд
     */
    public boolean playCard(int playerId, Card card) {
        if (card == null) throw new InvalidRequestException("Card is required");
        MatchState.ResolvingRound current = requireResolving();
        PlayerMatchState self = requireParticipant(current, playerId);
        if (self.hasPendingChoice()) {
            throw new InvalidRequestException("Pick a reward from " + self.getPendingRewardChoice() + " first");
        }

        Card previous = self.getChosenCard();
        int available = self.getHand().count(card) + (previous == card ? 1 : 0);
        if (available == 0) {
            throw new InvalidRequestException("No " + card + " left in hand");
        }

        if (previous != null) {
            self.getHand().add(previous);
        }
        self.getHand().take(card);
        self.setChosenCard(card);

        PlayerMatchState opponent = otherThan(current, playerId);
        if (opponent.getChosenCard() == null) {
            return false;
        }
        resolveRound(current);
        return true;
    }

    /**
     * Игрок забирает одну из предложенных наград.
     */
    public void pickCard(int playerId, Card choice) {
        if (choice == null) throw new InvalidRequestException("Card is required");
        MatchState.ResolvingRound current = requireResolving();
        PlayerMatchState self = requireParticipant(current, playerId);
        List<Card> offered = self.getPendingRewardChoice();
        if (offered == null) {
            throw new InvalidRequestException("No reward choice pending");
        }
        if (!offered.contains(choice)) {
            throw new InvalidRequestException(choice + " is not among the offered rewards " + offered);
        }
        self.setPendingRewardChoice(null);
        self.getHand().add(choice);
    }

    /**
     * Уход игрока: победа достаётся сопернику. Для завершённого матча ничего не меняет.
     */
    public void forfeit(int leavingPlayerId) {
        int winner = opponentOf(leavingPlayerId);
        if (isFinished()) {
            return;
        }
        state = new MatchState.Finished(playerIds, new EndState.Victory(winner));
        log.info("match-forfeit matchId={} leaver={} winner={}", id, leavingPlayerId, winner);
    }

    /**
     * Результат для каждого участника в порядке {@link #getPlayerIds()}.
     */
    public Map<Integer, RoundResult> roundResults() {
        Map<Integer, RoundResult> results = new LinkedHashMap<>();
        if (state instanceof MatchState.Finished finished) {
            for (Integer playerId : playerIds) {
                results.put(playerId, new RoundResult.MatchEnded(finished.endState()));
            }
            return results;
        }
        MatchState.ResolvingRound current = (MatchState.ResolvingRound) state;
        for (PlayerMatchState player : current.players()) {
            PlayerMatchState opponent = otherThan(current, player.getPlayerId());
            results.put(player.getPlayerId(), new RoundResult.NextRound(player.copy(), opponent.redacted()));
        }
        return results;
    }

    public PlayerMatchState stateOf(int playerId) {
        return requireParticipant(requireResolving(), playerId).copy();
    }

    private void resolveRound(MatchState.ResolvingRound current) {
        PlayerMatchState first = current.players().get(0);
        PlayerMatchState second = current.players().get(1);
        Card firstCard = first.getChosenCard();
        Card secondCard = second.getChosenCard();

        apply(first, CardResolver.resolve(firstCard, secondCard));
        apply(second, CardResolver.resolve(secondCard, firstCard));

        log.debug("round-resolved matchId={} round={} {}={} hp={} {}={} hp={}",
                id, round,
                first.getPlayerId(), firstCard, first.getHealth(),
                second.getPlayerId(), secondCard, second.getHealth());
        round++;

        boolean firstDown = first.getHealth() == 0;
        boolean secondDown = second.getHealth() == 0;
        if (firstDown && secondDown) {
            state = new MatchState.Finished(playerIds, new EndState.Draw());
        } else if (firstDown) {
            state = new MatchState.Finished(playerIds, new EndState.Victory(second.getPlayerId()));
        } else if (secondDown) {
            state = new MatchState.Finished(playerIds, new EndState.Victory(first.getPlayerId()));
        }
    }

    private static void apply(PlayerMatchState player, CardResolution resolution) {
        player.setChosenCard(null);
        player.setHealth(Math.max(0, player.getHealth() + resolution.healthDelta()));
        for (Reward reward : resolution.rewards()) {
            if (reward instanceof Reward.Fixed fixed) {
                player.getHand().add(fixed.card());
            } else if (reward instanceof Reward.Choice choice) {
                player.setPendingRewardChoice(choice.options());
            }
        }
    }

    private MatchState.ResolvingRound requireResolving() {
        if (state instanceof MatchState.ResolvingRound current) {
            return current;
        }
        throw new InvalidRequestException("Match " + id + " has already concluded");
    }

    private PlayerMatchState requireParticipant(MatchState.ResolvingRound current, int playerId) {
        return current.players().stream()
                .filter(p -> p.getPlayerId() == playerId)
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Player " + playerId + " is not part of match " + id));
    }

    private static PlayerMatchState otherThan(MatchState.ResolvingRound current, int playerId) {
        PlayerMatchState first = current.players().get(0);
        return first.getPlayerId() == playerId ? current.players().get(1) : first;
    }
}
