package com.quick.duel.duel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Единственный владелец игроков и матчей. Вызывается только из почтового ящика {@link StateStore},
 * поэтому без блокировок. Каждый метод возвращает сообщения, которые нужно разослать.
 */
public class GameState {

    private static final Logger log = LoggerFactory.getLogger(GameState.class);

    private final PlayerRegistry registry = new PlayerRegistry();
    private final Map<Integer, Match> matches = new HashMap<>();
    private final MatchRules rules;
    private final MessageCodec codec;
    private final boolean forfeitOnDisconnect;

    public GameState(MatchRules rules, MessageCodec codec, boolean forfeitOnDisconnect) {
        this.rules = rules;
        this.codec = codec;
        this.forfeitOnDisconnect = forfeitOnDisconnect;
    }

    public List<Outbound> create(SessionRef session) {
        Player player = registry.register(session);
        log.info("player-connected playerId={} session={}", player.getId(), session.sessionId());
        return List.of(new Outbound(session, new OutgoingMessage.Connected(player.getId())));
    }

    public List<Outbound> delete(int playerId) {
        Optional<Player> removed = registry.remove(playerId);
        if (removed.isEmpty()) {
            log.warn("player-delete-ignored playerId={} reason=unknown", playerId);
            return List.of();
        }
        Player player = removed.get();
        log.info("player-disconnected playerId={} phase={}", playerId, player.getPhase());
        if (!forfeitOnDisconnect) {
            return List.of();
        }

        List<Outbound> out = new ArrayList<>();
        if (player.getPhase() instanceof GamePhase.InMatch inMatch) {
            Match match = matches.get(inMatch.matchId());
            if (match != null && !match.isFinished()) {
                match.forfeit(playerId);
                finish(match, out);
            }
        }
        for (Player challenger : registry.challengersOf(playerId)) {
            challenger.setPhase(GamePhase.IDLE);
            out.add(new Outbound(challenger.getSession(), new OutgoingMessage.PhaseUpdate(GamePhase.IDLE)));
        }
        return out;
    }

    public List<Outbound> receive(int playerId, String payload) {
        Optional<Player> sender = registry.find(playerId);
        if (sender.isEmpty()) {
            log.warn("payload-dropped playerId={} reason=unknown-player", playerId);
            return List.of();
        }
        Player player = sender.get();
        List<Outbound> out = new ArrayList<>();
        try {
            handle(player, codec.decode(payload), out);
        } catch (DuelException e) {
            log.debug("request-rejected playerId={} reason={}", playerId, e.getMessage());
            return List.of(new Outbound(player.getSession(), new OutgoingMessage.Err(e.getMessage())));
        }
        return out;
    }

    public List<PlayerSummary> players() {
        return registry.all().stream()
                .map(p -> new PlayerSummary(p.getId(), p.getPhase()))
                .toList();
    }

    public Optional<Player> player(int playerId) {
        return registry.find(playerId);
    }

    public Optional<Match> match(int matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    private void handle(Player player, IncomingMessage message, List<Outbound> out) {
        if (message instanceof IncomingMessage.Chat chat) {
            onChat(player, chat, out);
        } else if (message instanceof IncomingMessage.ChallengeRequest request) {
            onChallengeRequest(player, request, out);
        } else if (message instanceof IncomingMessage.ChallengeResponse response) {
            onChallengeResponse(player, response, out);
        } else if (message instanceof IncomingMessage.PlayCard play) {
            onPlayCard(player, play, out);
        } else if (message instanceof IncomingMessage.PickCard pick) {
            onPickCard(player, pick, out);
        } else {
            throw new IllegalStateException("Unhandled message " + message);
        }
    }

    private void onChat(Player player, IncomingMessage.Chat chat, List<Outbound> out) {
        if (chat.text() == null) throw new InvalidRequestException("Text is required");
        Player target = registry.require(chat.to());
        out.add(new Outbound(target.getSession(), new OutgoingMessage.Direct(player.getId(), chat.text())));
    }

    private void onChallengeRequest(Player player, IncomingMessage.ChallengeRequest request, List<Outbound> out) {
        Player target = registry.challenge(player.getId(), request.target());
        log.info("challenge-sent from={} to={}", player.getId(), target.getId());
        out.add(new Outbound(player.getSession(), new OutgoingMessage.PhaseUpdate(player.getPhase())));
        out.add(new Outbound(target.getSession(), new OutgoingMessage.Challenge(player.getId())));
    }

    private void onChallengeResponse(Player responder, IncomingMessage.ChallengeResponse response, List<Outbound> out) {
        Player challenger = registry.requireChallenger(responder.getId(), response.challenger());

        if (!response.accepted()) {
            challenger.setPhase(GamePhase.IDLE);
            log.info("challenge-rejected from={} by={}", challenger.getId(), responder.getId());
            out.add(new Outbound(challenger.getSession(), new OutgoingMessage.PhaseUpdate(GamePhase.IDLE)));
            return;
        }

        if (responder.getPhase() instanceof GamePhase.InMatch) {
            throw new InvalidRequestException("Cannot accept while " + PlayerRegistry.describe(responder.getPhase()));
        }

        Match match = new Match(matches.size(), challenger.getId(), responder.getId(), rules);
        matches.put(match.getId(), match);
        GamePhase inMatch = new GamePhase.InMatch(match.getId());
        challenger.setPhase(inMatch);
        responder.setPhase(inMatch);
        log.info("match-created matchId={} players={}", match.getId(), match.getPlayerIds());

        out.add(new Outbound(challenger.getSession(), new OutgoingMessage.ChallengeAccepted()));
        out.add(new Outbound(challenger.getSession(), new OutgoingMessage.PhaseUpdate(inMatch)));
        out.add(new Outbound(responder.getSession(), new OutgoingMessage.PhaseUpdate(inMatch)));
        notifyParticipants(match, out);
    }

    private void onPlayCard(Player player, IncomingMessage.PlayCard play, List<Outbound> out) {
        Match match = requireOpponentPresent(player);
        boolean resolved = match.playCard(player.getId(), play.card());
        if (match.isFinished()) {
            finish(match, out);
        } else if (resolved) {
            notifyParticipants(match, out);
        } else {
            notifyPlayer(match, player, out);
        }
    }

    private void onPickCard(Player player, IncomingMessage.PickCard pick, List<Outbound> out) {
        Match match = requireOpponentPresent(player);
        match.pickCard(player.getId(), pick.card());
        notifyPlayer(match, player, out);
    }

    private Match requireMatch(Player player) {
        if (!(player.getPhase() instanceof GamePhase.InMatch inMatch)) {
            throw new InvalidRequestException("Not in a match");
        }
        Match match = matches.get(inMatch.matchId());
        if (match == null) {
            throw new IdNotFoundException("Match", inMatch.matchId());
        }
        return match;
    }

    /**
     * Матч, в котором соперник ещё подключён. Ушедший соперник делает матч недоступным для ходов.
     */
    private Match requireOpponentPresent(Player player) {
        Match match = requireMatch(player);
        registry.require(match.opponentOf(player.getId()));
        return match;
    }

    /**
     * Рассылает итог матча и возвращает оставшихся участников в лобби.
     */
    private void finish(Match match, List<Outbound> out) {
        MatchState.Finished finished = (MatchState.Finished) match.getState();
        log.info("match-finished matchId={} result={}", match.getId(), finished.endState());
        match.roundResults().forEach((playerId, result) -> registry.find(playerId).ifPresent(p -> {
            p.setPhase(GamePhase.IDLE);
            out.add(new Outbound(p.getSession(), new OutgoingMessage.RoundUpdate(result)));
            out.add(new Outbound(p.getSession(), new OutgoingMessage.PhaseUpdate(GamePhase.IDLE)));
        }));
    }

    private void notifyParticipants(Match match, List<Outbound> out) {
        match.roundResults().forEach((playerId, result) -> registry.find(playerId).ifPresent(p ->
                out.add(new Outbound(p.getSession(), new OutgoingMessage.RoundUpdate(result)))));
    }

    private void notifyPlayer(Match match, Player player, List<Outbound> out) {
        RoundResult result = match.roundResults().get(player.getId());
        out.add(new Outbound(player.getSession(), new OutgoingMessage.RoundUpdate(result)));
    }
}
