package com.quick.duel.duel;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StateStoreTest {

    private final StateStore store = new StateStore(
            new GameState(MatchRules.defaults(), new MessageCodec(new ObjectMapper()), false));

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldPublishConnectedToNewSession() {
        RecordingSession session = new RecordingSession("s1");

        join(store.create(session));

        assertEquals(List.of(new OutgoingMessage.Connected(1)), session.messages());
    }

    @Test
    void shouldApplyConcurrentRequestsOneAtATime() throws Exception {
        RecordingSession alice = new RecordingSession("alice");
        RecordingSession bob = new RecordingSession("bob");
        join(store.create(alice));
        join(store.create(bob));

        int senders = 8;
        int perSender = 50;
        ExecutorService pool = Executors.newFixedThreadPool(senders);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int s = 0; s < senders; s++) {
            int sender = s;
            pool.submit(() -> {
                for (int i = 0; i < perSender; i++) {
                    synchronized (futures) {
                        futures.add(store.receive(1, "{\"type\":\"chat\",\"to\":2,\"text\":\"" + sender + "-" + i + "\"}")
                                .toCompletableFuture());
                    }
                }
            });
        }
        pool.shutdown();
        pool.awaitTermination(10, TimeUnit.SECONDS);
        synchronized (futures) {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        }

        assertEquals(senders * perSender, bob.ofType(OutgoingMessage.Direct.class).size());
    }

    @Test
    void challengeFlowShouldRunThroughMailbox() {
        RecordingSession alice = new RecordingSession("alice");
        RecordingSession bob = new RecordingSession("bob");
        join(store.create(alice));
        join(store.create(bob));

        join(store.receive(1, "{\"type\":\"challenge_request\",\"target\":2}"));
        join(store.receive(2, "{\"type\":\"challenge_response\",\"challenger\":1,\"accepted\":true}"));

        List<PlayerSummary> players = join(store.players());
        assertEquals(List.of(
                new PlayerSummary(1, new GamePhase.InMatch(0)),
                new PlayerSummary(2, new GamePhase.InMatch(0))
        ), players);
        assertEquals(1, bob.ofType(OutgoingMessage.Challenge.class).size());
    }

    @Test
    void failingSessionShouldNotAffectOthers() {
        SessionRef broken = new SessionRef() {
            @Override
            public String sessionId() {
                return "broken";
            }

            @Override
            public void publish(OutgoingMessage message) {
                throw new IllegalStateException("transport gone");
            }
        };
        RecordingSession healthy = new RecordingSession("healthy");

        join(store.create(broken));
        join(store.create(healthy));
        join(store.receive(2, "{\"type\":\"chat\",\"to\":1,\"text\":\"ping\"}"));
        join(store.receive(1, "{\"type\":\"chat\",\"to\":2,\"text\":\"pong\"}"));

        assertEquals(List.of(new OutgoingMessage.Direct(1, "pong")), healthy.ofType(OutgoingMessage.Direct.class));
    }

    @Test
    void closedStoreShouldRejectNewEvents() {
        store.close();

        CompletableFuture<Void> future = store.create(new RecordingSession("late")).toCompletableFuture();

        assertThrows(CompletionException.class, future::join);
    }

    private static <T> T join(CompletionStage<T> stage) {
        return stage.toCompletableFuture().join();
    }
}
