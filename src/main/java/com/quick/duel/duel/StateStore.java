package com.quick.duel.duel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Почтовый ящик над {@link GameState}: все события выполняются по одному в одном потоке.
 * Отправка в ящик не блокирует вызывающего.
 */
@Component
public class StateStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final GameState state;
    private final ExecutorService mailbox;

    @Autowired
    public StateStore(DuelProperties properties, MessageCodec codec) {
        this(new GameState(properties.getMatch().toRules(), codec, properties.isForfeitOnDisconnect()));
    }

    public StateStore(GameState state) {
        this.state = Objects.requireNonNull(state, "state");
        this.mailbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "duel-state-store");
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletionStage<Void> create(SessionRef session) {
        return submit("create", () -> state.create(session));
    }

    public CompletionStage<Void> delete(int playerId) {
        return submit("delete", () -> state.delete(playerId));
    }

    public CompletionStage<Void> receive(int playerId, String payload) {
        return submit("receive", () -> state.receive(playerId, payload));
    }

    public CompletionStage<List<PlayerSummary>> players() {
        try {
            return CompletableFuture.supplyAsync(state::players, mailbox);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletionStage<Void> submit(String event, Supplier<List<Outbound>> task) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> dispatch(task.get()), mailbox);
        } catch (RejectedExecutionException e) {
            log.warn("mailbox-closed event={}", event);
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.error("mailbox-failure event={}", event, ex);
            }
        });
    }

    private void dispatch(List<Outbound> messages) {
        for (Outbound outbound : messages) {
            try {
                outbound.target().publish(outbound.message());
            } catch (RuntimeException e) {
                log.warn("publish-failed session={} type={}",
                        outbound.target().sessionId(), outbound.message().getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public void close() {
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(3, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            mailbox.shutdownNow();
        }
    }
}
