package com.quick.duel.duel;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/players")
@CrossOrigin("*")
@RequiredArgsConstructor
public class LobbyController {

    private final StateStore store;

    /**
     * Кто сейчас онлайн и кому можно бросить вызов.
     */
    @GetMapping
    public CompletableFuture<ResponseEntity<List<PlayerSummary>>> listPlayers() {
        return store.players()
                .thenApply(ResponseEntity::ok)
                .toCompletableFuture();
    }
}
