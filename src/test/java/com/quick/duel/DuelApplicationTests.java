package com.quick.duel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DuelApplicationTests {

    private static final ObjectMapper JSON = new ObjectMapper();

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Test
    void twoClientsCanChallengeAndPlayARound() throws Exception {
        Client alice = connect();
        Client bob = connect();
        int aliceId = alice.await(type("connected")).get("id").asInt();
        int bobId = bob.await(type("connected")).get("id").asInt();

        alice.send("{\"type\":\"challenge_request\",\"target\":" + bobId + "}");
        assertEquals(aliceId, bob.await(type("challenge")).get("from").asInt());

        bob.send("{\"type\":\"challenge_response\",\"challenger\":" + aliceId + ",\"accepted\":true}");
        alice.await(type("challenge_accepted"));

        alice.send("{\"type\":\"play_card\",\"card\":\"REST\"}");
        bob.send("{\"type\":\"play_card\",\"card\":\"ATTACK\"}");

        JsonNode round = alice.await(type("round_result").and(m -> m.at("/result/own/health").asInt() == 4));
        assertEquals(3, round.at("/result/own/hand/attacks").asInt());
        assertEquals(5, round.at("/result/opponent/health").asInt());

        ResponseEntity<String> players = rest.getForEntity("/api/players", String.class);
        assertEquals(HttpStatus.OK, players.getStatusCode());
        assertTrue(players.getBody().contains("\"in_match\""));

        alice.close();
        bob.close();
    }

    @Test
    void garbageShouldComeBackAsError() throws Exception {
        Client client = connect();
        client.await(type("connected"));

        client.send("{\"type\":\"dance\"}");

        assertNotNull(client.await(type("error")).get("message").asText());
        client.close();
    }

    private Client connect() throws Exception {
        Client client = new Client();
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/ws")
                .get(5, TimeUnit.SECONDS);
        return client;
    }

    private static Predicate<JsonNode> type(String type) {
        return message -> type.equals(message.path("type").asText());
    }

    private static class Client extends TextWebSocketHandler {
        private final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
            inbox.add(JSON.readTree(message.getPayload()));
        }

        void send(String payload) throws Exception {
            session.sendMessage(new TextMessage(payload));
        }

        JsonNode await(Predicate<JsonNode> matcher) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5_000;
            while (System.currentTimeMillis() < deadline) {
                JsonNode next = inbox.poll(100, TimeUnit.MILLISECONDS);
                if (next != null && matcher.test(next)) {
                    return next;
                }
            }
            throw new AssertionError("No matching message within 5s");
        }

        void close() throws Exception {
            session.close();
        }
    }
}
