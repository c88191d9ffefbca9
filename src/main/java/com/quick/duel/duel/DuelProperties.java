package com.quick.duel.duel;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Настройки сервера, префикс duel.* в application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "duel")
public class DuelProperties {

    private Ws ws = new Ws();
    private MatchSettings match = new MatchSettings();

    /**
     * Если игрок отключился посреди матча, победа присуждается сопернику.
     */
    private boolean forfeitOnDisconnect = false;

    @Data
    public static class Ws {
        private String path = "/ws";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private int sendTimeLimitMs = 5_000;
        private int bufferSizeLimit = 64 * 1024;
    }

    @Data
    public static class MatchSettings {
        private int startingHealth = 5;
        private int attacks = 2;
        private int counters = 1;
        private int rests = 1;

        public MatchRules toRules() {
            return new MatchRules(startingHealth, new Hand(attacks, counters, rests));
        }
    }
}
