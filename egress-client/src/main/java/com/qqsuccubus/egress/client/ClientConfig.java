package com.qqsuccubus.egress.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.UUID;

/**
 * Configuration for an {@link EgressClient}, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ClientConfig {

    /**
     * Names the client's reply topic; must be unique among live clients.
     */
    String clientId;
    String kafkaBootstrap;

    /**
     * How long start/stop/get wait for an answer.
     */
    Duration requestTimeout;

    /**
     * How long list collects answers from the fleet.
     */
    Duration listWindow;

    public static ClientConfig fromEnv() {
        return ClientConfig.builder()
            .clientId(getEnv("CLIENT_ID", "egress-client-" + UUID.randomUUID().toString().substring(0, 8)))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .requestTimeout(Duration.ofSeconds(Long.parseLong(getEnv("REQUEST_TIMEOUT_SEC", "10"))))
            .listWindow(Duration.ofMillis(Long.parseLong(getEnv("LIST_WINDOW_MS", "1000"))))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
