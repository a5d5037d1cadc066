package com.qqsuccubus.egress.node.config;

import com.qqsuccubus.egress.core.model.CpuCostConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for an egress node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class EgressConfig {

    String nodeId;
    /**
     * Port of the health/status/metrics server, 0 disables it.
     */
    int healthPort;
    String kafkaBootstrap;
    /**
     * Redis for availability heartbeats, empty disables them.
     */
    String redisUrl;

    CpuCostConfig cpuCost;

    // Admission and lifecycle timing
    Duration reservationHold;
    Duration evictionDelay;
    Duration shutdownTimeout;
    Duration cpuSampleInterval;

    /**
     * Handler program launched once per job, split on whitespace.
     */
    String handlerCommand;

    public static EgressConfig fromEnv() {
        return EgressConfig.builder()
            .nodeId(getEnv("NODE_ID", "egress-node-1"))
            .healthPort(Integer.parseInt(getEnv("HEALTH_PORT", "8080")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .redisUrl(getEnv("REDIS_URL", ""))
            .cpuCost(CpuCostConfig.builder()
                .roomCompositeCost(Double.parseDouble(getEnv("ROOM_COMPOSITE_CPU_COST", "3.0")))
                .webCost(Double.parseDouble(getEnv("WEB_CPU_COST", "3.0")))
                .trackCompositeCost(Double.parseDouble(getEnv("TRACK_COMPOSITE_CPU_COST", "2.0")))
                .trackCost(Double.parseDouble(getEnv("TRACK_CPU_COST", "1.0")))
                .build())
            .reservationHold(Duration.ofMillis(Long.parseLong(getEnv("RESERVATION_HOLD_MS", "1000"))))
            .evictionDelay(Duration.ofSeconds(Long.parseLong(getEnv("EVICTION_DELAY_SEC", "10"))))
            .shutdownTimeout(Duration.ofSeconds(Long.parseLong(getEnv("SHUTDOWN_TIMEOUT_SEC", "60"))))
            .cpuSampleInterval(Duration.ofMillis(Long.parseLong(getEnv("CPU_SAMPLE_INTERVAL_MS", "1000"))))
            .handlerCommand(getEnv("HANDLER_COMMAND", "egress-handler"))
            .build();
    }

    public boolean isHealthEnabled() {
        return healthPort > 0;
    }

    public boolean isRedisEnabled() {
        return redisUrl != null && !redisUrl.isBlank();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
