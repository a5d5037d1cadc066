package com.qqsuccubus.egress.node.redis;

import com.qqsuccubus.egress.core.redis.Keys;
import com.qqsuccubus.egress.node.admission.AdmissionController;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.job.JobTable;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes this node's spare capacity to Redis so fleet tooling can pick nodes with room.
 * <p>
 * Non-blocking, Lettuce reactive API. A failed write is logged and retried on the next tick.
 * </p>
 */
public class RedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(10);
    static final long HEARTBEAT_TTL_SEC = 30;

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final EgressConfig config;
    private final AdmissionController admission;
    private final JobTable jobs;

    public RedisService(EgressConfig config, AdmissionController admission, JobTable jobs) {
        this.config = config;
        this.admission = admission;
        this.jobs = jobs;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    public Disposable startHeartbeats() {
        String key = Keys.node(config.getNodeId());
        return Flux.interval(Duration.ZERO, HEARTBEAT_INTERVAL)
            .concatMap(tick -> commands.hset(key, heartbeat(admission, jobs, System.currentTimeMillis()))
                .then(commands.expire(key, HEARTBEAT_TTL_SEC))
                .onErrorResume(err -> {
                    log.warn("Failed to write heartbeat {}: {}", key, err.getMessage());
                    return Mono.empty();
                }))
            .subscribe();
    }

    static Map<String, String> heartbeat(AdmissionController admission, JobTable jobs, long now) {
        return Map.of(
            "cpuLoad", String.valueOf(admission.getCpuLoad()),
            "availableCpu", String.valueOf(admission.getState().getAvailableCpu()),
            "activeJobs", String.valueOf(jobs.activeCount()),
            "ts", String.valueOf(now)
        );
    }

    /**
     * Removes this node's heartbeat and closes the connection.
     */
    public void close() {
        commands.del(Keys.node(config.getNodeId()))
            .onErrorResume(err -> {
                log.warn("Failed to remove heartbeat: {}", err.getMessage());
                return Mono.empty();
            })
            .block(Duration.ofSeconds(5));
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
