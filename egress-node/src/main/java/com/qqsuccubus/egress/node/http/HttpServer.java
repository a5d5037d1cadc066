package com.qqsuccubus.egress.node.http;

import com.qqsuccubus.egress.core.util.JsonUtils;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.egress.node.service.IEgressService;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, node status and metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final EgressConfig config;
    private final IEgressService egressService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHealthPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Fails once the node stops taking jobs
                .get("/healthz", (req, res) -> {
                    if (egressService.isShuttingDown()) {
                        return res.status(503).sendString(Mono.just("Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/status", (req, res) ->
                    res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(egressService.status())))
                )
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
