package com.qqsuccubus.egress.node;

import com.qqsuccubus.egress.node.admission.AdmissionController;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.cpu.SystemCpuSampler;
import com.qqsuccubus.egress.node.http.HttpServer;
import com.qqsuccubus.egress.node.job.JobTable;
import com.qqsuccubus.egress.node.metrics.MetricsService;
import com.qqsuccubus.egress.node.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.egress.node.pipeline.ProcessPipelineExecutor;
import com.qqsuccubus.egress.node.publish.UpdatePublisher;
import com.qqsuccubus.egress.node.redis.RedisService;
import com.qqsuccubus.egress.node.rpc.KafkaRpcServer;
import com.qqsuccubus.egress.node.rpc.RequestDispatcher;
import com.qqsuccubus.egress.node.service.EgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for an egress node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Admit start requests against the node's CPU budget</li>
 *   <li>Launch and track one pipeline per accepted job</li>
 *   <li>Answer start/stop/get/list requests from Kafka</li>
 *   <li>Publish every lifecycle transition to the updates topic</li>
 *   <li>Expose /healthz, /status and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class EgressNodeApp {
    private static final Logger log = LoggerFactory.getLogger(EgressNodeApp.class);

    public static void main(String[] args) {
        EgressConfig config = EgressConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        int numCpus = Runtime.getRuntime().availableProcessors();

        log.info("Starting egress node: {}", config.getNodeId());
        log.info("  Kafka: {}", config.getKafkaBootstrap());
        log.info("  Redis: {}", config.isRedisEnabled() ? config.getRedisUrl() : "disabled");
        log.info("  CPUs: {}, costs: {}", numCpus, config.getCpuCost());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());

        // Fails fast when the node cannot run any kind of egress
        AdmissionController admission = new AdmissionController(
            config.getCpuCost(), numCpus, config.getReservationHold(),
            Schedulers.parallel(), metricsExporter.getRegistry()
        );
        Disposable sampler = new SystemCpuSampler(numCpus, config.getCpuSampleInterval())
            .start(admission::onIdleSample);

        JobTable jobs = new JobTable(
            config.getEvictionDelay(), Schedulers.parallel(), Clock.systemUTC(),
            metricsExporter.getRegistry()
        );
        UpdatePublisher publisher = new UpdatePublisher();
        EgressService egressService = new EgressService(
            config,
            admission,
            jobs,
            publisher,
            new ProcessPipelineExecutor(config.getHandlerCommand(), Schedulers.boundedElastic()),
            metricsService,
            Schedulers.parallel(),
            Schedulers.boundedElastic(),
            Clock.systemUTC()
        );

        KafkaRpcServer rpcServer = new KafkaRpcServer(
            config, new RequestDispatcher(egressService), publisher, metricsService
        );
        rpcServer.start().block();

        HttpServer httpServer = new HttpServer(config, egressService, metricsExporter);
        if (config.isHealthEnabled()) {
            httpServer.start();
        }

        RedisService redisService = config.isRedisEnabled()
            ? new RedisService(config, admission, jobs)
            : null;
        Disposable heartbeats = redisService != null ? redisService.startHeartbeats() : null;

        log.info("Egress node {} is ready", config.getNodeId());

        handleShutdown(config, egressService, rpcServer, httpServer, redisService, heartbeats, sampler);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(EgressConfig config,
                                       EgressService egressService,
                                       KafkaRpcServer rpcServer,
                                       HttpServer httpServer,
                                       RedisService redisService,
                                       Disposable heartbeats,
                                       Disposable sampler) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, waiting for running egress jobs...");

            rpcServer.stopAcceptingStarts();

            // Running jobs keep reporting through Kafka until they finish or time out
            egressService.shutdown(true).block(config.getShutdownTimeout().plus(Duration.ofSeconds(10)));

            rpcServer.stop().block(Duration.ofSeconds(10));
            httpServer.stop();

            if (heartbeats != null) {
                heartbeats.dispose();
            }
            if (redisService != null) {
                redisService.close();
            }
            sampler.dispose();

            log.info("Shutdown complete");
        }));
    }
}
