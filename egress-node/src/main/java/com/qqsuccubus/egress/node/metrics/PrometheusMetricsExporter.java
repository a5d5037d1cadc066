package com.qqsuccubus.egress.node.metrics;

import com.qqsuccubus.egress.core.metrics.MetricsTags;
import com.qqsuccubus.egress.node.config.EgressConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Backs the {@code /metrics} scrape.
 * <p>
 * Meters are registered on {@link #getRegistry()}; every meter on it, including Reactor Netty's,
 * gets the node's {@code node_id} and {@code node_type} as common tags. The tags must be in place
 * before the first meter is registered.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    static final String NODE_TYPE = "EGRESS";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(EgressConfig config) {
        this(Metrics.REGISTRY, config.getNodeId());
    }

    PrometheusMetricsExporter(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId, MetricsTags.NODE_TYPE, NODE_TYPE);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }
        log.info("Prometheus exporter attached for egress node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
