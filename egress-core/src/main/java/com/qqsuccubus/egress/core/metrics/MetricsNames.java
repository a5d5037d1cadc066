package com.qqsuccubus.egress.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code egress.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * {@code node_id} and {@code node_type} are common tags set on the node's registry.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Node CPU load as a fraction (0.0 to 1.0) from the latest idle sample.
     * <p>
     * Tags: node_id, node_type
     * </p>
     */
    public static final String NODE_CPU_LOAD = "egress.node.cpu.load";

    /**
     * Gauge: CPU cores available for new jobs (idle minus pending reservations).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String AVAILABLE_CPU = "egress.available";

    /**
     * Gauge: Egress jobs currently running, per request kind.
     * <p>
     * Tags: node_id, type (room_composite/web/track_composite/track)
     * </p>
     */
    public static final String REQUESTS = "egress.requests";

    /**
     * Counter: Admission decisions.
     * <p>
     * Tags: node_id, type, result (accepted/rejected)
     * </p>
     */
    public static final String ADMISSION_TOTAL = "egress.admission.total";

    /**
     * Counter: Jobs reaching a terminal state.
     * <p>
     * Tags: node_id, outcome (complete/aborted)
     * </p>
     */
    public static final String JOBS_TOTAL = "egress.jobs.total";

    /**
     * Counter: Lifecycle transitions dropped because the lifecycle does not allow them.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String TRANSITIONS_REJECTED_TOTAL = "egress.transitions.rejected.total";

    /**
     * Timer: Kafka update/response publish latency.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String KAFKA_PUBLISH_LATENCY = "egress.kafka.publish.latency";

    /**
     * Timer: Time spent handling one inbound request.
     * <p>
     * Tags: node_id, type (start/stop/list/get)
     * </p>
     */
    public static final String REQUEST_LATENCY = "egress.request.latency";
}
