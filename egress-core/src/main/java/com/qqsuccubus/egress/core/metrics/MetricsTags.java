package com.qqsuccubus.egress.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    public static final String NODE_TYPE = "node_type";

    /**
     * Tag key for request kind or RPC type.
     */
    public static final String TYPE = "type";

    public static final String RESULT = "result";

    public static final String OUTCOME = "outcome";

    public static final String TOPIC = "topic";
}
