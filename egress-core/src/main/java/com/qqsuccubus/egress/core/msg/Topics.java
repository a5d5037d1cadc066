package com.qqsuccubus.egress.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Start requests (RpcRequest of type START).
     * Consumed by all egress nodes in one consumer group, so each request reaches a single node.
     */
    public static final String START_REQUESTS = "egress.start";

    /**
     * Stop/list/get requests (RpcRequest).
     * Every node consumes it under its own group; only the owner of a job answers for it.
     */
    public static final String CONTROL_REQUESTS = "egress.control";

    /**
     * Every lifecycle transition of every job (EgressInfo), keyed by egressId.
     */
    public static final String UPDATES = "egress.updates";

    /**
     * Consumer group shared by all egress nodes for {@link #START_REQUESTS}.
     */
    public static final String NODE_GROUP = "egress-nodes";

    /**
     * Prefix for per-client reply topics.
     * <p>
     * Topic naming convention: egress.responses.{clientId}
     * </p>
     */
    public static final String RESPONSE_TOPIC_PREFIX = "egress.responses.";

    /**
     * Generates the reply topic name for a given client.
     *
     * @param clientId Client identifier
     * @return Topic name: egress.responses.{clientId}
     */
    public static String responseTopicFor(String clientId) {
        return RESPONSE_TOPIC_PREFIX + clientId;
    }
}
