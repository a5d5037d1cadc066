package com.qqsuccubus.egress.core.redis;

/**
 * Redis keyspace of the egress fleet.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Availability heartbeat of one node: {@code egress:node:{nodeId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code cpuLoad}: CPU load in percent</li>
     *   <li>{@code availableCpu}: idle cores minus pending reservations</li>
     *   <li>{@code activeJobs}: jobs not yet in a terminal state</li>
     *   <li>{@code ts}: write time (epoch millis)</li>
     * </ul>
     * <b>TTL:</b> refreshed on every heartbeat; a node that stops writing disappears.
     * </p>
     *
     * @param nodeId node identifier
     * @return Redis key
     */
    public static String node(String nodeId) {
        return "egress:node:" + nodeId;
    }
}
