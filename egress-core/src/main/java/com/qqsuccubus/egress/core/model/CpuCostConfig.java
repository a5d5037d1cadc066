package com.qqsuccubus.egress.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static CPU cost estimates per request kind, in CPU cores.
 */
@Value
@Builder(toBuilder = true)
public class CpuCostConfig {

    public static final double DEFAULT_ROOM_COMPOSITE_COST = 3.0;
    public static final double DEFAULT_WEB_COST = 3.0;
    public static final double DEFAULT_TRACK_COMPOSITE_COST = 2.0;
    public static final double DEFAULT_TRACK_COST = 1.0;

    @Builder.Default
    double roomCompositeCost = DEFAULT_ROOM_COMPOSITE_COST;

    @Builder.Default
    double webCost = DEFAULT_WEB_COST;

    @Builder.Default
    double trackCompositeCost = DEFAULT_TRACK_COMPOSITE_COST;

    @Builder.Default
    double trackCost = DEFAULT_TRACK_COST;

    public static CpuCostConfig defaults() {
        return CpuCostConfig.builder().build();
    }

    /**
     * Cost of one job of the given kind.
     *
     * @param kind request kind
     * @return cores reserved for the job
     */
    public double costOf(RequestKind kind) {
        return switch (kind) {
            case ROOM_COMPOSITE -> roomCompositeCost;
            case WEB -> webCost;
            case TRACK_COMPOSITE -> trackCompositeCost;
            case TRACK -> trackCost;
        };
    }
}
