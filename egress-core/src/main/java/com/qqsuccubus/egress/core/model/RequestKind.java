package com.qqsuccubus.egress.core.model;

/**
 * Egress request categories. Each one maps to its own CPU cost estimate.
 */
public enum RequestKind {
    ROOM_COMPOSITE("room_composite"),
    WEB("web"),
    TRACK_COMPOSITE("track_composite"),
    TRACK("track");

    private final String metricLabel;

    RequestKind(String metricLabel) {
        this.metricLabel = metricLabel;
    }

    /**
     * Value used for the {@code type} metric tag.
     */
    public String metricLabel() {
        return metricLabel;
    }
}
