package com.qqsuccubus.egress.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Snapshot of an egress job as seen by callers and update subscribers.
 * <p>
 * Timestamps are epoch millis and {@code 0} while unset. {@code error} is empty unless the job
 * was aborted by a failure.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class EgressInfo {

    @JsonProperty("egressId")
    String egressId;

    @JsonProperty("roomId")
    String roomId;

    @JsonProperty("requestKind")
    RequestKind requestKind;

    @JsonProperty("status")
    EgressStatus status;

    @JsonProperty("startedAt")
    long startedAt;

    @JsonProperty("endedAt")
    long endedAt;

    @JsonProperty("error")
    String error;

    /**
     * Node that owns the job.
     */
    @JsonProperty("nodeId")
    String nodeId;

    @JsonCreator
    public EgressInfo(
        @JsonProperty("egressId") String egressId,
        @JsonProperty("roomId") String roomId,
        @JsonProperty("requestKind") RequestKind requestKind,
        @JsonProperty("status") EgressStatus status,
        @JsonProperty("startedAt") long startedAt,
        @JsonProperty("endedAt") long endedAt,
        @JsonProperty("error") String error,
        @JsonProperty("nodeId") String nodeId
    ) {
        this.egressId = egressId;
        this.roomId = roomId;
        this.requestKind = requestKind;
        this.status = status;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.error = error == null ? "" : error;
        this.nodeId = nodeId;
    }

    public boolean hasError() {
        return !error.isEmpty();
    }
}
