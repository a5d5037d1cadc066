package com.qqsuccubus.egress.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Request envelope carried on the egress request topics.
 * <p>
 * {@code requestId} correlates the single response sent to {@code replyTo}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class RpcRequest {

    public enum Type {
        START,
        STOP,
        LIST,
        GET
    }

    @JsonProperty("requestId")
    String requestId;

    /**
     * Topic the response is published to.
     */
    @JsonProperty("replyTo")
    String replyTo;

    @JsonProperty("type")
    Type type;

    /**
     * Set for START only.
     */
    @JsonProperty("start")
    StartEgressRequest start;

    /**
     * Set for STOP and GET.
     */
    @JsonProperty("egressId")
    String egressId;

    /**
     * Timestamp when this request was issued (epoch millis).
     */
    @JsonProperty("ts")
    long ts;

    @JsonCreator
    public RpcRequest(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("replyTo") String replyTo,
        @JsonProperty("type") Type type,
        @JsonProperty("start") StartEgressRequest start,
        @JsonProperty("egressId") String egressId,
        @JsonProperty("ts") long ts
    ) {
        this.requestId = requestId;
        this.replyTo = replyTo;
        this.type = type;
        this.start = start;
        this.egressId = egressId;
        this.ts = ts;
    }
}
