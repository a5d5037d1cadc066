package com.qqsuccubus.egress.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.egress.core.model.RequestKind;
import lombok.Builder;
import lombok.Value;

/**
 * Request to start a new egress job.
 */
@Value
@Builder(toBuilder = true)
public class StartEgressRequest {

    @JsonProperty("roomId")
    String roomId;

    /**
     * Media server url the pipeline connects to.
     */
    @JsonProperty("wsUrl")
    String wsUrl;

    @JsonProperty("payload")
    EgressPayload payload;

    @JsonCreator
    public StartEgressRequest(
        @JsonProperty("roomId") String roomId,
        @JsonProperty("wsUrl") String wsUrl,
        @JsonProperty("payload") EgressPayload payload
    ) {
        this.roomId = roomId;
        this.wsUrl = wsUrl;
        this.payload = payload;
    }

    /**
     * @return kind selected by the payload, or null when the payload is missing
     */
    @JsonIgnore
    public RequestKind getKind() {
        return payload == null ? null : payload.kind();
    }
}
