package com.qqsuccubus.egress.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.egress.core.error.ErrorCode;
import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.model.EgressInfo;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response envelope published to the caller's reply topic.
 */
@Value
@Builder(toBuilder = true)
public class RpcResponse {

    @JsonProperty("requestId")
    String requestId;

    @JsonProperty("nodeId")
    String nodeId;

    /**
     * Result of START, STOP and GET.
     */
    @JsonProperty("info")
    EgressInfo info;

    /**
     * Result of LIST.
     */
    @JsonProperty("infos")
    List<EgressInfo> infos;

    @JsonProperty("errorCode")
    ErrorCode errorCode;

    @JsonProperty("error")
    String error;

    @JsonProperty("ts")
    long ts;

    @JsonCreator
    public RpcResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("info") EgressInfo info,
        @JsonProperty("infos") List<EgressInfo> infos,
        @JsonProperty("errorCode") ErrorCode errorCode,
        @JsonProperty("error") String error,
        @JsonProperty("ts") long ts
    ) {
        this.requestId = requestId;
        this.nodeId = nodeId;
        this.info = info;
        this.infos = infos == null ? List.of() : List.copyOf(infos);
        this.errorCode = errorCode;
        this.error = error == null ? "" : error;
        this.ts = ts;
    }

    public static RpcResponse failure(String requestId, String nodeId, EgressException e) {
        return RpcResponse.builder()
            .requestId(requestId)
            .nodeId(nodeId)
            .errorCode(e.getCode())
            .error(e.getMessage())
            .ts(System.currentTimeMillis())
            .build();
    }

    @JsonIgnore
    public boolean isError() {
        return errorCode != null;
    }

    /**
     * Rebuilds the exception a failed response carries.
     */
    public EgressException toException() {
        return new EgressException(errorCode == null ? ErrorCode.INTERNAL : errorCode, error);
    }
}
