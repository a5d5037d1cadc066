package com.qqsuccubus.egress.core.error;

import lombok.Getter;

/**
 * Error returned synchronously to the caller of an egress operation.
 */
@Getter
public class EgressException extends RuntimeException {

    private final ErrorCode code;

    public EgressException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static EgressException resourceExhausted(String message) {
        return new EgressException(ErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public static EgressException notFound(String egressId) {
        return new EgressException(ErrorCode.NOT_FOUND, "egress not found: " + egressId);
    }

    public static EgressException invalidState(String message) {
        return new EgressException(ErrorCode.INVALID_STATE, message);
    }

    public static EgressException invalidArgument(String message) {
        return new EgressException(ErrorCode.INVALID_ARGUMENT, message);
    }

    public static EgressException shuttingDown() {
        return new EgressException(ErrorCode.SHUTTING_DOWN, "egress node is shutting down");
    }

    public static EgressException unavailable(String message) {
        return new EgressException(ErrorCode.UNAVAILABLE, message);
    }
}
