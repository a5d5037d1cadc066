package com.qqsuccubus.egress.core.error;

/**
 * Error categories returned to callers.
 */
public enum ErrorCode {
    /**
     * Admission rejected the request, retry later or on another node.
     */
    RESOURCE_EXHAUSTED,

    /**
     * Unknown or already evicted egress id.
     */
    NOT_FOUND,

    /**
     * Request conflicts with the job lifecycle (e.g. stopping a job that is already ending).
     */
    INVALID_STATE,

    /**
     * Malformed request.
     */
    INVALID_ARGUMENT,

    /**
     * Node is draining and no longer accepts new jobs.
     */
    SHUTTING_DOWN,

    /**
     * No node answered in time.
     */
    UNAVAILABLE,

    INTERNAL
}
