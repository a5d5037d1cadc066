package com.qqsuccubus.egress.core.model;

/**
 * Lifecycle states of an egress job.
 * <p>
 * State transitions:
 * <pre>
 * STARTING → ACTIVE → ENDING → COMPLETE
 *     │         │        │
 *     └─────────┴────────┴──→ ABORTED
 * </pre>
 * STARTING may also move straight to ENDING when a job is stopped before it became active.
 * Progression is forward-only: a state is never revisited once left.
 * </p>
 */
public enum EgressStatus {
    /**
     * Accepted by admission control, pipeline being built.
     */
    STARTING,

    /**
     * Pipeline running and producing output.
     */
    ACTIVE,

    /**
     * Graceful stop requested, pipeline flushing output.
     */
    ENDING,

    /**
     * Finished successfully.
     */
    COMPLETE,

    /**
     * Failed or stopped before producing a complete output.
     */
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ABORTED;
    }

    /**
     * Checks whether a job in this state may move to {@code next}.
     *
     * @param next target state
     * @return true if the transition keeps the lifecycle monotonic
     */
    public boolean canTransitionTo(EgressStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case STARTING -> next == ACTIVE || next == ENDING || next == ABORTED;
            case ACTIVE -> next == ENDING || next == ABORTED;
            case ENDING -> next == COMPLETE || next == ABORTED;
            case COMPLETE, ABORTED -> false;
        };
    }

    /**
     * Stop is only accepted while the job has not started ending.
     */
    public boolean isStoppable() {
        return this == STARTING || this == ACTIVE;
    }
}
