package com.qqsuccubus.egress.node.admission;

import com.qqsuccubus.egress.core.model.RequestKind;

/**
 * CPU-cost admission control for new egress jobs.
 */
public interface IAdmissionController {

    /**
     * Checks whether a job of the given kind fits into the CPU that is idle and not yet reserved.
     * Read-only: callers must still {@link #reserve(RequestKind)} once they commit.
     *
     * @param kind request kind
     * @return true if {@code idle - pending > cost(kind)}
     */
    boolean canAccept(RequestKind kind);

    /**
     * Holds {@code cost(kind)} cores until the sampler can see the new pipeline.
     * The hold is released after a fixed delay whatever happens to the job.
     *
     * @param kind request kind
     */
    void reserve(RequestKind kind);

    /**
     * {@link #canAccept(RequestKind)} and {@link #reserve(RequestKind)} as one step, so two
     * concurrent requests cannot both be admitted against the same idle cores.
     *
     * @param kind request kind
     * @return true if the job was admitted and its cost reserved
     */
    boolean tryReserve(RequestKind kind);

    /**
     * @return node CPU load in percent
     */
    double getCpuLoad();

    void jobStarted(RequestKind kind);

    void jobEnded(RequestKind kind);
}
