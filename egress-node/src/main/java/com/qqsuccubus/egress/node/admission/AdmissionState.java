package com.qqsuccubus.egress.node.admission;

import java.util.concurrent.atomic.DoubleAdder;

/**
 * Numeric state behind admission decisions, owned by a single {@link AdmissionController}.
 * <p>
 * {@code idleCpu} has a single writer (the CPU sampler callback). {@code pendingReservation} only
 * ever receives additions and subtractions, so concurrent reserves and releases commute and
 * need no lock. Reads never block writers.
 * </p>
 */
public class AdmissionState {

    private final double numCpus;
    private volatile double idleCpu;
    private final DoubleAdder pendingReservation = new DoubleAdder();

    public AdmissionState(double numCpus) {
        this.numCpus = numCpus;
        this.idleCpu = numCpus;
    }

    public double getNumCpus() {
        return numCpus;
    }

    public double getIdleCpu() {
        return idleCpu;
    }

    void setIdleCpu(double idleCpu) {
        this.idleCpu = idleCpu;
    }

    public double getPendingReservation() {
        return pendingReservation.sum();
    }

    void addPending(double cores) {
        pendingReservation.add(cores);
    }

    /**
     * @return idle cores not held by a pending reservation
     */
    public double getAvailableCpu() {
        return idleCpu - pendingReservation.sum();
    }
}
