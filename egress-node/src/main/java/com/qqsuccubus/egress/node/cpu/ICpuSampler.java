package com.qqsuccubus.egress.node.cpu;

import reactor.core.Disposable;

import java.util.function.DoubleConsumer;

/**
 * Periodic source of system-wide idle CPU samples.
 */
public interface ICpuSampler {

    /**
     * Starts sampling.
     *
     * @param onIdle receives the number of idle cores after every sample
     * @return handle stopping the sampler
     */
    Disposable start(DoubleConsumer onIdle);
}
