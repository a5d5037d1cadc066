package com.qqsuccubus.egress.node.cpu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.function.DoubleConsumer;

/**
 * Samples system CPU load through the platform {@code OperatingSystemMXBean}.
 */
public class SystemCpuSampler implements ICpuSampler {
    private static final Logger log = LoggerFactory.getLogger(SystemCpuSampler.class);

    private final com.sun.management.OperatingSystemMXBean osBean;
    private final double numCpus;
    private final Duration interval;

    public SystemCpuSampler(double numCpus, Duration interval) {
        this.osBean = (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.numCpus = numCpus;
        this.interval = interval;
    }

    @Override
    public Disposable start(DoubleConsumer onIdle) {
        log.info("Starting CPU sampler: cpus={}, interval={}", numCpus, interval);

        return Flux.interval(Duration.ZERO, interval, Schedulers.parallel())
            .map(tick -> osBean.getCpuLoad())
            // negative until the first measurement is ready
            .filter(load -> load >= 0)
            .subscribe(
                load -> onIdle.accept(numCpus * (1 - load)),
                err -> log.error("CPU sampler stopped", err)
            );
    }
}
