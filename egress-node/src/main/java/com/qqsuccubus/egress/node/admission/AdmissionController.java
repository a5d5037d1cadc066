package com.qqsuccubus.egress.node.admission;

import com.qqsuccubus.egress.core.error.CpuConfigException;
import com.qqsuccubus.egress.core.metrics.MetricsNames;
import com.qqsuccubus.egress.core.metrics.MetricsTags;
import com.qqsuccubus.egress.core.model.CpuCostConfig;
import com.qqsuccubus.egress.core.model.RequestKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether this node has CPU for a new egress job.
 * <p>
 * The CPU sampler only reflects a pipeline's usage once it has been running for a while, so a burst
 * of near-simultaneous requests checked against the raw idle sample would all be admitted. Every
 * accepted job therefore holds its static cost as a pending reservation for a fixed window
 * (1 second by default) before the hold is released unconditionally. The release is not tied to
 * the job's outcome, so a job that never reports back cannot leak reserved CPU.
 * </p>
 */
public class AdmissionController implements IAdmissionController {
    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    // Recommended floors: encoder startup spikes need at least this much headroom
    static final double ROOM_COMPOSITE_MIN = 2.5;
    static final double WEB_MIN = 2.5;
    static final double TRACK_COMPOSITE_MIN = 1.0;
    static final double TRACK_MIN = 0.5;

    private final CpuCostConfig costConfig;
    private final AdmissionState state;
    private final Duration reservationHold;
    private final Scheduler scheduler;
    private final Map<RequestKind, AtomicInteger> activeRequests = new EnumMap<>(RequestKind.class);

    /**
     * @param costConfig      per-kind CPU costs
     * @param numCpus         logical CPUs of this node
     * @param reservationHold how long an accepted job's cost stays reserved
     * @param scheduler       scheduler running the reservation release timers
     * @param registry        meter registry
     * @throws CpuConfigException if the node cannot serve any request kind
     */
    public AdmissionController(CpuCostConfig costConfig, double numCpus, Duration reservationHold,
                               Scheduler scheduler, MeterRegistry registry) {
        checkCpuConfig(costConfig, numCpus);

        this.costConfig = costConfig;
        this.state = new AdmissionState(numCpus);
        this.reservationHold = reservationHold;
        this.scheduler = scheduler;

        Gauge.builder(MetricsNames.AVAILABLE_CPU, state, AdmissionState::getAvailableCpu)
            .description("CPU cores available for new egress jobs")
            .register(registry);

        Gauge.builder(MetricsNames.NODE_CPU_LOAD, state, s -> 1 - s.getIdleCpu() / s.getNumCpus())
            .description("Node CPU load (0.0 to 1.0)")
            .register(registry);

        for (RequestKind kind : RequestKind.values()) {
            AtomicInteger counter = new AtomicInteger();
            activeRequests.put(kind, counter);
            Gauge.builder(MetricsNames.REQUESTS, counter, AtomicInteger::get)
                .tag(MetricsTags.TYPE, kind.metricLabel())
                .description("Egress jobs currently running")
                .register(registry);
        }

        log.info("AdmissionController initialized: cpus={}, costs={}, reservationHold={}",
            numCpus, costConfig, reservationHold);
    }

    /**
     * Validates CPU costs against the node size.
     * <p>
     * Fatal only when no request kind fits at all. Too-low thresholds and kinds that do not fit
     * are logged and tolerated.
     * </p>
     *
     * @param costConfig per-kind CPU costs
     * @param numCpus    logical CPUs of this node
     * @throws CpuConfigException if {@code numCpus} is below the smallest cost
     */
    public static void checkCpuConfig(CpuCostConfig costConfig, double numCpus) {
        warnIfTooLow("room composite", costConfig.getRoomCompositeCost(), ROOM_COMPOSITE_MIN, 3);
        warnIfTooLow("web", costConfig.getWebCost(), WEB_MIN, 3);
        warnIfTooLow("track composite", costConfig.getTrackCompositeCost(), TRACK_COMPOSITE_MIN, 2);
        warnIfTooLow("track", costConfig.getTrackCost(), TRACK_MIN, 1);

        double[] requirements = {
            costConfig.getRoomCompositeCost(),
            costConfig.getWebCost(),
            costConfig.getTrackCompositeCost(),
            costConfig.getTrackCost()
        };
        Arrays.sort(requirements);

        double recommendedMinimum = Math.max(requirements[2], 3);

        if (numCpus < requirements[0]) {
            log.error("Not enough cpu: minimum={}, recommended={}, available={}",
                requirements[0], recommendedMinimum, numCpus);
            throw new CpuConfigException(String.format(
                "not enough cpu: %.1f available, at least %.1f required", numCpus, requirements[0]));
        }

        if (numCpus < requirements[3]) {
            log.error("Not enough cpu for some egress types: minimum={}, recommended={}, available={}",
                requirements[3], recommendedMinimum, numCpus);
        }
    }

    private static void warnIfTooLow(String type, double value, double minimum, double recommended) {
        if (value < minimum) {
            log.warn("{} cpu cost too low: configured={}, minimum={}, recommended={}",
                type, value, minimum, recommended);
        }
    }

    /**
     * Sampler callback with the number of idle cores.
     *
     * @param idleCpu idle cores in the latest sample
     */
    public void onIdleSample(double idleCpu) {
        state.setIdleCpu(idleCpu);
    }

    @Override
    public boolean canAccept(RequestKind kind) {
        double available = state.getAvailableCpu();
        boolean accept = available > costConfig.costOf(kind);

        log.debug("cpu request: kind={}, accepted={}, availableCpus={}, numCpus={}",
            kind, accept, available, state.getNumCpus());
        return accept;
    }

    @Override
    public void reserve(RequestKind kind) {
        double hold = costConfig.costOf(kind);
        state.addPending(hold);

        Mono.delay(reservationHold, scheduler)
            .subscribe(tick -> {
                state.addPending(-hold);
                log.debug("Released {} reserved cores ({} still pending)", hold, state.getPendingReservation());
            });
    }

    @Override
    public synchronized boolean tryReserve(RequestKind kind) {
        if (!canAccept(kind)) {
            return false;
        }
        reserve(kind);
        return true;
    }

    @Override
    public double getCpuLoad() {
        return (state.getNumCpus() - state.getIdleCpu()) / state.getNumCpus() * 100;
    }

    @Override
    public void jobStarted(RequestKind kind) {
        activeRequests.get(kind).incrementAndGet();
    }

    @Override
    public void jobEnded(RequestKind kind) {
        activeRequests.get(kind).decrementAndGet();
    }

    public int getActiveRequests(RequestKind kind) {
        return activeRequests.get(kind).get();
    }

    public AdmissionState getState() {
        return state;
    }
}
