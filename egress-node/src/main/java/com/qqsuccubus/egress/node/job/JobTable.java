package com.qqsuccubus.egress.node.job;

import com.qqsuccubus.egress.core.metrics.MetricsNames;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.model.EgressStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory table of the egress jobs owned by this node.
 * <p>
 * All mutations go through one lock, which is held only for the map/state update and the
 * {@code onApplied} callback. Running the callback under the lock is what keeps per-job update
 * order equal to application order. Reads work on immutable {@link EgressInfo} snapshots and never
 * take the lock.
 * </p>
 * <p>
 * Terminal jobs stay visible for {@code evictionDelay} so late status queries still find them.
 * </p>
 */
public class JobTable {
    private static final Logger log = LoggerFactory.getLogger(JobTable.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final Duration evictionDelay;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Counter rejectedTransitions;

    public JobTable(Duration evictionDelay, Scheduler scheduler, Clock clock,
                    MeterRegistry registry) {
        this.evictionDelay = evictionDelay;
        this.scheduler = scheduler;
        this.clock = clock;
        this.rejectedTransitions = Counter.builder(MetricsNames.TRANSITIONS_REJECTED_TOTAL)
            .description("Lifecycle transitions dropped as invalid")
            .register(registry);
    }

    /**
     * Outcome of a transition attempt.
     *
     * @param outcome what happened
     * @param info    job snapshot after the attempt, null when the job is unknown
     */
    public record Transition(Outcome outcome, EgressInfo info) {
        public boolean isApplied() {
            return outcome == Outcome.APPLIED;
        }
    }

    public enum Outcome {
        APPLIED,
        NOT_FOUND,
        REJECTED
    }

    /**
     * Adds a freshly accepted job in STARTING state.
     *
     * @param job         new job
     * @param onInserted  called under the lock with the initial snapshot
     */
    public void insert(Job job, Consumer<EgressInfo> onInserted) {
        lock.lock();
        try {
            Job existing = jobs.putIfAbsent(job.getEgressId(), job);
            if (existing != null) {
                throw new IllegalStateException("duplicate egress id " + job.getEgressId());
            }
            onInserted.accept(job.getInfo());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a lifecycle transition.
     * <p>
     * Transitions the lifecycle does not allow are logged and dropped; the recorded state is left
     * untouched.
     * </p>
     *
     * @param egressId  job id
     * @param next      target state
     * @param error     failure detail, only recorded for ABORTED
     * @param onApplied called under the lock with the new snapshot when the transition is applied
     * @return transition outcome
     */
    public Transition transition(String egressId, EgressStatus next, String error,
                                 Consumer<EgressInfo> onApplied) {
        lock.lock();
        try {
            Job job = jobs.get(egressId);
            if (job == null) {
                return new Transition(Outcome.NOT_FOUND, null);
            }

            EgressInfo current = job.getInfo();
            if (!current.getStatus().canTransitionTo(next)) {
                rejectedTransitions.increment();
                log.warn("Rejected transition for egress {}: {} -> {}", egressId, current.getStatus(), next);
                return new Transition(Outcome.REJECTED, current);
            }

            EgressInfo.EgressInfoBuilder updated = current.toBuilder().status(next);
            long now = clock.millis();
            if (next == EgressStatus.ACTIVE) {
                updated.startedAt(now);
            }
            if (next.isTerminal()) {
                updated.endedAt(now);
            }
            if (next == EgressStatus.ABORTED && error != null) {
                updated.error(error);
            }

            EgressInfo info = updated.build();
            job.setInfo(info);
            log.info("Egress {} status updated: {} -> {}", egressId, current.getStatus(), next);

            onApplied.accept(info);

            if (next.isTerminal()) {
                scheduleEviction(egressId);
            }
            return new Transition(Outcome.APPLIED, info);
        } finally {
            lock.unlock();
        }
    }

    private void scheduleEviction(String egressId) {
        Mono.delay(evictionDelay, scheduler)
            .subscribe(tick -> {
                lock.lock();
                try {
                    jobs.remove(egressId);
                } finally {
                    lock.unlock();
                }
                log.debug("Evicted egress {}", egressId);
            });
    }

    public Optional<Job> get(String egressId) {
        return Optional.ofNullable(jobs.get(egressId));
    }

    /**
     * @return every job still in the table, terminal ones included, oldest first
     */
    public List<EgressInfo> snapshot() {
        return jobs.values().stream()
            .sorted(Comparator.comparingLong(Job::getCreatedAt))
            .map(Job::getInfo)
            .collect(Collectors.toList());
    }

    /**
     * @return jobs that have not reached a terminal state
     */
    public List<Job> activeJobs() {
        return jobs.values().stream()
            .filter(job -> !job.getStatus().isTerminal())
            .sorted(Comparator.comparingLong(Job::getCreatedAt))
            .collect(Collectors.toList());
    }

    public int activeCount() {
        return (int) jobs.values().stream()
            .filter(job -> !job.getStatus().isTerminal())
            .count();
    }

    public int size() {
        return jobs.size();
    }
}
