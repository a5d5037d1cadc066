package com.qqsuccubus.egress.node.service;

import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.model.EgressStatus;
import com.qqsuccubus.egress.core.model.RequestKind;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.core.util.EgressIds;
import com.qqsuccubus.egress.node.admission.IAdmissionController;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.job.Job;
import com.qqsuccubus.egress.node.job.JobTable;
import com.qqsuccubus.egress.node.metrics.MetricsService;
import com.qqsuccubus.egress.node.pipeline.IPipelineExecutor;
import com.qqsuccubus.egress.node.pipeline.PipelineEvent;
import com.qqsuccubus.egress.node.pipeline.PipelineHandle;
import com.qqsuccubus.egress.node.publish.IUpdatePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates egress jobs on this node: admission, job table, pipeline dispatch and updates.
 * <p>
 * Every applied transition is published by the job table while it holds its lock, so subscribers
 * see each job's states in the order they were applied. Pipelines run outside the service; their
 * events are folded back into the job table as they arrive.
 * </p>
 */
public class EgressService implements IEgressService {
    private static final Logger log = LoggerFactory.getLogger(EgressService.class);

    static final String CPU_LOAD_KEY = "CpuLoad";
    static final String UNEXPECTED_EXIT = "pipeline exited unexpectedly";
    static final String SHUTDOWN_ABORT = "egress node shut down";
    static final String STOPPED_BEFORE_ACTIVE = "egress stopped before it became active";

    private static final Duration DRAIN_POLL_INTERVAL = Duration.ofMillis(500);

    private final EgressConfig config;
    private final IAdmissionController admission;
    private final JobTable jobs;
    private final IUpdatePublisher publisher;
    private final IPipelineExecutor executor;
    private final MetricsService metricsService;
    private final Scheduler timerScheduler;
    private final Scheduler launchScheduler;
    private final Clock clock;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private volatile boolean killRequested;

    /**
     * @param timerScheduler  runs drain polling and the shutdown timeout
     * @param launchScheduler runs blocking pipeline launches
     */
    public EgressService(EgressConfig config,
                         IAdmissionController admission,
                         JobTable jobs,
                         IUpdatePublisher publisher,
                         IPipelineExecutor executor,
                         MetricsService metricsService,
                         Scheduler timerScheduler,
                         Scheduler launchScheduler,
                         Clock clock) {
        this.config = config;
        this.admission = admission;
        this.jobs = jobs;
        this.publisher = publisher;
        this.executor = executor;
        this.metricsService = metricsService;
        this.timerScheduler = timerScheduler;
        this.launchScheduler = launchScheduler;
        this.clock = clock;
    }

    @Override
    public Mono<EgressInfo> start(StartEgressRequest request) {
        return Mono.defer(() -> {
            if (shuttingDown.get()) {
                return Mono.error(EgressException.shuttingDown());
            }
            if (request == null || request.getPayload() == null) {
                return Mono.error(EgressException.invalidArgument("start request has no payload"));
            }
            if (request.getRoomId() == null || request.getRoomId().isBlank()) {
                return Mono.error(EgressException.invalidArgument("start request has no room id"));
            }

            RequestKind kind = request.getKind();
            if (!admission.tryReserve(kind)) {
                metricsService.recordAdmission(false);
                log.info("Rejected {} egress for room {}: not enough cpu", kind, request.getRoomId());
                return Mono.error(EgressException.resourceExhausted("not enough cpu for " + kind.metricLabel()));
            }

            Job job = new Job(EgressIds.newEgressId(), request, config.getNodeId(), clock.millis());
            jobs.insert(job, publisher::publish);
            admission.jobStarted(kind);
            metricsService.recordAdmission(true);

            EgressInfo starting = job.getInfo();
            log.info("Accepted {} egress {} for room {}", kind, job.getEgressId(), request.getRoomId());

            launch(job);
            return Mono.just(starting);
        });
    }

    private void launch(Job job) {
        Mono.fromCallable(() -> executor.launch(job.getEgressId(), job.getRequest()))
            .subscribeOn(launchScheduler)
            .doOnNext(handle -> attach(job, handle))
            .flatMapMany(PipelineHandle::events)
            .subscribe(
                event -> onPipelineEvent(job, event),
                error -> {
                    log.error("Pipeline of egress {} failed", job.getEgressId(), error);
                    apply(job, EgressStatus.ABORTED, errorMessage(error));
                },
                () -> {
                    if (!job.getStatus().isTerminal()) {
                        log.warn("Pipeline of egress {} ended while {}", job.getEgressId(), job.getStatus());
                        apply(job, EgressStatus.ABORTED, UNEXPECTED_EXIT);
                    }
                }
            );
    }

    // A stop or kill can land before the handle is attached; each side re-checks the other.
    private void attach(Job job, PipelineHandle handle) {
        job.attachPipeline(handle);
        if (killRequested) {
            handle.kill();
        } else if (job.getStatus() == EgressStatus.ENDING) {
            handle.stop();
        }
    }

    private void onPipelineEvent(Job job, PipelineEvent event) {
        log.debug("Pipeline event for egress {}: {}", job.getEgressId(), event);
        switch (event.getType()) {
            case ACTIVE -> apply(job, EgressStatus.ACTIVE, null);
            case COMPLETE -> {
                // a job that never went active produced no output
                if (job.getInfo().getStartedAt() == 0) {
                    apply(job, EgressStatus.ABORTED, STOPPED_BEFORE_ACTIVE);
                    return;
                }
                // pipeline finished on its own: pass through ENDING
                if (job.getStatus().isStoppable()) {
                    apply(job, EgressStatus.ENDING, null);
                }
                apply(job, EgressStatus.COMPLETE, null);
            }
            case FAILED -> apply(job, EgressStatus.ABORTED, event.getError());
        }
    }

    private JobTable.Transition apply(Job job, EgressStatus next, String error) {
        JobTable.Transition transition = jobs.transition(job.getEgressId(), next, error, publisher::publish);
        if (transition.isApplied() && next.isTerminal()) {
            admission.jobEnded(job.getKind());
            metricsService.recordJobEnded(next);
            if (next == EgressStatus.ABORTED) {
                log.warn("Egress {} aborted: {}", job.getEgressId(), error);
            }
        }
        return transition;
    }

    @Override
    public Mono<EgressInfo> stop(String egressId) {
        return Mono.defer(() -> {
            Job job = jobs.get(egressId).orElse(null);
            if (job == null) {
                return Mono.error(EgressException.notFound(egressId));
            }
            if (!job.getStatus().isStoppable()) {
                return Mono.error(invalidStop(egressId, job.getStatus()));
            }

            JobTable.Transition transition = apply(job, EgressStatus.ENDING, null);
            switch (transition.outcome()) {
                case NOT_FOUND:
                    return Mono.error(EgressException.notFound(egressId));
                case REJECTED:
                    return Mono.error(invalidStop(egressId, transition.info().getStatus()));
                default:
                    break;
            }

            PipelineHandle pipeline = job.getPipeline();
            if (pipeline != null) {
                pipeline.stop();
            }
            log.info("Stopping egress {}", egressId);
            return Mono.just(transition.info());
        });
    }

    private static EgressException invalidStop(String egressId, EgressStatus status) {
        return EgressException.invalidState("egress " + egressId + " is " + status + " and cannot be stopped");
    }

    @Override
    public Flux<EgressInfo> list() {
        return Flux.defer(() -> Flux.fromIterable(jobs.snapshot()));
    }

    @Override
    public Mono<EgressInfo> get(String egressId) {
        return Mono.defer(() -> Mono.justOrEmpty(jobs.get(egressId).map(Job::getInfo)))
            .switchIfEmpty(Mono.error(() -> EgressException.notFound(egressId)));
    }

    @Override
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        for (Job job : jobs.activeJobs()) {
            EgressInfo info = job.getInfo();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", info.getStatus());
            entry.put("requestKind", info.getRequestKind());
            entry.put("roomId", info.getRoomId());
            entry.put("startedAt", info.getStartedAt());
            status.put(info.getEgressId(), entry);
        }
        status.put(CPU_LOAD_KEY, admission.getCpuLoad());
        return status;
    }

    @Override
    public Mono<Void> shutdown(boolean graceful) {
        return Mono.defer(() -> {
            if (!shuttingDown.compareAndSet(false, true)) {
                log.info("Shutdown already in progress");
            }
            log.info("Shutting down egress service (graceful={}, active jobs={})", graceful, jobs.activeCount());

            Mono<Void> drain = graceful
                ? awaitDrain()
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("{} egress jobs still running after {}, killing them",
                        jobs.activeCount(), config.getShutdownTimeout());
                    killAll();
                    return Mono.empty();
                })
                : Mono.fromRunnable(this::killAll);

            return drain
                .doOnSuccess(v -> log.info("Egress service stopped"))
                .doFinally(signal -> publisher.close());
        });
    }

    private Mono<Void> awaitDrain() {
        return Flux.interval(Duration.ZERO, DRAIN_POLL_INTERVAL, timerScheduler)
            .filter(tick -> jobs.activeCount() == 0)
            .next()
            .timeout(config.getShutdownTimeout(), timerScheduler)
            .then();
    }

    private void killAll() {
        killRequested = true;
        for (Job job : jobs.activeJobs()) {
            // abort first so the pipeline's stream completion finds the job already terminal
            apply(job, EgressStatus.ABORTED, SHUTDOWN_ABORT);
            PipelineHandle pipeline = job.getPipeline();
            if (pipeline != null) {
                pipeline.kill();
            }
        }
    }

    private static String errorMessage(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    @Override
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @Override
    public String getNodeId() {
        return config.getNodeId();
    }
}
