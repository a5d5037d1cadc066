package com.qqsuccubus.egress.node.service;

import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.error.ErrorCode;
import com.qqsuccubus.egress.core.model.CpuCostConfig;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.model.EgressStatus;
import com.qqsuccubus.egress.core.model.RequestKind;
import com.qqsuccubus.egress.core.msg.EgressPayload;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.node.admission.AdmissionController;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.job.JobTable;
import com.qqsuccubus.egress.node.metrics.MetricsService;
import com.qqsuccubus.egress.node.pipeline.StubPipelineExecutor;
import com.qqsuccubus.egress.node.publish.UpdatePublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Service tests against a stub pipeline executor; timers run on virtual time.
 */
class EgressServiceTest {

    private static final Duration EVICTION = Duration.ofSeconds(10);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

    private VirtualTimeScheduler scheduler;
    private AdmissionController admission;
    private JobTable jobs;
    private UpdatePublisher publisher;
    private StubPipelineExecutor executor;
    private MetricsService metricsService;
    private EgressService service;
    private List<EgressInfo> updates;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        EgressConfig config = EgressConfig.builder()
            .nodeId("node-1")
            .cpuCost(CpuCostConfig.defaults())
            .reservationHold(Duration.ofSeconds(1))
            .evictionDelay(EVICTION)
            .shutdownTimeout(SHUTDOWN_TIMEOUT)
            .build();

        admission = new AdmissionController(config.getCpuCost(), 4, config.getReservationHold(),
            scheduler, registry);
        jobs = new JobTable(EVICTION, scheduler, Clock.systemUTC(), registry);
        publisher = new UpdatePublisher();
        executor = new StubPipelineExecutor();
        metricsService = new MetricsService(registry);

        service = new EgressService(config, admission, jobs, publisher, executor, metricsService,
            scheduler, Schedulers.immediate(), Clock.systemUTC());

        updates = new CopyOnWriteArrayList<>();
        publisher.subscribeAll().subscribe(updates::add);
    }

    private static StartEgressRequest roomComposite() {
        return new StartEgressRequest("room-1", "ws://media:7880",
            new EgressPayload.RoomComposite("room-1", "grid", false, "/out/room-1.mp4"));
    }

    private static StartEgressRequest track() {
        return new StartEgressRequest("room-2", "ws://media:7880",
            new EgressPayload.Track("room-2", "TR_1", "/out/track.ogg"));
    }

    private List<EgressStatus> statusesOf(String egressId) {
        return updates.stream()
            .filter(info -> info.getEgressId().equals(egressId))
            .map(EgressInfo::getStatus)
            .toList();
    }

    private static boolean hasCode(Throwable error, ErrorCode code) {
        return error instanceof EgressException e && e.getCode() == code;
    }

    @Test
    void testFullLifecycle_ThenEvicted() {
        EgressInfo starting = service.start(roomComposite()).block();
        assertEquals(EgressStatus.STARTING, starting.getStatus());
        assertEquals(RequestKind.ROOM_COMPOSITE, starting.getRequestKind());
        assertEquals("node-1", starting.getNodeId());
        String egressId = starting.getEgressId();
        assertTrue(egressId.startsWith("EG_"));

        StubPipelineExecutor.StubPipeline pipeline = executor.pipeline(egressId);
        pipeline.running();
        assertEquals(EgressStatus.ACTIVE, service.get(egressId).block().getStatus());

        EgressInfo ending = service.stop(egressId).block();
        assertEquals(EgressStatus.ENDING, ending.getStatus());
        assertTrue(pipeline.isStopRequested());

        pipeline.finished();

        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ACTIVE, EgressStatus.ENDING, EgressStatus.COMPLETE),
            statusesOf(egressId));
        EgressInfo complete = updates.get(updates.size() - 1);
        assertTrue(complete.getStartedAt() > 0);
        assertTrue(complete.getEndedAt() >= complete.getStartedAt());
        assertEquals("", complete.getError());
        assertEquals(1.0, metricsService.getCompletedCount());
        assertEquals(0, admission.getActiveRequests(RequestKind.ROOM_COMPOSITE));

        assertTrue(service.list().map(EgressInfo::getEgressId).collectList().block().contains(egressId));

        scheduler.advanceTimeBy(EVICTION);

        assertFalse(service.list().map(EgressInfo::getEgressId).collectList().block().contains(egressId));
        StepVerifier.create(service.get(egressId))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.NOT_FOUND))
            .verify();
    }

    @Test
    void testStart_RejectedWhileReservationHeld() {
        admission.onIdleSample(4);

        StepVerifier.create(service.start(roomComposite()))
            .expectNextMatches(info -> info.getStatus() == EgressStatus.STARTING)
            .verifyComplete();
        assertEquals(3.0, admission.getState().getPendingReservation(), 1e-9);

        StepVerifier.create(service.start(roomComposite()))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.RESOURCE_EXHAUSTED))
            .verify();
        assertEquals(1, jobs.size());
        assertEquals(1, executor.launched());
        assertEquals(1.0, metricsService.getRejectedCount());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        StepVerifier.create(service.start(roomComposite()))
            .expectNextMatches(info -> info.getStatus() == EgressStatus.STARTING)
            .verifyComplete();
        assertEquals(2, jobs.size());
    }

    @Test
    void testStart_ConcurrentStartsAdmitOnlyOne() throws Exception {
        admission.onIdleSample(4);
        CountDownLatch go = new CountDownLatch(1);
        int callers = 8;

        CompletableFuture<List<Boolean>> results = Flux.range(0, callers)
            .flatMap(i -> Mono.fromCallable(() -> {
                    go.await();
                    return roomComposite();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(service::start)
                .map(info -> true)
                .onErrorResume(e -> hasCode(e, ErrorCode.RESOURCE_EXHAUSTED), e -> Mono.just(false)), callers)
            .collectList()
            .toFuture();
        go.countDown();

        List<Boolean> accepted = results.get(10, TimeUnit.SECONDS);
        assertEquals(callers, accepted.size());
        assertEquals(1, accepted.stream().filter(Boolean::booleanValue).count());
        assertEquals(3.0, admission.getState().getPendingReservation(), 1e-9);
        assertEquals(1, jobs.size());
        assertEquals(1, executor.launched());
    }

    @Test
    void testStart_InvalidRequest() {
        StepVerifier.create(service.start(new StartEgressRequest("room-1", "ws://media", null)))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.INVALID_ARGUMENT))
            .verify();
        StepVerifier.create(service.start(new StartEgressRequest(" ", "ws://media",
                new EgressPayload.Web("https://example.com", false, "/out/web.mp4"))))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.INVALID_ARGUMENT))
            .verify();
        assertEquals(0, jobs.size());
    }

    @Test
    void testStop_BeforeActive() {
        String egressId = service.start(track()).block().getEgressId();

        service.stop(egressId).block();
        executor.pipeline(egressId).running();
        executor.pipeline(egressId).finished();

        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ENDING, EgressStatus.ABORTED),
            statusesOf(egressId));
        EgressInfo info = service.get(egressId).block();
        assertEquals(EgressService.STOPPED_BEFORE_ACTIVE, info.getError());
        assertEquals(0, info.getStartedAt());
        assertEquals(1.0, metricsService.getAbortedCount());
    }

    @Test
    void testStop_BeforeActiveWithoutActiveEvent() {
        String egressId = service.start(track()).block().getEgressId();

        service.stop(egressId).block();
        executor.pipeline(egressId).finished();

        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ENDING, EgressStatus.ABORTED),
            statusesOf(egressId));
        assertEquals(0, admission.getActiveRequests(RequestKind.TRACK));
    }

    @Test
    void testStop_AlreadyEndingOrTerminalProducesNoTransition() {
        String egressId = service.start(track()).block().getEgressId();
        service.stop(egressId).block();
        int published = updates.size();

        StepVerifier.create(service.stop(egressId))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.INVALID_STATE))
            .verify();
        assertEquals(published, updates.size());

        executor.pipeline(egressId).finished();
        published = updates.size();

        StepVerifier.create(service.stop(egressId))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.INVALID_STATE))
            .verify();
        assertEquals(published, updates.size());

        scheduler.advanceTimeBy(EVICTION);

        StepVerifier.create(service.stop(egressId))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.NOT_FOUND))
            .verify();
    }

    @Test
    void testStop_UnknownJob() {
        StepVerifier.create(service.stop("EG_unknown"))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.NOT_FOUND))
            .verify();
    }

    @Test
    void testPipelineFailure_Aborts() {
        String egressId = service.start(track()).block().getEgressId();
        executor.pipeline(egressId).running();

        executor.pipeline(egressId).failed("output bucket not writable");

        EgressInfo aborted = service.get(egressId).block();
        assertEquals(EgressStatus.ABORTED, aborted.getStatus());
        assertEquals("output bucket not writable", aborted.getError());
        assertTrue(aborted.getEndedAt() > 0);
        assertEquals(1.0, metricsService.getAbortedCount());
        assertEquals(0, admission.getActiveRequests(RequestKind.TRACK));
    }

    @Test
    void testPipelineStreamError_Aborts() {
        String egressId = service.start(track()).block().getEgressId();

        executor.pipeline(egressId).crashed(new IllegalStateException("handler lost"));

        EgressInfo aborted = service.get(egressId).block();
        assertEquals(EgressStatus.ABORTED, aborted.getStatus());
        assertEquals("handler lost", aborted.getError());
    }

    @Test
    void testPipelineExitWithoutResult_Aborts() {
        String egressId = service.start(track()).block().getEgressId();
        executor.pipeline(egressId).running();

        executor.pipeline(egressId).exitedSilently();

        EgressInfo aborted = service.get(egressId).block();
        assertEquals(EgressStatus.ABORTED, aborted.getStatus());
        assertEquals(EgressService.UNEXPECTED_EXIT, aborted.getError());
    }

    @Test
    void testPipelineLaunchFailure_Aborts() {
        executor.failLaunches(new IllegalStateException("handler binary missing"));

        EgressInfo starting = service.start(track()).block();

        assertEquals(EgressStatus.STARTING, starting.getStatus());
        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ABORTED), statusesOf(starting.getEgressId()));
        assertEquals("handler binary missing", service.get(starting.getEgressId()).block().getError());
    }

    @Test
    void testPipelineFinishingOnItsOwn_PassesThroughEnding() {
        String egressId = service.start(track()).block().getEgressId();
        executor.pipeline(egressId).running();

        executor.pipeline(egressId).finished();

        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ACTIVE, EgressStatus.ENDING, EgressStatus.COMPLETE),
            statusesOf(egressId));
    }

    @Test
    void testStatus_IdleNodeOnlyReportsCpuLoad() {
        admission.onIdleSample(3);

        Map<String, Object> status = service.status();

        assertEquals(Map.of(EgressService.CPU_LOAD_KEY, 25.0), status);
    }

    @Test
    void testStatus_ListsRunningJobsOnly() {
        String running = service.start(track()).block().getEgressId();
        executor.pipeline(running).running();
        String failed = service.start(track()).block().getEgressId();
        executor.pipeline(failed).failed("boom");

        Map<String, Object> status = service.status();

        assertEquals(2, status.size());
        assertTrue(status.containsKey(EgressService.CPU_LOAD_KEY));
        Map<?, ?> entry = assertInstanceOf(Map.class, status.get(running));
        assertEquals(EgressStatus.ACTIVE, entry.get("status"));
        assertEquals(RequestKind.TRACK, entry.get("requestKind"));
        assertEquals("room-2", entry.get("roomId"));
        assertFalse(status.containsKey(failed));
    }

    @Test
    void testGracefulShutdown_WaitsForRunningJobs() {
        String egressId = service.start(track()).block().getEgressId();
        executor.pipeline(egressId).running();

        AtomicBoolean done = new AtomicBoolean();
        service.shutdown(true).subscribe(v -> { }, e -> { }, () -> done.set(true));

        assertTrue(service.isShuttingDown());
        StepVerifier.create(service.start(track()))
            .expectErrorMatches(e -> hasCode(e, ErrorCode.SHUTTING_DOWN))
            .verify();

        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertFalse(done.get());

        service.stop(egressId).block();
        executor.pipeline(egressId).finished();
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertTrue(done.get());
        assertFalse(executor.pipeline(egressId).isKilled());
        assertEquals(EgressStatus.COMPLETE, service.get(egressId).block().getStatus());
    }

    @Test
    void testGracefulShutdown_KillsAfterTimeout() {
        String egressId = service.start(track()).block().getEgressId();
        executor.pipeline(egressId).running();

        AtomicBoolean done = new AtomicBoolean();
        service.shutdown(true).subscribe(v -> { }, e -> { }, () -> done.set(true));

        scheduler.advanceTimeBy(SHUTDOWN_TIMEOUT);

        assertTrue(done.get());
        assertTrue(executor.pipeline(egressId).isKilled());
        EgressInfo aborted = service.get(egressId).block();
        assertEquals(EgressStatus.ABORTED, aborted.getStatus());
        assertEquals(EgressService.SHUTDOWN_ABORT, aborted.getError());
    }

    @Test
    void testForcedShutdown_KillsEverything() {
        String first = service.start(track()).block().getEgressId();
        executor.pipeline(first).running();
        String second = service.start(track()).block().getEgressId();

        StepVerifier.create(publisher.subscribeAll())
            .then(() -> service.shutdown(false).block())
            .expectNextMatches(info -> info.getStatus() == EgressStatus.ABORTED)
            .expectNextMatches(info -> info.getStatus() == EgressStatus.ABORTED)
            .verifyComplete();

        assertTrue(executor.pipeline(first).isKilled());
        assertTrue(executor.pipeline(second).isKilled());
        assertEquals(0, jobs.activeCount());
        assertEquals(List.of(EgressStatus.STARTING, EgressStatus.ACTIVE, EgressStatus.ABORTED), statusesOf(first));
    }
}
