package com.qqsuccubus.egress.node.pipeline;

import com.qqsuccubus.egress.core.msg.EgressPayload;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs real processes, so it relies on standard POSIX tools.
 */
@DisabledOnOs(OS.WINDOWS)
class ProcessPipelineExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private static final StartEgressRequest REQUEST = new StartEgressRequest("room-1", "ws://media",
        new EgressPayload.Track("room-1", "TR_1", "/out/track.ogg"));

    private static PipelineHandle launch(String command) {
        return new ProcessPipelineExecutor(command, Schedulers.boundedElastic()).launch("EG_test", REQUEST);
    }

    @Test
    void testSuccessfulExit_Completes() {
        StepVerifier.create(launch("cat").events())
            .expectNext(PipelineEvent.active())
            .expectNext(PipelineEvent.complete())
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void testNonZeroExit_Fails() {
        StepVerifier.create(launch("false").events())
            .expectNext(PipelineEvent.active())
            .assertNext(event -> {
                assertTrue(event.getType() == PipelineEvent.Type.FAILED);
                assertTrue(event.getError().contains("code 1"), event.getError());
            })
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void testMissingHandler_FailsWithoutActive() {
        StepVerifier.create(launch("/nonexistent/egress-handler").events())
            .assertNext(event -> {
                assertTrue(event.getType() == PipelineEvent.Type.FAILED);
                assertTrue(event.getError().startsWith("failed to launch handler"), event.getError());
            })
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void testStop_CompletesRunningHandler() {
        PipelineHandle handle = launch("sleep 30");

        StepVerifier.create(handle.events())
            .expectNext(PipelineEvent.active())
            .then(handle::stop)
            .expectNext(PipelineEvent.complete())
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void testKill_EndsWithoutResult() {
        PipelineHandle handle = launch("sleep 30");

        StepVerifier.create(handle.events())
            .expectNext(PipelineEvent.active())
            .then(handle::kill)
            .expectComplete()
            .verify(TIMEOUT);
    }
}
