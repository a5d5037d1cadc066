package com.qqsuccubus.egress.node.pipeline;

import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test stub for pipeline execution: tests drive each pipeline's events by hand.
 */
public class StubPipelineExecutor implements IPipelineExecutor {

    private final Map<String, StubPipeline> pipelines = new ConcurrentHashMap<>();
    private volatile RuntimeException launchFailure;

    @Override
    public PipelineHandle launch(String egressId, StartEgressRequest request) {
        if (launchFailure != null) {
            throw launchFailure;
        }
        StubPipeline pipeline = new StubPipeline();
        pipelines.put(egressId, pipeline);
        return pipeline;
    }

    public StubPipeline pipeline(String egressId) {
        return pipelines.get(egressId);
    }

    public void failLaunches(RuntimeException failure) {
        this.launchFailure = failure;
    }

    public int launched() {
        return pipelines.size();
    }

    public static class StubPipeline implements PipelineHandle {
        private final Sinks.Many<PipelineEvent> events = Sinks.many().replay().all();
        private volatile boolean stopRequested;
        private volatile boolean killed;

        @Override
        public Flux<PipelineEvent> events() {
            return events.asFlux();
        }

        @Override
        public void stop() {
            stopRequested = true;
        }

        @Override
        public void kill() {
            killed = true;
            events.tryEmitComplete();
        }

        public void running() {
            events.tryEmitNext(PipelineEvent.active());
        }

        public void finished() {
            events.tryEmitNext(PipelineEvent.complete());
            events.tryEmitComplete();
        }

        public void failed(String error) {
            events.tryEmitNext(PipelineEvent.failed(error));
            events.tryEmitComplete();
        }

        public void exitedSilently() {
            events.tryEmitComplete();
        }

        public void crashed(Throwable error) {
            events.tryEmitError(error);
        }

        public boolean isStopRequested() {
            return stopRequested;
        }

        public boolean isKilled() {
            return killed;
        }
    }
}
