package com.qqsuccubus.egress.node.pipeline;

import reactor.core.publisher.Flux;

/**
 * Control handle of one running pipeline.
 */
public interface PipelineHandle {

    /**
     * Lifecycle events of the pipeline. Completes after the terminal event.
     *
     * @return Flux of events, replayed to late subscribers
     */
    Flux<PipelineEvent> events();

    /**
     * Asks the pipeline to finish its output and exit. Cooperative: completion is reported
     * through {@link #events()}.
     */
    void stop();

    /**
     * Terminates the pipeline immediately. Only used when the whole node shuts down without grace.
     */
    void kill();
}
