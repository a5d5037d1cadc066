package com.qqsuccubus.egress.node.service;

import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Egress operations of one node.
 * <p>
 * Failures reach the caller as {@link com.qqsuccubus.egress.core.error.EgressException} signals.
 * Pipeline failures are never errors here: they show up as an ABORTED job.
 * </p>
 */
public interface IEgressService {

    /**
     * Admits and launches a new job.
     *
     * @param request start request
     * @return the job in STARTING state, or RESOURCE_EXHAUSTED / INVALID_ARGUMENT / SHUTTING_DOWN
     */
    Mono<EgressInfo> start(StartEgressRequest request);

    /**
     * Asks a running job to finish. Completion is reported asynchronously.
     *
     * @param egressId job id
     * @return the job in ENDING state, or NOT_FOUND / INVALID_STATE
     */
    Mono<EgressInfo> stop(String egressId);

    /**
     * @return every job still held by this node, including recently finished ones
     */
    Flux<EgressInfo> list();

    /**
     * @param egressId job id
     * @return the job, or NOT_FOUND
     */
    Mono<EgressInfo> get(String egressId);

    /**
     * Non-terminal jobs keyed by egress id plus the node's {@code CpuLoad} in percent.
     *
     * @return status document
     */
    Map<String, Object> status();

    /**
     * Stops accepting new jobs and winds down the running ones.
     *
     * @param graceful wait for running jobs to finish (bounded) instead of killing them
     * @return Mono completing once no job is running
     */
    Mono<Void> shutdown(boolean graceful);

    boolean isShuttingDown();

    String getNodeId();
}
