package com.qqsuccubus.egress.client;

import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Caller side of the egress fleet. Failures arrive as
 * {@link com.qqsuccubus.egress.core.error.EgressException} signals.
 */
public interface IEgressClient extends AutoCloseable {

    /**
     * Creates the reply topic and starts listening on it.
     *
     * @return Mono completing when responses can be received
     */
    Mono<Void> start();

    /**
     * @param request start request
     * @return the new job in STARTING state; UNAVAILABLE when no node answers in time
     */
    Mono<EgressInfo> startEgress(StartEgressRequest request);

    /**
     * @param egressId job id
     * @return the job in ENDING state; NOT_FOUND when no node owns it
     */
    Mono<EgressInfo> stopEgress(String egressId);

    /**
     * @param egressId job id
     * @return the job; NOT_FOUND when no node owns it
     */
    Mono<EgressInfo> getEgress(String egressId);

    /**
     * @return jobs of every node that answered within the collection window
     */
    Flux<EgressInfo> listEgress();

    UpdateSubscription subscribeUpdates();

    UpdateSubscription subscribeUpdates(String egressId);

    @Override
    void close();
}
