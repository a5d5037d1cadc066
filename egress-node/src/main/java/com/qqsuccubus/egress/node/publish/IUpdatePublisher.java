package com.qqsuccubus.egress.node.publish;

import com.qqsuccubus.egress.core.model.EgressInfo;
import reactor.core.publisher.Flux;

/**
 * Fan-out of egress lifecycle updates to live subscribers.
 */
public interface IUpdatePublisher {

    /**
     * Delivers an update to every subscriber connected right now. Never blocks on slow subscribers.
     *
     * @param info job snapshot after a transition
     */
    void publish(EgressInfo info);

    /**
     * @return updates of every job, from the moment of subscription
     */
    Flux<EgressInfo> subscribeAll();

    /**
     * @param egressId job id
     * @return updates of one job, from the moment of subscription
     */
    Flux<EgressInfo> subscribe(String egressId);

    /**
     * Completes every open subscription.
     */
    void close();
}
