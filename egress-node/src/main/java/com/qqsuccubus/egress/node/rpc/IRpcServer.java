package com.qqsuccubus.egress.node.rpc;

import reactor.core.publisher.Mono;

/**
 * Message bus side of an egress node: request consumers, response producer and the update bridge.
 */
public interface IRpcServer {

    /**
     * Creates missing topics and starts consuming.
     *
     * @return Mono completing when consumers are subscribed
     */
    Mono<Void> start();

    /**
     * Stops taking new start requests. Control requests are still served.
     */
    void stopAcceptingStarts();

    /**
     * Stops consumers, producer and admin client.
     *
     * @return Mono completing when stopped
     */
    Mono<Void> stop();
}
