package com.qqsuccubus.egress.client;

import com.qqsuccubus.egress.core.model.EgressInfo;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * An open stream of egress updates. Updates published before it was {@link #ready()} are not seen.
 */
public class UpdateSubscription implements AutoCloseable {

    private final Sinks.Many<EgressInfo> updates = Sinks.many().unicast().onBackpressureBuffer();
    private final Mono<Void> ready;
    private final Disposable source;

    /**
     * @param source updates to relay, subscribed immediately
     * @param ready  completes once the source receives live updates
     */
    public UpdateSubscription(Flux<EgressInfo> source, Mono<Void> ready) {
        this.ready = ready;
        this.source = source.subscribe(
            info -> updates.emitNext(info, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100))),
            updates::tryEmitError,
            updates::tryEmitComplete
        );
    }

    /**
     * @return updates in arrival order, one subscriber only
     */
    public Flux<EgressInfo> updates() {
        return updates.asFlux();
    }

    public Mono<Void> ready() {
        return ready;
    }

    /**
     * Stops receiving and completes {@link #updates()}.
     */
    @Override
    public void close() {
        source.dispose();
        updates.tryEmitComplete();
    }

    public boolean isClosed() {
        return source.isDisposed();
    }
}
