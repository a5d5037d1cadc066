package com.qqsuccubus.egress.node.publish;

import com.qqsuccubus.egress.core.model.EgressInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * In-process update fan-out backed by a multicast sink.
 * <p>
 * Each subscriber gets its own unbounded buffer, so a slow consumer falls behind without losing
 * updates and without stalling the publisher. Updates published while nobody is subscribed are
 * dropped.
 * </p>
 */
public class UpdatePublisher implements IUpdatePublisher {
    private static final Logger log = LoggerFactory.getLogger(UpdatePublisher.class);

    private final Sinks.Many<EgressInfo> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(EgressInfo info) {
        log.debug("Publishing update: egressId={}, status={}", info.getEgressId(), info.getStatus());
        sink.emitNext(info, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }

    @Override
    public Flux<EgressInfo> subscribeAll() {
        return sink.asFlux().onBackpressureBuffer();
    }

    @Override
    public Flux<EgressInfo> subscribe(String egressId) {
        return sink.asFlux()
            .filter(info -> egressId.equals(info.getEgressId()))
            .onBackpressureBuffer();
    }

    @Override
    public void close() {
        sink.emitComplete(Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
        log.info("Update publisher closed");
    }

    public int currentSubscriberCount() {
        return sink.currentSubscriberCount();
    }
}
