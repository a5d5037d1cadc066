package com.qqsuccubus.egress.client;

import com.qqsuccubus.egress.core.msg.RpcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Correlates responses arriving on the reply topic with the requests waiting for them.
 * <p>
 * Single-answer requests take the first response and ignore the rest. Collecting requests (list)
 * take every response until the caller stops listening.
 * </p>
 */
public class PendingRequests {
    private static final Logger log = LoggerFactory.getLogger(PendingRequests.class);

    private final Map<String, Sinks.One<RpcResponse>> singles = new ConcurrentHashMap<>();
    private final Map<String, Sinks.Many<RpcResponse>> collectors = new ConcurrentHashMap<>();

    /**
     * Registers a request expecting one answer. Call before sending the request.
     *
     * @param requestId request id
     * @return Mono of the first answer; the registration is dropped when it terminates or is cancelled
     */
    public Mono<RpcResponse> expectOne(String requestId) {
        Sinks.One<RpcResponse> sink = Sinks.one();
        singles.put(requestId, sink);
        return sink.asMono().doFinally(signal -> singles.remove(requestId));
    }

    /**
     * Registers a request answered by many nodes. Call before sending the request.
     *
     * @param requestId request id
     * @return Flux of answers; the registration is dropped when it terminates or is cancelled
     */
    public Flux<RpcResponse> expectMany(String requestId) {
        Sinks.Many<RpcResponse> sink = Sinks.many().unicast().onBackpressureBuffer();
        collectors.put(requestId, sink);
        return sink.asFlux().doFinally(signal -> collectors.remove(requestId));
    }

    /**
     * Hands a response to whoever waits for it.
     *
     * @param response response from the reply topic
     * @return true if a waiting request took it
     */
    public boolean complete(RpcResponse response) {
        String requestId = response.getRequestId();
        if (requestId == null) {
            return false;
        }

        Sinks.One<RpcResponse> single = singles.get(requestId);
        if (single != null) {
            return single.tryEmitValue(response).isSuccess();
        }

        Sinks.Many<RpcResponse> collector = collectors.get(requestId);
        if (collector != null) {
            return collector.tryEmitNext(response).isSuccess();
        }

        log.debug("Dropping response to unknown or finished request {}", requestId);
        return false;
    }

    public int size() {
        return singles.size() + collectors.size();
    }
}
