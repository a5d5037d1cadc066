package com.qqsuccubus.egress.node.rpc;

import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.error.ErrorCode;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.msg.RpcRequest;
import com.qqsuccubus.egress.core.msg.RpcResponse;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.node.service.IEgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps bus requests onto {@link IEgressService} calls.
 * <p>
 * Stop and get requests are broadcast to every node, so a node that does not own the job stays
 * silent (empty Mono) instead of answering NOT_FOUND. List requests are answered by every node
 * with its own jobs.
 * </p>
 */
public class RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final IEgressService service;

    public RequestDispatcher(IEgressService service) {
        this.service = service;
    }

    /**
     * @param request inbound request
     * @return response to publish, or empty when this node must not answer
     */
    public Mono<RpcResponse> dispatch(RpcRequest request) {
        if (request.getType() == null) {
            return Mono.just(RpcResponse.failure(request.getRequestId(), service.getNodeId(),
                EgressException.invalidArgument("request type missing")));
        }

        Mono<RpcResponse> response = switch (request.getType()) {
            case START -> service.start(request.getStart())
                .map(info -> single(request, info));
            case STOP -> ownedOnly(service.stop(request.getEgressId()))
                .map(info -> single(request, info));
            case GET -> ownedOnly(service.get(request.getEgressId()))
                .map(info -> single(request, info));
            case LIST -> service.list()
                .collectList()
                .map(infos -> multiple(request, infos));
        };

        return response
            .onErrorResume(EgressException.class, e -> {
                log.info("{} request {} failed: {} {}", request.getType(), request.getRequestId(),
                    e.getCode(), e.getMessage());
                RpcResponse failure = RpcResponse.failure(request.getRequestId(), service.getNodeId(), e);
                return Mono.just(request.getType() == RpcRequest.Type.START
                    ? failure.toBuilder().info(rejectedStart(request.getStart(), e)).build()
                    : failure);
            })
            .onErrorResume(e -> {
                log.error("{} request {} failed unexpectedly", request.getType(), request.getRequestId(), e);
                return Mono.just(RpcResponse.failure(request.getRequestId(), service.getNodeId(),
                    new EgressException(ErrorCode.INTERNAL, e.getMessage())));
            });
    }

    /**
     * A refused start still answers with an {@link EgressInfo}: no egress id, no status, and the
     * refusal reason in {@code error}.
     */
    private EgressInfo rejectedStart(StartEgressRequest start, EgressException e) {
        return EgressInfo.builder()
            .egressId("")
            .roomId(start == null ? null : start.getRoomId())
            .requestKind(start == null ? null : start.getKind())
            .error(e.getMessage())
            .nodeId(service.getNodeId())
            .build();
    }

    private static Mono<EgressInfo> ownedOnly(Mono<EgressInfo> call) {
        return call.onErrorResume(
            e -> e instanceof EgressException ee && ee.getCode() == ErrorCode.NOT_FOUND,
            e -> Mono.empty()
        );
    }

    private RpcResponse single(RpcRequest request, EgressInfo info) {
        return RpcResponse.builder()
            .requestId(request.getRequestId())
            .nodeId(service.getNodeId())
            .info(info)
            .ts(System.currentTimeMillis())
            .build();
    }

    private RpcResponse multiple(RpcRequest request, List<EgressInfo> infos) {
        return RpcResponse.builder()
            .requestId(request.getRequestId())
            .nodeId(service.getNodeId())
            .infos(infos)
            .ts(System.currentTimeMillis())
            .build();
    }
}
