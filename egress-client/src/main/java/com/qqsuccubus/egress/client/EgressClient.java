package com.qqsuccubus.egress.client;

import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.msg.RpcRequest;
import com.qqsuccubus.egress.core.msg.RpcResponse;
import com.qqsuccubus.egress.core.msg.StartEgressRequest;
import com.qqsuccubus.egress.core.msg.Topics;
import com.qqsuccubus.egress.core.util.EgressIds;
import com.qqsuccubus.egress.core.util.JsonUtils;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverPartition;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Kafka RPC client for the egress fleet.
 * <p>
 * Requests carry this client's reply topic. A start request reaches one node through the shared
 * node group; stop and get are broadcast and answered only by the owning node, so silence until
 * the timeout means no node owns the job. List collects answers from every node for a fixed window.
 * </p>
 */
public class EgressClient implements IEgressClient {
    private static final Logger log = LoggerFactory.getLogger(EgressClient.class);

    private final ClientConfig config;
    private final String replyTopic;
    private final PendingRequests pending = new PendingRequests();

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private volatile Disposable replyConsumer;

    public EgressClient(ClientConfig config) {
        this.config = config;
        this.replyTopic = Topics.responseTopicFor(config.getClientId());

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);
    }

    @Override
    public Mono<Void> start() {
        return createTopicIfNotExists(replyTopic)
            .then(Mono.defer(() -> {
                Sinks.Empty<Void> assigned = Sinks.empty();
                ReceiverOptions<String, String> options = receiverOptions(
                    "egress-client-" + config.getClientId(), replyTopic, assigned);

                replyConsumer = KafkaReceiver.create(options)
                    .receive()
                    .doOnNext(record -> {
                        try {
                            pending.complete(JsonUtils.readValue(record.value(), RpcResponse.class));
                        } catch (Exception e) {
                            log.error("Skipping malformed response on {}: {}", replyTopic, e.getMessage());
                        }
                        record.receiverOffset().acknowledge();
                    })
                    .onErrorContinue((err, obj) -> log.error("Error in reply consumer loop", err))
                    .subscribe();

                return assigned.asMono();
            }))
            .timeout(config.getRequestTimeout())
            .doOnSuccess(v -> log.info("Egress client {} listening on {}", config.getClientId(), replyTopic));
    }

    @Override
    public Mono<EgressInfo> startEgress(StartEgressRequest request) {
        RpcRequest rpc = newRequest(RpcRequest.Type.START).withStart(request);
        return call(Topics.START_REQUESTS, request.getRoomId(), rpc)
            .switchIfEmpty(Mono.error(() -> EgressException.unavailable("no egress node answered the start request")));
    }

    @Override
    public Mono<EgressInfo> stopEgress(String egressId) {
        RpcRequest rpc = newRequest(RpcRequest.Type.STOP).withEgressId(egressId);
        return call(Topics.CONTROL_REQUESTS, egressId, rpc)
            .switchIfEmpty(Mono.error(() -> EgressException.notFound(egressId)));
    }

    @Override
    public Mono<EgressInfo> getEgress(String egressId) {
        RpcRequest rpc = newRequest(RpcRequest.Type.GET).withEgressId(egressId);
        return call(Topics.CONTROL_REQUESTS, egressId, rpc)
            .switchIfEmpty(Mono.error(() -> EgressException.notFound(egressId)));
    }

    @Override
    public Flux<EgressInfo> listEgress() {
        return Flux.defer(() -> {
            RpcRequest rpc = newRequest(RpcRequest.Type.LIST);
            Flux<RpcResponse> answers = pending.expectMany(rpc.getRequestId());

            return send(Topics.CONTROL_REQUESTS, rpc.getRequestId(), rpc)
                .thenMany(answers.take(config.getListWindow()))
                .filter(response -> {
                    if (response.isError()) {
                        log.warn("Node {} failed to list egress: {}", response.getNodeId(), response.getError());
                        return false;
                    }
                    return true;
                })
                .flatMapIterable(RpcResponse::getInfos);
        });
    }

    /**
     * Sends a single-answer request. Empty when nobody answers before the timeout.
     */
    private Mono<EgressInfo> call(String topic, String key, RpcRequest rpc) {
        return Mono.defer(() -> {
            Mono<RpcResponse> answer = pending.expectOne(rpc.getRequestId());

            return send(topic, key, rpc)
                .then(answer.timeout(config.getRequestTimeout(), Mono.empty()))
                .flatMap(response -> response.isError()
                    ? Mono.error(response.toException())
                    : Mono.just(response.getInfo()));
        });
    }

    private RpcRequest newRequest(RpcRequest.Type type) {
        return RpcRequest.builder()
            .requestId(EgressIds.newRequestId())
            .replyTo(replyTopic)
            .type(type)
            .ts(System.currentTimeMillis())
            .build();
    }

    private Mono<Void> send(String topic, String key, RpcRequest rpc) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, JsonUtils.writeValueAsString(rpc));
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .retry(3)
            .doOnNext(result -> log.debug("Sent {} request {} to {}", rpc.getType(), rpc.getRequestId(), topic))
            .then();
    }

    @Override
    public UpdateSubscription subscribeUpdates() {
        return openSubscription(info -> true);
    }

    @Override
    public UpdateSubscription subscribeUpdates(String egressId) {
        return openSubscription(info -> egressId.equals(info.getEgressId()));
    }

    private UpdateSubscription openSubscription(Predicate<EgressInfo> filter) {
        Sinks.Empty<Void> assigned = Sinks.empty();
        // Fresh group per subscription: every subscriber sees every update
        String groupId = "egress-updates-" + config.getClientId() + "-" + UUID.randomUUID();

        Flux<EgressInfo> source = KafkaReceiver.create(receiverOptions(groupId, Topics.UPDATES, assigned))
            .receive()
            .flatMap(record -> {
                record.receiverOffset().acknowledge();
                try {
                    return Mono.just(JsonUtils.readValue(record.value(), EgressInfo.class));
                } catch (Exception e) {
                    log.error("Skipping malformed update: {}", e.getMessage());
                    return Mono.empty();
                }
            }, 1)
            .filter(filter);

        return new UpdateSubscription(source, assigned.asMono());
    }

    private ReceiverOptions<String, String> receiverOptions(String groupId, String topic, Sinks.Empty<Void> assigned) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        return ReceiverOptions.<String, String>create(props)
            .subscription(Collections.singleton(topic))
            .addAssignListener(partitions -> {
                // resolve "latest" now so nothing sent after this point is skipped
                partitions.forEach(ReceiverPartition::position);
                assigned.tryEmitEmpty();
            });
    }

    private Mono<Void> createTopicIfNotExists(String topicName) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }
                log.info("Creating reply topic: {}", topicName);
                return Mono.fromFuture(() -> adminClient.createTopics(Collections.singleton(
                        new NewTopic(topicName, 1, (short) 1)))
                    .all()
                    .toCompletionStage()
                    .toCompletableFuture());
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    return Mono.empty();
                }
                log.error("Failed to create reply topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        if (replyConsumer != null) {
            replyConsumer.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Egress client {} closed", config.getClientId());
    }
}
