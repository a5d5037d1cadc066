package com.qqsuccubus.egress.node.rpc;

import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.msg.RpcRequest;
import com.qqsuccubus.egress.core.msg.RpcResponse;
import com.qqsuccubus.egress.core.msg.Topics;
import com.qqsuccubus.egress.core.util.JsonUtils;
import com.qqsuccubus.egress.node.config.EgressConfig;
import com.qqsuccubus.egress.node.metrics.MetricsService;
import com.qqsuccubus.egress.node.publish.IUpdatePublisher;
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
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka transport of an egress node.
 * <p>
 * Start requests are consumed in the shared node group, so exactly one node handles each of them.
 * Control requests (stop, get, list) are consumed by every node under its own group id. Responses
 * go to the topic named in the request's {@code replyTo}. Every published update is forwarded to
 * {@link Topics#UPDATES} keyed by egress id, which keeps one job's updates in one partition.
 * </p>
 */
public class KafkaRpcServer implements IRpcServer {
    private static final Logger log = LoggerFactory.getLogger(KafkaRpcServer.class);

    private static final int START_PARTITIONS = 6;
    private static final int CONTROL_PARTITIONS = 1;
    private static final int UPDATE_PARTITIONS = 6;
    private static final short REPLICATION_FACTOR = 1;    // 1 for dev, 3+ for prod
    private static final int HANDLER_CONCURRENCY = 16;

    private final EgressConfig config;
    private final RequestDispatcher dispatcher;
    private final IUpdatePublisher publisher;
    private final MetricsService metricsService;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    private volatile Disposable startConsumer;
    private volatile Disposable controlConsumer;
    private volatile Disposable updateBridge;

    public KafkaRpcServer(EgressConfig config, RequestDispatcher dispatcher,
                          IUpdatePublisher publisher, MetricsService metricsService) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.publisher = publisher;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized");
    }

    @Override
    public Mono<Void> start() {
        String nodeId = config.getNodeId();

        return createTopicIfNotExists(Topics.START_REQUESTS, START_PARTITIONS, REPLICATION_FACTOR)
            .then(createTopicIfNotExists(Topics.CONTROL_REQUESTS, CONTROL_PARTITIONS, REPLICATION_FACTOR))
            .then(createTopicIfNotExists(Topics.UPDATES, UPDATE_PARTITIONS, REPLICATION_FACTOR))
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                KafkaReceiver<String, String> startReceiver = KafkaReceiver.create(
                    receiverOptions(Topics.NODE_GROUP, Topics.START_REQUESTS, "earliest"));
                KafkaReceiver<String, String> controlReceiver = KafkaReceiver.create(
                    receiverOptions("egress-control-" + nodeId, Topics.CONTROL_REQUESTS, "latest"));

                startConsumer = listen(startReceiver, Topics.START_REQUESTS).subscribe();
                controlConsumer = listen(controlReceiver, Topics.CONTROL_REQUESTS).subscribe();
                updateBridge = bridgeUpdates().subscribe();

                log.info("Node {} consuming {} (group {}) and {}", nodeId,
                    Topics.START_REQUESTS, Topics.NODE_GROUP, Topics.CONTROL_REQUESTS);
            });
    }

    private ReceiverOptions<String, String> receiverOptions(String groupId, String topic, String offsetReset) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, offsetReset);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        return ReceiverOptions.<String, String>create(props)
            .subscription(Collections.singleton(topic));
    }

    private Flux<Void> listen(KafkaReceiver<String, String> receiver, String topic) {
        return receiver.receive()
            .flatMap(record -> handle(record)
                    .doFinally(signal -> record.receiverOffset().acknowledge()),
                HANDLER_CONCURRENCY)
            .onErrorContinue((err, obj) -> log.error("Error in {} consumer loop", topic, err));
    }

    private Mono<Void> handle(ReceiverRecord<String, String> record) {
        long startNanos = System.nanoTime();
        RpcRequest request;
        try {
            request = JsonUtils.readValue(record.value(), RpcRequest.class);
        } catch (Exception e) {
            log.error("Skipping malformed request on {}: {}", record.topic(), e.getMessage());
            return Mono.empty();
        }

        log.info("Request received: type={}, requestId={}, egressId={}",
            request.getType(), request.getRequestId(), request.getEgressId());

        return dispatcher.dispatch(request)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(response -> reply(request, response))
            .doOnSuccess(v -> metricsService.recordRequestLatency(startNanos))
            .onErrorResume(err -> {
                log.error("Failed to answer request {}", request.getRequestId(), err);
                return Mono.empty();
            });
    }

    private Mono<Void> reply(RpcRequest request, RpcResponse response) {
        if (request.getReplyTo() == null || request.getReplyTo().isBlank()) {
            log.warn("Request {} has no reply topic, dropping response", request.getRequestId());
            return Mono.empty();
        }
        return send(request.getReplyTo(), request.getRequestId(), JsonUtils.writeValueAsString(response))
            .doOnSuccess(v -> log.debug("Replied to {} on {}", request.getRequestId(), request.getReplyTo()));
    }

    private Flux<Void> bridgeUpdates() {
        return publisher.subscribeAll()
            .concatMap(this::publishUpdate)
            .onErrorContinue((err, obj) -> log.error("Error forwarding egress update", err));
    }

    private Mono<Void> publishUpdate(EgressInfo info) {
        long startNanos = System.nanoTime();
        return send(Topics.UPDATES, info.getEgressId(), JsonUtils.writeValueAsString(info))
            .doOnSuccess(v -> metricsService.recordKafkaPublishLatency(startNanos))
            .onErrorResume(err -> {
                log.warn("Failed to publish update for egress {} ({}): {}",
                    info.getEgressId(), info.getStatus(), err.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> send(String topic, String key, String json) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, json);
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .retry(3)
            .then();
    }

    /**
     * Creates a Kafka topic if it doesn't already exist. Idempotent.
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(
                            new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void stopAcceptingStarts() {
        if (startConsumer != null) {
            startConsumer.dispose();
            log.info("Stopped consuming {}", Topics.START_REQUESTS);
        }
    }

    @Override
    public Mono<Void> stop() {
        stopAcceptingStarts();
        if (controlConsumer != null) {
            controlConsumer.dispose();
        }
        if (updateBridge != null) {
            updateBridge.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka RPC server stopped");
        return Mono.empty();
    }
}
