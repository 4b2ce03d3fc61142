package com.powerscheduler.scheduler.kafka;

import com.powerscheduler.core.model.ScaleResult;
import com.powerscheduler.core.msg.Topics;
import com.powerscheduler.core.util.JsonUtils;
import com.powerscheduler.scheduler.config.SchedulerConfig;
import com.powerscheduler.scheduler.scale.ScaleRequestHandler;
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
 * Consumes scale requests from {@link Topics#SCALE_REQUESTS} and publishes results to
 * {@link Topics#SCALE_RESULTS}.
 * <p>
 * Records are handled one at a time and acknowledged after their result is published
 * (or after a failure was logged), so one bad record never stalls the stream.
 * </p>
 */
public class KafkaService implements IKafkaService {
    private static final Logger log = LoggerFactory.getLogger(KafkaService.class);

    private static final int DEFAULT_PARTITIONS = 1;
    private static final short REPLICATION_FACTOR = 1;

    private final SchedulerConfig config;
    private final ScaleRequestHandler handler;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private KafkaReceiver<String, String> requestReceiver;
    private Disposable subscription;

    public KafkaService(SchedulerConfig config, ScaleRequestHandler handler) {
        this.config = config;
        this.handler = handler;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        SenderOptions<String, String> senderOptions = SenderOptions.create(producerProps);
        this.sender = KafkaSender.create(senderOptions);

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized");
    }

    @Override
    public Mono<Void> start() {
        return createTopicIfNotExists(Topics.SCALE_REQUESTS, DEFAULT_PARTITIONS, REPLICATION_FACTOR)
            .then(createTopicIfNotExists(Topics.SCALE_RESULTS, DEFAULT_PARTITIONS, REPLICATION_FACTOR))
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, config.getKafkaGroupId());
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(Topics.SCALE_REQUESTS));
                requestReceiver = KafkaReceiver.create(receiverOptions);

                subscription = listenToScaleRequests().subscribe();
                log.info("Kafka consumer started on {} (group {})", Topics.SCALE_REQUESTS, config.getKafkaGroupId());
            });
    }

    private Flux<ScaleResult> listenToScaleRequests() {
        return requestReceiver.receive()
            .concatMap(record -> handler.handle(record.value())
                .flatMap(result -> publishResult(record.key(), result).thenReturn(result))
                .doOnError(err -> log.error("Failed to process scale request at offset {}: {}",
                    record.offset(), err.getMessage(), err))
                .onErrorResume(err -> Mono.empty())
                .doFinally(signal -> acknowledge(record)));
    }

    private void acknowledge(ReceiverRecord<String, String> record) {
        record.receiverOffset().acknowledge();
    }

    @Override
    public Mono<Void> publishResult(String requestKey, ScaleResult result) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.SCALE_RESULTS,
            requestKey,
            JsonUtils.writeValueAsString(result)
        );

        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .doOnSuccess(r -> log.debug("Published scale result: processed={}", result.getProcessedCount()))
            .doOnError(err -> log.error("Failed to publish scale result", err))
            .then();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(newTopic))
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
    public void close() {
        if (subscription != null) {
            subscription.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka service closed");
    }
}
