package com.powerscheduler.scheduler.kafka;

import com.powerscheduler.core.model.ScaleResult;
import reactor.core.publisher.Mono;

/**
 * Kafka transport for scale requests and results (Dependency Inversion Principle).
 */
public interface IKafkaService {
    Mono<Void> start();
    Mono<Void> publishResult(String requestKey, ScaleResult result);
    void close();
}
