package com.powerscheduler.scheduler.scale;

import com.powerscheduler.core.model.ScaleRequest;
import com.powerscheduler.core.model.ScaleResult;
import com.powerscheduler.core.msg.ScaleRequestDecoder;
import com.powerscheduler.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Entry point shared by the Kafka and HTTP transports: raw payload in, result out.
 */
public class ScaleRequestHandler {
    private static final Logger log = LoggerFactory.getLogger(ScaleRequestHandler.class);

    private final ScaleOrchestrator orchestrator;

    public ScaleRequestHandler(ScaleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Mono<ScaleResult> handle(String payload) {
        return Mono.fromSupplier(() -> ScaleRequestDecoder.decode(payload))
            .doOnNext(request -> log.info("Processing action: {}", request.getAction()))
            .flatMap(this::handleRequest);
    }

    public Mono<ScaleResult> handleRequest(ScaleRequest request) {
        return orchestrator.handle(request)
            .doOnNext(result -> log.info("Action completed: {}", JsonUtils.writeValueAsString(result)));
    }
}
