package com.powerscheduler.scheduler.http;

import com.powerscheduler.core.util.JsonUtils;
import com.powerscheduler.scheduler.config.SchedulerConfig;
import com.powerscheduler.scheduler.metrics.PrometheusMetricsExporter;
import com.powerscheduler.scheduler.scale.ScaleRequestHandler;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;

/**
 * HTTP server for scheduler endpoints.
 * <ul>
 *   <li>{@code GET /healthz}</li>
 *   <li>{@code GET /metrics} Prometheus scrape</li>
 *   <li>{@code POST /api/v1/scale} request JSON or Pub/Sub push envelope, returns the result JSON</li>
 * </ul>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SchedulerConfig config;
    private final ScaleRequestHandler handler;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(SchedulerConfig config, ScaleRequestHandler handler, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.handler = handler;
        this.metricsExporter = metricsExporter;
    }

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            .post("/api/v1/scale", (req, res) ->
                req.receive().aggregate().asString()
                    .defaultIfEmpty("")
                    .flatMap(handler::handle)
                    .flatMap(result -> res
                        .status(result.isFailed() ? HttpResponseStatus.INTERNAL_SERVER_ERROR : HttpResponseStatus.OK)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(JsonUtils.writeValueAsString(result)))
                        .then())
                    .onErrorResume(err -> {
                        log.error("Failed to handle scale request", err);
                        return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                            .sendString(Mono.just("{\"error\":\"Scale request failed\"}")).then();
                    })
            );
    }
}
