package com.powerscheduler.scheduler;

import com.powerscheduler.scheduler.compute.ComputeControlPlane;
import com.powerscheduler.scheduler.compute.GceComputeControlPlane;
import com.powerscheduler.scheduler.config.SchedulerConfig;
import com.powerscheduler.scheduler.discovery.InstanceDirectory;
import com.powerscheduler.scheduler.http.HttpServer;
import com.powerscheduler.scheduler.kafka.KafkaService;
import com.powerscheduler.scheduler.metrics.PrometheusMetricsExporter;
import com.powerscheduler.scheduler.scale.ScaleOrchestrator;
import com.powerscheduler.scheduler.scale.ScaleRequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

public class SchedulerApp {
    private static final Logger log = LoggerFactory.getLogger(SchedulerApp.class);

    public static void main(String[] args) {
        SchedulerConfig config = SchedulerConfig.fromEnv();

        log.info("Starting VM scheduler");
        log.info("  Default project: {}", config.getDefaultProjectId() == null ? "<unset>" : config.getDefaultProjectId());
        log.info("  Default labels: {}", config.getDefaultSelector().getLabels());
        log.info("  Default zones: {}", config.getDefaultZones());
        log.info("  Scale down: {}, scale up: {}",
            config.getScaleConfig().getScaleDownOperation(), config.getScaleConfig().getScaleUpOperation());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        ComputeControlPlane controlPlane = new GceComputeControlPlane();
        InstanceDirectory directory = new InstanceDirectory(controlPlane, metricsExporter.getRegistry());
        ScaleOrchestrator orchestrator = new ScaleOrchestrator(
            config,
            directory,
            controlPlane,
            metricsExporter.getRegistry()
        );
        ScaleRequestHandler handler = new ScaleRequestHandler(orchestrator);

        KafkaService kafkaService = null;
        if (config.isKafkaEnabled()) {
            kafkaService = new KafkaService(config, handler);
            kafkaService.start().block();
        } else {
            log.info("Kafka transport disabled, serving HTTP only");
        }

        HttpServer httpServer = new HttpServer(config, handler, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("VM scheduler is ready");

        handleShutDown(kafkaService, httpServer, controlPlane);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(KafkaService kafkaService, HttpServer httpServer, ComputeControlPlane controlPlane) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            if (kafkaService != null) {
                kafkaService.close();
            }

            httpServer.stop();

            controlPlane.close();

            log.info("Shutdown complete");
        }));
    }
}
