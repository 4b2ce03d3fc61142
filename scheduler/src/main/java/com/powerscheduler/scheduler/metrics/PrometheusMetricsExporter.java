package com.powerscheduler.scheduler.metrics;

import com.powerscheduler.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus metrics exporter attached to the global Micrometer registry.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        CompositeMeterRegistry composite = Metrics.globalRegistry;
        this.registry = composite;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheusRegistry);

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized with global registry + Prometheus");
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
