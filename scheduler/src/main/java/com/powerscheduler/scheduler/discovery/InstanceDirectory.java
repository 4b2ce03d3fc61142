package com.powerscheduler.scheduler.discovery;

import com.powerscheduler.core.label.LabelMatcher;
import com.powerscheduler.core.metrics.MetricsNames;
import com.powerscheduler.core.metrics.MetricsTags;
import com.powerscheduler.core.model.InstanceRef;
import com.powerscheduler.core.model.InstanceState;
import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.scheduler.compute.ComputeControlPlane;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Label-based instance discovery over the compute control plane.
 * <p>
 * Each zone is listed independently. A zone that fails (unreachable, permission
 * denied, ...) is logged and treated as empty so healthy zones are still acted on.
 * </p>
 * <p>
 * An empty selector matches nothing here: listing is skipped entirely rather than
 * returning every instance in the project.
 * </p>
 */
public class InstanceDirectory implements IInstanceDirectory {
    private static final Logger log = LoggerFactory.getLogger(InstanceDirectory.class);

    private final ComputeControlPlane controlPlane;
    private final MeterRegistry meterRegistry;

    public InstanceDirectory(ComputeControlPlane controlPlane, MeterRegistry meterRegistry) {
        this.controlPlane = controlPlane;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Mono<List<InstanceRef>> discover(String project, List<String> zones, LabelSelector selector) {
        if (selector == null || selector.isEmpty()) {
            log.warn("Refusing to discover instances with an empty label selector");
            return Mono.just(List.of());
        }
        if (zones == null || zones.isEmpty()) {
            log.warn("No zones to search");
            return Mono.just(List.of());
        }

        return Flux.fromIterable(zones)
            .concatMap(zone -> discoverZone(project, zone, selector))
            .collectList();
    }

    private Flux<InstanceRef> discoverZone(String project, String zone, LabelSelector selector) {
        return Mono.fromCallable(() -> controlPlane.list(project, zone))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(Flux::fromIterable)
            .filter(instance -> LabelMatcher.matches(instance.labels(), selector))
            .map(instance -> InstanceRef.builder()
                .name(instance.name())
                .zone(zone)
                .state(InstanceState.fromStatus(instance.status()))
                .build())
            .collectList()
            .doOnNext(found -> log.debug("Zone {}: {} matching instance(s)", zone, found.size()))
            .flatMapMany(Flux::fromIterable)
            .onErrorResume(err -> {
                log.error("Error listing instances in zone {}: {}", zone, err.getMessage());
                Counter.builder(MetricsNames.SCHEDULER_ZONE_FAILURES_TOTAL)
                    .tag(MetricsTags.ZONE, zone)
                    .register(meterRegistry)
                    .increment();
                return Flux.empty();
            });
    }
}
