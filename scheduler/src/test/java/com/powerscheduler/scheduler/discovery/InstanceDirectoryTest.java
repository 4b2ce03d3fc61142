package com.powerscheduler.scheduler.discovery;

import com.powerscheduler.core.metrics.MetricsNames;
import com.powerscheduler.core.model.InstanceRef;
import com.powerscheduler.core.model.InstanceState;
import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.scheduler.compute.InMemoryComputeControlPlane;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InstanceDirectoryTest {

    private static final Map<String, String> SCHEDULED = Map.of("auto-schedule", "true");
    private static final LabelSelector SELECTOR = LabelSelector.of("auto-schedule", "true");

    private InMemoryComputeControlPlane controlPlane;
    private SimpleMeterRegistry meterRegistry;
    private InstanceDirectory directory;

    @BeforeEach
    void setUp() {
        controlPlane = new InMemoryComputeControlPlane()
            .withInstance("zone-a", "a-1", "RUNNING", SCHEDULED)
            .withInstance("zone-a", "a-2", "TERMINATED", Map.of("auto-schedule", "false"))
            .withInstance("zone-a", "a-3", "STAGING", SCHEDULED)
            .withInstance("zone-b", "b-1", "SUSPENDED", SCHEDULED)
            .withInstance("zone-b", "b-2", "RUNNING", Map.of());
        meterRegistry = new SimpleMeterRegistry();
        directory = new InstanceDirectory(controlPlane, meterRegistry);
    }

    @Test
    @DisplayName("Returns matching instances in zone order, then listing order")
    void testDiscoveryOrderAndFiltering() {
        StepVerifier.create(directory.discover("proj", List.of("zone-b", "zone-a"), SELECTOR))
            .assertNext(instances -> assertEquals(List.of(
                ref("b-1", "zone-b", InstanceState.SUSPENDED),
                ref("a-1", "zone-a", InstanceState.RUNNING),
                ref("a-3", "zone-a", InstanceState.OTHER)
            ), instances))
            .verifyComplete();

        assertEquals("proj", controlPlane.getLastProject());
    }

    @Test
    @DisplayName("A failing zone contributes nothing and does not fail discovery")
    void testZoneFailureIsIsolated() {
        controlPlane.failZone("zone-b");

        StepVerifier.create(directory.discover("proj", List.of("zone-a", "zone-b"), SELECTOR))
            .assertNext(instances -> assertEquals(List.of("a-1", "a-3"),
                instances.stream().map(InstanceRef::getName).toList()))
            .verifyComplete();

        assertEquals(1.0, meterRegistry.get(MetricsNames.SCHEDULER_ZONE_FAILURES_TOTAL)
            .tag("zone", "zone-b").counter().count());
    }

    @Test
    void testAllZonesFailing() {
        controlPlane.failZone("zone-a").failZone("zone-b");

        StepVerifier.create(directory.discover("proj", List.of("zone-a", "zone-b"), SELECTOR))
            .assertNext(instances -> assertEquals(List.of(), instances))
            .verifyComplete();
    }

    @Test
    @DisplayName("Empty selector matches nothing and never lists the control plane")
    void testEmptySelectorMatchesNothing() {
        StepVerifier.create(directory.discover("proj", List.of("zone-a"), LabelSelector.empty()))
            .assertNext(instances -> assertEquals(List.of(), instances))
            .verifyComplete();

        assertEquals(0, controlPlane.getListCalls());
    }

    @Test
    void testUnknownZoneIsEmpty() {
        StepVerifier.create(directory.discover("proj", List.of("zone-z"), SELECTOR))
            .assertNext(instances -> assertEquals(List.of(), instances))
            .verifyComplete();
    }

    private static InstanceRef ref(String name, String zone, InstanceState state) {
        return InstanceRef.builder().name(name).zone(zone).state(state).build();
    }
}
