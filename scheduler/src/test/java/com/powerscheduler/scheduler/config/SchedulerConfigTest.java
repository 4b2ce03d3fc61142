package com.powerscheduler.scheduler.config;

import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.core.model.ScaleConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerConfigTest {

    @Test
    void testDefaults() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of());

        assertNull(config.getDefaultProjectId());
        assertEquals(List.of(new LabelSelector.Label("auto-schedule", "true")), config.getDefaultSelector().getLabels());
        assertEquals(List.of("us-central1-a", "us-central1-b"), config.getDefaultZones());
        assertEquals(ScaleConfig.ScaleDownOperation.STOP, config.getScaleConfig().getScaleDownOperation());
        assertEquals(ScaleConfig.ScaleUpOperation.START, config.getScaleConfig().getScaleUpOperation());
        assertEquals(8080, config.getHttpPort());
        assertTrue(config.isKafkaEnabled());
    }

    @Test
    void testOverrides() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            "GCP_PROJECT", "prod-project",
            "VM_LABELS", "team:data,env:prod",
            "VM_ZONES", "europe-west1-b, europe-west1-c ,",
            "SCALE_DOWN_ACTION", "SUSPEND",
            "SCALE_UP_ACTION", "RESUME",
            "KAFKA_ENABLED", "false",
            "HTTP_PORT", "9000"
        ));

        assertEquals("prod-project", config.getDefaultProjectId());
        assertEquals(2, config.getDefaultSelector().getLabels().size());
        assertEquals(List.of("europe-west1-b", "europe-west1-c"), config.getDefaultZones());
        assertEquals(ScaleConfig.ScaleDownOperation.SUSPEND, config.getScaleConfig().getScaleDownOperation());
        assertEquals(ScaleConfig.ScaleUpOperation.RESUME, config.getScaleConfig().getScaleUpOperation());
        assertFalse(config.isKafkaEnabled());
        assertEquals(9000, config.getHttpPort());
    }

    @Test
    void testUnrecognizedOperationsFallBack() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
            "SCALE_DOWN_ACTION", "hibernate",
            "SCALE_UP_ACTION", "resume"
        ));

        assertEquals(ScaleConfig.ScaleDownOperation.STOP, config.getScaleConfig().getScaleDownOperation());
        assertEquals(ScaleConfig.ScaleUpOperation.START, config.getScaleConfig().getScaleUpOperation());
    }

    @Test
    void testBlankProjectIsUnset() {
        assertNull(SchedulerConfig.fromEnv(Map.of("GCP_PROJECT", "  ")).getDefaultProjectId());
    }

    @Test
    void testInvalidSelectorFailsFast() {
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromEnv(Map.of("VM_LABELS", ":true")));
    }
}
