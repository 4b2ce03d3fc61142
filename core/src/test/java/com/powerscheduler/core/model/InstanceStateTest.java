package com.powerscheduler.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InstanceStateTest {

    @Test
    void testKnownStatuses() {
        assertEquals(InstanceState.RUNNING, InstanceState.fromStatus("RUNNING"));
        assertEquals(InstanceState.SUSPENDING, InstanceState.fromStatus("SUSPENDING"));
        assertEquals(InstanceState.TERMINATED, InstanceState.fromStatus("terminated"));
    }

    @Test
    void testUnknownStatusesMapToOther() {
        assertEquals(InstanceState.OTHER, InstanceState.fromStatus("STAGING"));
        assertEquals(InstanceState.OTHER, InstanceState.fromStatus("REPAIRING"));
        assertEquals(InstanceState.OTHER, InstanceState.fromStatus(""));
        assertEquals(InstanceState.OTHER, InstanceState.fromStatus(null));
    }

    @Test
    void testScaleIntentWireNames() {
        assertEquals(ScaleIntent.SCALE_UP, ScaleIntent.fromAction("scale_up").orElseThrow());
        assertEquals(ScaleIntent.SCALE_DOWN, ScaleIntent.fromAction("scale_down").orElseThrow());
        assertEquals(false, ScaleIntent.fromAction("SCALE_UP").isPresent());
    }
}
