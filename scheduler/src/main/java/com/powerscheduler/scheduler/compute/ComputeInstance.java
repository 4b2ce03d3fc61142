package com.powerscheduler.scheduler.compute;

import java.util.Map;

/**
 * Instance as listed by the control plane, before filtering.
 *
 * @param name   instance name, unique within its zone
 * @param labels instance labels, never null
 * @param status raw control-plane status (RUNNING, TERMINATED, STAGING, ...)
 */
public record ComputeInstance(String name, Map<String, String> labels, String status) {
    public ComputeInstance {
        labels = labels == null ? Map.of() : labels;
    }
}
