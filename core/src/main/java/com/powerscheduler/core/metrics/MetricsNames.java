package com.powerscheduler.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code vmsched.<component>.<metric>}, counters end in {@code .total}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Per-instance outcomes.
     * <p>
     * Tags: intent, operation, status (success/error/skipped)
     * </p>
     */
    public static final String SCHEDULER_ACTIONS_TOTAL = "vmsched.scheduler.actions.total";

    /**
     * Counter: Zones whose instance listing failed.
     * <p>
     * Tags: zone
     * </p>
     */
    public static final String SCHEDULER_ZONE_FAILURES_TOTAL = "vmsched.scheduler.zone.failures.total";

    /**
     * Counter: Handled scale requests.
     * <p>
     * Tags: outcome (completed/no_instances/config_error)
     * </p>
     */
    public static final String SCHEDULER_REQUESTS_TOTAL = "vmsched.scheduler.requests.total";
}
