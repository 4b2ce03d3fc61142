package com.powerscheduler.core.model;

/**
 * Power state of a compute instance as reported by the control plane.
 * <p>
 * Snapshot taken at discovery time; it may be stale by the time an action runs.
 * The control plane stays authoritative.
 * </p>
 */
public enum InstanceState {
    RUNNING,
    STOPPED,
    TERMINATED,
    SUSPENDED,
    SUSPENDING,
    STOPPING,
    PROVISIONING,

    /**
     * Any status without a dedicated constant (STAGING, REPAIRING, ...).
     */
    OTHER;

    /**
     * Maps a control-plane status string to a state.
     *
     * @param status status as returned by the control plane, may be null
     * @return matching state, {@link #OTHER} when unknown
     */
    public static InstanceState fromStatus(String status) {
        if (status == null || status.isBlank()) {
            return OTHER;
        }
        try {
            return InstanceState.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
