package com.powerscheduler.core.model;

/**
 * Control-plane operation invoked on a single instance.
 */
public enum ControlOperation {
    STOP,
    SUSPEND,
    START,
    RESUME;

    /**
     * @return lower-case name used in log lines and metric tags
     */
    public String tag() {
        return name().toLowerCase();
    }
}
