package com.powerscheduler.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    public static final String INTENT = "intent";

    public static final String OPERATION = "operation";

    public static final String STATUS = "status";

    public static final String ZONE = "zone";

    public static final String OUTCOME = "outcome";
}
