package com.powerscheduler.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Inbound scale requests (JSON, see {@link ScaleRequestMessage}).
     * Published by schedulers/operators, consumed by the scheduler service.
     */
    public static final String SCALE_REQUESTS = "vmsched.scale.requests";

    /**
     * Aggregated results of processed requests, one record per request.
     */
    public static final String SCALE_RESULTS = "vmsched.scale.results";
}
