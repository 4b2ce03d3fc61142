package com.powerscheduler.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Decoded inbound request.
 * <p>
 * Optional fields are null when the caller did not supply them; the scheduler
 * then falls back to its process-wide defaults.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ScaleRequest {

    public static final String DEFAULT_ACTION = ScaleIntent.SCALE_DOWN.action();

    /**
     * Raw action string, {@code scale_up} or {@code scale_down} when valid.
     */
    @Builder.Default
    String action = DEFAULT_ACTION;

    String projectId;

    LabelSelector selector;

    List<String> zones;

    /**
     * Set when the payload was well-formed but one of its fields was not; such a
     * request is answered with an error result and nothing is discovered.
     */
    String invalidReason;

    public boolean isInvalid() {
        return invalidReason != null;
    }

    /**
     * Request used when the inbound payload cannot be decoded.
     */
    public static ScaleRequest empty() {
        return ScaleRequest.builder().build();
    }
}
