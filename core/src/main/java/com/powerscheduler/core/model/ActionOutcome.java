package com.powerscheduler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Recorded result of attempting (or skipping) an action on one instance.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionOutcome {

    @JsonProperty("instance")
    String instance;

    @JsonProperty("zone")
    String zone;

    /**
     * Action exactly as requested on the wire (kept even when unrecognized).
     */
    @JsonProperty("action")
    String action;

    /**
     * Parsed intent, null when {@link #action} was not recognized.
     */
    @JsonProperty("intent")
    ScaleIntent intent;

    @JsonProperty("status")
    Status status;

    /**
     * Operation id on success, error message on failure, skip reason otherwise.
     */
    @JsonProperty("detail")
    String detail;

    public enum Status {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    @JsonIgnore
    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
