package com.powerscheduler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of one scale invocation.
 * <p>
 * {@code processedCount} counts every outcome that is not {@link ActionOutcome.Status#SKIPPED};
 * {@code outcomes} holds all outcomes in processing order.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScaleResult {

    public static final String NO_INSTANCES_FOUND = "no instances found";

    @JsonProperty("processedCount")
    int processedCount;

    @Singular
    @JsonProperty("outcomes")
    List<ActionOutcome> outcomes;

    /**
     * Informational message, e.g. when nothing matched the selector.
     */
    @JsonProperty("message")
    String message;

    /**
     * Set when the invocation could not run at all (configuration error).
     */
    @JsonProperty("error")
    String error;

    public static ScaleResult of(List<ActionOutcome> outcomes) {
        int processed = (int) outcomes.stream().filter(outcome -> !outcome.isSkipped()).count();
        return ScaleResult.builder()
                .processedCount(processed)
                .outcomes(outcomes)
                .build();
    }

    public static ScaleResult noInstancesFound() {
        return ScaleResult.builder()
                .processedCount(0)
                .message(NO_INSTANCES_FOUND)
                .build();
    }

    public static ScaleResult failed(String error) {
        return ScaleResult.builder()
                .processedCount(0)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    @JsonIgnore
    public long skippedCount() {
        return outcomes.stream().filter(ActionOutcome::isSkipped).count();
    }
}
