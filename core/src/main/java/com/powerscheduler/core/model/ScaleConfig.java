package com.powerscheduler.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Which control-plane operation to use for each scaling direction.
 * <p>
 * Built once from the process configuration and passed into the decision logic,
 * never looked up from the environment there.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ScaleConfig {

    public static final ScaleConfig DEFAULT = ScaleConfig.builder().build();

    @Builder.Default
    ScaleDownOperation scaleDownOperation = ScaleDownOperation.STOP;

    @Builder.Default
    ScaleUpOperation scaleUpOperation = ScaleUpOperation.START;

    public enum ScaleDownOperation {
        STOP(ControlOperation.STOP),
        SUSPEND(ControlOperation.SUSPEND);

        private final ControlOperation operation;

        ScaleDownOperation(ControlOperation operation) {
            this.operation = operation;
        }

        public ControlOperation operation() {
            return operation;
        }
    }

    public enum ScaleUpOperation {
        START(ControlOperation.START),
        RESUME(ControlOperation.RESUME);

        private final ControlOperation operation;

        ScaleUpOperation(ControlOperation operation) {
            this.operation = operation;
        }

        public ControlOperation operation() {
            return operation;
        }
    }
}
