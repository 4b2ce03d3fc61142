package com.powerscheduler.core.policy;

import com.powerscheduler.core.model.ControlOperation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Per-instance verdict of {@link ActionPolicy}.
 * <ul>
 *   <li>{@link Kind#SKIP}: instance already in the desired state</li>
 *   <li>{@link Kind#PERFORM}: invoke {@link #getOperation()}</li>
 *   <li>{@link Kind#UNKNOWN}: intent not recognized, {@link #getReason()} explains</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Decision {

    Kind kind;
    ControlOperation operation;
    String reason;

    public static Decision skip(String reason) {
        return new Decision(Kind.SKIP, null, reason);
    }

    public static Decision perform(ControlOperation operation) {
        return new Decision(Kind.PERFORM, operation, null);
    }

    public static Decision unknown(String reason) {
        return new Decision(Kind.UNKNOWN, null, reason);
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    public boolean isPerform() {
        return kind == Kind.PERFORM;
    }

    public enum Kind {
        SKIP,
        PERFORM,
        UNKNOWN
    }
}
