package com.powerscheduler.core.policy;

import com.powerscheduler.core.model.InstanceState;
import com.powerscheduler.core.model.ScaleConfig;
import com.powerscheduler.core.model.ScaleIntent;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides what to do with a single instance for a requested intent.
 * <p>
 * <b>Decision table:</b>
 * <pre>
 *   SCALE_DOWN, state in {STOPPED, TERMINATED, SUSPENDED} -> Skip
 *   SCALE_DOWN, any other state                          -> Perform(scaleDownOperation)
 *   SCALE_UP,   state == RUNNING                         -> Skip
 *   SCALE_UP,   any other state                          -> Perform(scaleUpOperation)
 *   unrecognized intent                                  -> Unknown
 * </pre>
 * </p>
 * <p>
 * Repeated runs against a fleet that has settled produce only skips.
 * </p>
 */
public final class ActionPolicy {
    private ActionPolicy() {
    }

    static final Set<InstanceState> AT_REST = EnumSet.of(
        InstanceState.STOPPED,
        InstanceState.TERMINATED,
        InstanceState.SUSPENDED
    );

    /**
     * @param intent       parsed intent, null when the request action was not recognized
     * @param currentState state captured at discovery
     * @param config       operation choice per direction
     */
    public static Decision decide(ScaleIntent intent, InstanceState currentState, ScaleConfig config) {
        if (intent == null) {
            return Decision.unknown("Unknown action");
        }

        return switch (intent) {
            case SCALE_DOWN -> AT_REST.contains(currentState)
                ? Decision.skip("already stopped/suspended (" + currentState + ")")
                : Decision.perform(config.getScaleDownOperation().operation());
            case SCALE_UP -> currentState == InstanceState.RUNNING
                ? Decision.skip("already running")
                : Decision.perform(config.getScaleUpOperation().operation());
        };
    }

    /**
     * Variant taking the raw wire action, so unknown actions keep their text in the reason.
     */
    public static Decision decide(String action, InstanceState currentState, ScaleConfig config) {
        return ScaleIntent.fromAction(action)
            .map(intent -> decide(intent, currentState, config))
            .orElseGet(() -> Decision.unknown("Unknown action: " + action));
    }
}
