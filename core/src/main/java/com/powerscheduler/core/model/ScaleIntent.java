package com.powerscheduler.core.model;

import java.util.Optional;

/**
 * Requested direction of scaling.
 */
public enum ScaleIntent {
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down");

    private final String action;

    ScaleIntent(String action) {
        this.action = action;
    }

    /**
     * @return wire name used in inbound requests ({@code scale_up} / {@code scale_down})
     */
    public String action() {
        return action;
    }

    public static Optional<ScaleIntent> fromAction(String action) {
        if (action == null) {
            return Optional.empty();
        }
        for (ScaleIntent intent : values()) {
            if (intent.action.equals(action)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
