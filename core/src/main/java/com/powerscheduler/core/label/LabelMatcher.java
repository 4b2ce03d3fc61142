package com.powerscheduler.core.label;

import com.powerscheduler.core.model.LabelSelector;

import java.util.Map;
import java.util.Objects;

/**
 * Decides whether an instance's labels satisfy a {@link LabelSelector}.
 * <p>
 * Pure and total: never throws. An empty selector matches by convention;
 * callers must reject empty selectors before reaching this point.
 * </p>
 */
public final class LabelMatcher {
    private LabelMatcher() {
    }

    public static boolean matches(Map<String, String> instanceLabels, LabelSelector selector) {
        if (selector == null || selector.isEmpty()) {
            return true;
        }
        if (instanceLabels == null || instanceLabels.isEmpty()) {
            return false;
        }
        for (LabelSelector.Label label : selector.getLabels()) {
            if (!instanceLabels.containsKey(label.key())
                || !Objects.equals(instanceLabels.get(label.key()), label.value())) {
                return false;
            }
        }
        return true;
    }
}
