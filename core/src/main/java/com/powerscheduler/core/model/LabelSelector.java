package com.powerscheduler.core.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conjunctive set of label requirements.
 * <p>
 * Every pair must be present on an instance with an equal value (exact,
 * case-sensitive). Order of pairs is kept as given.
 * </p>
 */
@Value
public class LabelSelector {

    private static final LabelSelector EMPTY = new LabelSelector(List.of());

    List<Label> labels;

    private LabelSelector(List<Label> labels) {
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public static LabelSelector of(List<Label> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        return new LabelSelector(labels);
    }

    public static LabelSelector of(String key, String value) {
        return new LabelSelector(List.of(new Label(key, value)));
    }

    public static LabelSelector empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    /**
     * Single {@code key == value} requirement.
     *
     * @param key   label key, never blank
     * @param value expected value; null matches only a present key whose value is null
     */
    public record Label(String key, String value) {
        public Label {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Label key must not be blank");
            }
        }

        @Override
        public String toString() {
            return key + ":" + value;
        }
    }
}
