package com.powerscheduler.core.label;

import com.powerscheduler.core.model.LabelSelector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelMatcherTest {

    private static final LabelSelector TEAM_AND_SCHEDULE = LabelSelector.of(List.of(
        new LabelSelector.Label("auto-schedule", "true"),
        new LabelSelector.Label("team", "data")
    ));

    @Test
    @DisplayName("Matches when every selector pair is present with an equal value")
    void testAllPairsPresent() {
        Map<String, String> labels = Map.of("auto-schedule", "true", "team", "data", "env", "dev");

        assertTrue(LabelMatcher.matches(labels, TEAM_AND_SCHEDULE));
    }

    @Test
    @DisplayName("Rejects when one pair is missing")
    void testMissingKey() {
        assertFalse(LabelMatcher.matches(Map.of("auto-schedule", "true"), TEAM_AND_SCHEDULE));
    }

    @Test
    @DisplayName("Rejects when a value differs")
    void testDifferentValue() {
        Map<String, String> labels = Map.of("auto-schedule", "false", "team", "data");

        assertFalse(LabelMatcher.matches(labels, TEAM_AND_SCHEDULE));
    }

    @Test
    @DisplayName("Comparison is case-sensitive and has no wildcards")
    void testCaseSensitive() {
        assertFalse(LabelMatcher.matches(Map.of("auto-schedule", "TRUE"), LabelSelector.of("auto-schedule", "true")));
        assertFalse(LabelMatcher.matches(Map.of("Auto-Schedule", "true"), LabelSelector.of("auto-schedule", "true")));
        assertFalse(LabelMatcher.matches(Map.of("auto-schedule", "true"), LabelSelector.of("auto-schedule", "*")));
    }

    @Test
    @DisplayName("Instance without labels never matches a non-empty selector")
    void testEmptyLabels() {
        assertFalse(LabelMatcher.matches(Map.of(), TEAM_AND_SCHEDULE));
        assertFalse(LabelMatcher.matches(null, TEAM_AND_SCHEDULE));
    }

    @Test
    @DisplayName("Empty selector matches by convention")
    void testEmptySelector() {
        assertTrue(LabelMatcher.matches(Map.of("env", "dev"), LabelSelector.empty()));
        assertTrue(LabelMatcher.matches(Map.of(), LabelSelector.empty()));
    }

    @Test
    void testNullExpectedValueRequiresPresentKey() {
        Map<String, String> labels = new HashMap<>();
        labels.put("flag", null);
        LabelSelector selector = LabelSelector.of("flag", null);

        assertTrue(LabelMatcher.matches(labels, selector));
        assertFalse(LabelMatcher.matches(Map.of("other", "x"), selector));
    }
}
