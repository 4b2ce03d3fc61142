package com.powerscheduler.core.label;

import com.powerscheduler.core.model.LabelSelector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelSelectorParserTest {

    @Test
    void testDefaultSelector() {
        LabelSelector selector = LabelSelectorParser.parse("auto-schedule:true");

        assertEquals(List.of(new LabelSelector.Label("auto-schedule", "true")), selector.getLabels());
    }

    @Test
    void testMultiplePairsKeepOrderAndTrim() {
        LabelSelector selector = LabelSelectorParser.parse(" team : data , env:dev ");

        assertEquals(List.of(
            new LabelSelector.Label("team", "data"),
            new LabelSelector.Label("env", "dev")
        ), selector.getLabels());
    }

    @Test
    void testValueMayContainColon() {
        LabelSelector selector = LabelSelectorParser.parse("endpoint:host:8080");

        assertEquals("host:8080", selector.getLabels().get(0).value());
    }

    @Test
    void testEntriesWithoutColonAreIgnored() {
        LabelSelector selector = LabelSelectorParser.parse("garbage,env:dev,,");

        assertEquals(1, selector.getLabels().size());
        assertEquals("env", selector.getLabels().get(0).key());
    }

    @Test
    void testBlankInputYieldsEmptySelector() {
        assertTrue(LabelSelectorParser.parse(null).isEmpty());
        assertTrue(LabelSelectorParser.parse("   ").isEmpty());
        assertTrue(LabelSelectorParser.parse("no-colon-here").isEmpty());
    }

    @Test
    void testEmptyKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LabelSelectorParser.parse("env:dev, :true"));
    }

    @Test
    void testEmptyValueIsAllowed() {
        LabelSelector selector = LabelSelectorParser.parse("env:");

        assertEquals("", selector.getLabels().get(0).value());
    }
}
