package com.powerscheduler.core.label;

import com.google.common.base.Splitter;
import com.powerscheduler.core.model.LabelSelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses selectors written as {@code key1:value1,key2:value2}.
 * <p>
 * Entries without a colon are ignored. Only the first colon separates key from
 * value, so values may contain colons. Keys and values are trimmed.
 * </p>
 */
public final class LabelSelectorParser {
    private LabelSelectorParser() {
    }

    private static final Splitter ENTRY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter PAIR_SPLITTER = Splitter.on(':').limit(2).trimResults();

    /**
     * @param text selector string, null or blank yields the empty selector
     * @return parsed selector
     * @throws IllegalArgumentException if an entry has a blank key
     */
    public static LabelSelector parse(String text) {
        if (text == null || text.isBlank()) {
            return LabelSelector.empty();
        }

        List<LabelSelector.Label> labels = new ArrayList<>();
        for (String entry : ENTRY_SPLITTER.split(text)) {
            if (entry.indexOf(':') < 0) {
                continue;
            }
            List<String> pair = PAIR_SPLITTER.splitToList(entry);
            if (pair.get(0).isEmpty()) {
                throw new IllegalArgumentException("Empty label key in selector entry '" + entry + "'");
            }
            labels.add(new LabelSelector.Label(pair.get(0), pair.get(1)));
        }
        return LabelSelector.of(labels);
    }
}
