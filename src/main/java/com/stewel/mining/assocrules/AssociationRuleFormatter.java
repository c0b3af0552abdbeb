package com.stewel.mining.assocrules;

import com.google.common.collect.ImmutableMap;
import com.stewel.mining.fpgrowth.Itemset;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class AssociationRuleFormatter<T> {

    private final Map<T, String> itemTranslations;
    private final static String FORMAT = "%s => %s (support: %d, confidence: %.2f)";
    private final static String FORMAT_WITH_LIFT = "%s => %s (support: %d, confidence: %.2f, lift: %.2f)";

    public AssociationRuleFormatter() {
        this(ImmutableMap.<T, String>of());
    }

    public AssociationRuleFormatter(final Map<T, String> itemTranslations) {
        this.itemTranslations = itemTranslations;
    }

    public String formatRule(final AssociationRule<T> rule) {
        final String antecedentList = formatItemset(rule.getAntecedent());
        final String consequentList = formatItemset(rule.getConsequent());
        if (rule.getLift().isPresent()) {
            return String.format(Locale.ENGLISH, FORMAT_WITH_LIFT, antecedentList, consequentList,
                    rule.getAbsoluteSupport(), rule.getConfidence(), rule.getLift().getAsDouble());
        }
        return String.format(Locale.ENGLISH, FORMAT, antecedentList, consequentList,
                rule.getAbsoluteSupport(), rule.getConfidence());
    }

    // items are sorted by their rendered name so equal itemsets always print the same way
    private String formatItemset(final Itemset<T> itemset) {
        return itemset.getItems().stream()
                .map(item -> itemTranslations.getOrDefault(item, String.valueOf(item)))
                .sorted()
                .collect(Collectors.joining(","));
    }

}
