package com.stewel.mining.assocrules;

import com.stewel.mining.fpgrowth.Itemset;
import com.stewel.mining.fpgrowth.Itemsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Looks up the support of itemsets in a mined set of frequent itemsets.
 */
public class ItemsetSupportCalculator<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemsetSupportCalculator.class);

    private final Itemsets<T> patterns;

    public ItemsetSupportCalculator(final Itemsets<T> patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    /**
     * Returns the support of an itemset, or nothing if the itemset is not among the frequent
     * itemsets. For a sub-itemset of a frequent itemset this should not happen, since support
     * only shrinks as itemsets grow.
     *
     * @param itemset the itemset.
     * @return the support of the itemset
     */
    public OptionalLong calculateSupport(final Itemset<T> itemset) {
        final OptionalLong support = patterns.getSupport(itemset);
        if (!support.isPresent()) {
            LOGGER.trace("No support known for {}", itemset);
        }
        return support;
    }

}
