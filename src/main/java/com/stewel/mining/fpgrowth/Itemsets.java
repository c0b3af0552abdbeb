package com.stewel.mining.fpgrowth;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;
import org.apache.commons.lang.builder.ReflectionToStringBuilder;
import org.apache.commons.lang.builder.ToStringStyle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class represents a set of frequent itemsets, each with its support count.
 * <p>
 * Itemsets are kept in the order they were first added. Adding an itemset that is already
 * present adds the supports.
 */
public class Itemsets<T> {

    private final Map<Itemset<T>, Long> patterns = new LinkedHashMap<>();

    /**
     * Add an itemset to this structure, or add to its support if it is already present.
     *
     * @param itemset the itemset
     * @param support the support of the itemset
     */
    public void merge(final Itemset<T> itemset, final long support) {
        checkNotNull(itemset, "itemset");
        checkArgument(!itemset.isEmpty(), "the empty itemset is not a pattern");
        patterns.merge(itemset, support, Long::sum);
    }

    /**
     * Add all itemsets of another structure, adding supports of itemsets present in both.
     */
    public void mergeAll(final Itemsets<T> other) {
        for (final Map.Entry<Itemset<T>, Long> entry : other.patterns.entrySet()) {
            merge(entry.getKey(), entry.getValue());
        }
    }

    public OptionalLong getSupport(final Itemset<T> itemset) {
        final Long support = patterns.get(itemset);
        return support == null ? OptionalLong.empty() : OptionalLong.of(support);
    }

    public boolean contains(final Itemset<T> itemset) {
        return patterns.containsKey(itemset);
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Returns an unmodifiable view of itemset to support.
     */
    public Map<Itemset<T>, Long> asMap() {
        return Collections.unmodifiableMap(patterns);
    }

    /**
     * Get all itemsets grouped by size.
     *
     * @return A list of list of itemsets.
     * Position i in this list is the list of itemsets of size i, position 0 is always empty.
     */
    public List<List<Itemset<T>>> getLevels() {
        final List<List<Itemset<T>>> levels = new ArrayList<>();
        levels.add(new ArrayList<>());
        for (final Itemset<T> itemset : patterns.keySet()) {
            final int levelNumber = itemset.size();
            while (levels.size() <= levelNumber) {
                levels.add(new ArrayList<>());
            }
            levels.get(levelNumber).add(itemset);
        }
        return levels;
    }

    @Override
    public final boolean equals(final Object object) {
        return EqualsBuilder.reflectionEquals(this, object);
    }

    @Override
    public final int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public final String toString() {
        return ReflectionToStringBuilder.toString(this, ToStringStyle.SHORT_PREFIX_STYLE);
    }
}
