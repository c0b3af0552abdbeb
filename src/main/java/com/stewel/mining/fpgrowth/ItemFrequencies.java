package com.stewel.mining.fpgrowth;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.commons.lang.mutable.MutableLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The frequency table of one tree: every item whose weighted occurrence count reaches the
 * minimum support, in the order the items were first seen.
 * <p>
 * The first-seen position is the tie-break of the canonical item order, so two items with
 * the same count are ordered the same way in every transaction of a tree.
 */
public final class ItemFrequencies<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemFrequencies.class);

    private final ImmutableMap<T, Long> counts;
    private final ImmutableMap<T, Integer> firstSeen;
    private final long minimumSupport;
    private final AttrComparator attrComparator = new AttrComparator();

    private ItemFrequencies(final ImmutableMap<T, Long> counts, final long minimumSupport) {
        this.counts = counts;
        this.minimumSupport = minimumSupport;
        final ImmutableMap.Builder<T, Integer> positions = ImmutableMap.builder();
        int position = 0;
        for (final T item : counts.keySet()) {
            positions.put(item, position++);
        }
        this.firstSeen = positions.build();
    }

    /**
     * Counts all items of the given transactions in a single scan and keeps the frequent ones.
     *
     * @param transactions   the transactions, each counted with its weight
     * @param minimumSupport the absolute minimum support, at least 1
     * @return the frequency table
     */
    public static <T> ItemFrequencies<T> count(final Iterable<WeightedTransaction<T>> transactions,
                                               final long minimumSupport) {
        checkNotNull(transactions, "transactions");
        checkArgument(minimumSupport >= 1, "minimumSupport must be at least 1, got: %s", minimumSupport);

        final Map<T, MutableLong> frequencyList = Maps.newLinkedHashMap();
        for (final WeightedTransaction<T> transaction : transactions) {
            for (final T item : transaction.getItems()) {
                MutableLong count = frequencyList.get(item);
                if (count == null) {
                    count = new MutableLong(0);
                    frequencyList.put(item, count);
                }
                count.add(transaction.getWeight());
            }
        }

        final ImmutableMap.Builder<T, Long> frequent = ImmutableMap.builder();
        for (final Map.Entry<T, MutableLong> entry : frequencyList.entrySet()) {
            final long support = entry.getValue().longValue();
            if (support >= minimumSupport) {
                LOGGER.trace("Item '{}' | Support '{}' FREQUENT.", entry.getKey(), support);
                frequent.put(entry.getKey(), support);
            } else {
                LOGGER.trace("Item '{}' | Support '{}' NOT FREQUENT.", entry.getKey(), support);
            }
        }
        return new ItemFrequencies<>(frequent.build(), minimumSupport);
    }

    /**
     * Returns the count of the item, or 0 if the item is not frequent.
     */
    public long count(final T item) {
        final Long count = counts.get(item);
        return count == null ? 0L : count;
    }

    public boolean contains(final T item) {
        return counts.containsKey(item);
    }

    /**
     * Returns the frequent items in first-seen order.
     */
    public ImmutableSet<T> items() {
        return counts.keySet();
    }

    public ImmutableMap<T, Long> asMap() {
        return counts;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public long minimumSupport() {
        return minimumSupport;
    }

    /**
     * The canonical order used to sort transactions before they are inserted into a tree.
     */
    public Comparator<T> descendingFrequencyOrder() {
        return attrComparator;
    }

    /**
     * Returns the frequent items sorted by frequency (high to low).
     */
    public List<T> canonicalOrder() {
        final List<T> items = Lists.newArrayList(counts.keySet());
        items.sort(attrComparator);
        return ImmutableList.copyOf(items);
    }

    /**
     * Returns the frequent items sorted by frequency (low to high), the order in which
     * conditional trees are mined.
     */
    public List<T> miningOrder() {
        return Lists.reverse(canonicalOrder());
    }

    @Override
    public String toString() {
        return "ItemFrequencies{minimumSupport=" + minimumSupport + ", counts=" + counts + '}';
    }

    // biggest count or earliest seen item goes first
    private class AttrComparator implements Comparator<T> {
        @Override
        public int compare(final T a, final T b) {
            final long aCnt = count(a);
            final long bCnt = count(b);
            if (aCnt == bCnt) {
                return Integer.compare(position(a), position(b));
            }
            return aCnt > bCnt ? -1 : 1;
        }

        private int position(final T item) {
            final Integer position = firstSeen.get(item);
            return position == null ? Integer.MAX_VALUE : position;
        }
    }
}
