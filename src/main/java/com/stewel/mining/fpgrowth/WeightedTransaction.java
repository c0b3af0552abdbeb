package com.stewel.mining.fpgrowth;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A list of items together with the number of times it occurs in a transaction database.
 * <p>
 * Caller supplied transactions have a weight of one. Prefix paths collected from an
 * {@link FPTree} carry the count of the node they were collected for, which is the same
 * as repeating the path that many times.
 */
public final class WeightedTransaction<T> {

    private final ImmutableList<T> items;

    private final long weight;

    public WeightedTransaction(final Iterable<? extends T> items, final long weight) {
        checkNotNull(items, "items");
        checkArgument(weight > 0, "weight must be positive, got: %s", weight);
        this.items = ImmutableList.copyOf(items);
        this.weight = weight;
    }

    public static <T> WeightedTransaction<T> of(final Iterable<? extends T> items) {
        return new WeightedTransaction<>(items, 1L);
    }

    public ImmutableList<T> getItems() {
        return items;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return items + "=" + weight;
    }

    @Override
    public int hashCode() {
        return items.hashCode() * 13 + Long.hashCode(weight);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o instanceof WeightedTransaction) {
            final WeightedTransaction<?> other = (WeightedTransaction<?>) o;
            return weight == other.weight && items.equals(other.items);
        }
        return false;
    }
}
