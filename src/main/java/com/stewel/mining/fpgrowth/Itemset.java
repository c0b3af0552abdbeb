package com.stewel.mining.fpgrowth;

import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import org.immutables.value.Value;

import java.util.Arrays;
import java.util.Set;

/**
 * This class represents an itemset (a set of items). Two itemsets are equal when they hold
 * the same items, whatever the order the items were added in.
 */
@Value.Immutable
public abstract class Itemset<T> {

    public abstract Set<T> getItems();

    public int size() {
        return getItems().size();
    }

    public boolean isEmpty() {
        return getItems().isEmpty();
    }

    public boolean contains(final T item) {
        return getItems().contains(item);
    }

    /**
     * Make a copy of this itemset that also holds the given item.
     *
     * @param item the item to add
     * @return the copy of this itemset plus the item
     */
    public Itemset<T> union(final T item) {
        if (contains(item)) {
            return this;
        }
        return ImmutableItemset.<T>builder().addAllItems(getItems()).addItems(item).build();
    }

    /**
     * Make a copy of this itemset that also holds all items of another itemset.
     */
    public Itemset<T> union(final Iterable<? extends T> items) {
        return ImmutableItemset.<T>builder().addAllItems(getItems()).addAllItems(items).build();
    }

    /**
     * Make a copy of this itemset but exclude a set of items.
     *
     * @param itemsetToNotKeep the set of items to be excluded
     * @return the copy of this itemset except the set of items to be excluded
     */
    public Itemset<T> minus(final Itemset<T> itemsetToNotKeep) {
        return of(Sets.difference(getItems(), itemsetToNotKeep.getItems()));
    }

    public static <T> Itemset<T> empty() {
        return ImmutableItemset.<T>builder().build();
    }

    public static <T> Itemset<T> of(final Iterable<? extends T> items) {
        return ImmutableItemset.<T>builder().addAllItems(items).build();
    }

    @SafeVarargs
    public static <T> Itemset<T> of(final T... items) {
        return of(Arrays.asList(items));
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", Iterables.transform(getItems(), String::valueOf)) + ")";
    }
}
