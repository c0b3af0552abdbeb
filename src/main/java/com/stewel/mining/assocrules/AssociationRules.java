package com.stewel.mining.assocrules;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.stewel.mining.fpgrowth.Itemset;
import org.immutables.value.Value;

import java.util.List;

/**
 * This class represents a list of association rules.
 */
@Value.Immutable
public interface AssociationRules<T> {

    List<AssociationRule<T>> getRules();

    /**
     * Groups the rules by antecedent; an antecedent maps to the rules of all itemsets it was
     * split from, in generation order.
     */
    default ImmutableListMultimap<Itemset<T>, AssociationRule<T>> byAntecedent() {
        return Multimaps.index(getRules(), AssociationRule::getAntecedent);
    }

    default int size() {
        return getRules().size();
    }

    default boolean isEmpty() {
        return getRules().isEmpty();
    }
}
