package com.stewel.mining.assocrules;

import com.stewel.mining.fpgrowth.Itemset;
import org.immutables.value.Value;

import java.util.OptionalDouble;

/**
 * This class represents an association rule: when the antecedent occurs in a transaction,
 * the consequent occurs with the given confidence.
 */
@Value.Immutable
public abstract class AssociationRule<T> {

    public abstract Itemset<T> getAntecedent();

    public abstract Itemset<T> getConsequent();

    /**
     * The support of the antecedent.
     */
    public abstract long getCoverage();

    /**
     * The support of the antecedent and the consequent together.
     */
    public abstract long getTransactionCount();

    public abstract double getConfidence();

    /**
     * The lift of the rule, present only if the size of the database was known.
     */
    public abstract OptionalDouble getLift();

    public long getAbsoluteSupport() {
        return getTransactionCount();
    }

    public double getRelativeSupport(final long databaseSize) {
        return ((double) getTransactionCount()) / ((double) databaseSize);
    }
}
