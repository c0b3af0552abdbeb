package com.stewel.mining;

import com.stewel.mining.assocrules.AssociationRuleGenerator;
import com.stewel.mining.assocrules.AssociationRules;
import com.stewel.mining.fpgrowth.AlgoFPGrowth;
import com.stewel.mining.fpgrowth.Itemsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points of the library: mine the frequent itemsets of a transaction database and
 * derive association rules from them.
 * <p>
 * Every call works on its own trees and returns fresh results; nothing is kept between calls.
 */
public final class FrequentPatterns {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrequentPatterns.class);

    private FrequentPatterns() {
    }

    /**
     * Finds all itemsets occurring in at least {@code supportThreshold} transactions.
     *
     * @param transactions     the transactions, each one a sequence of items
     * @param supportThreshold the absolute minimum support, at least 1
     * @return the frequent itemsets with their support, empty if there are none
     * @throws IllegalArgumentException if the threshold is below 1
     */
    public static <T> Itemsets<T> findFrequentPatterns(final Iterable<? extends Iterable<? extends T>> transactions,
                                                       final long supportThreshold) {
        return findFrequentPatterns(transactions, MiningParameters.withAbsoluteSupport(supportThreshold));
    }

    public static <T> Itemsets<T> findFrequentPatterns(final Iterable<? extends Iterable<? extends T>> transactions,
                                                       final MiningParameters parameters) {
        final AlgoFPGrowth<T> algoFPGrowth = new AlgoFPGrowth<>(parameters.getMinimumSupport());
        final Itemsets<T> patterns = algoFPGrowth.runAlgorithm(transactions);
        if (LOGGER.isDebugEnabled()) {
            algoFPGrowth.printStats();
        }
        return patterns;
    }

    /**
     * Derives the association rules whose confidence reaches {@code confidenceThreshold}.
     *
     * @param patterns            frequent itemsets, as returned by {@link #findFrequentPatterns}
     * @param confidenceThreshold the minimum confidence; above 1 no rule qualifies
     * @return the rules, grouped by antecedent through {@link AssociationRules#byAntecedent()}
     * @throws IllegalArgumentException if the threshold is negative or not a number
     */
    public static <T> AssociationRules<T> generateAssociationRules(final Itemsets<T> patterns,
                                                                   final double confidenceThreshold) {
        return new AssociationRuleGenerator<T>().runAlgorithm(patterns, confidenceThreshold);
    }

    /**
     * Derives association rules with the confidence and lift thresholds of the parameters.
     * Lift is only computed when the parameters carry the database size.
     */
    public static <T> AssociationRules<T> generateAssociationRules(final Itemsets<T> patterns,
                                                                   final MiningParameters parameters) {
        final AssociationRuleGenerator<T> generator = new AssociationRuleGenerator<>();
        final AssociationRules<T> rules;
        if (parameters.getDatabaseSize().isPresent()) {
            rules = generator.runAlgorithm(patterns, parameters.getMinimumConfidence(),
                    parameters.getDatabaseSize().getAsLong(), parameters.getMinimumLift());
        } else {
            rules = generator.runAlgorithm(patterns, parameters.getMinimumConfidence());
        }
        LOGGER.debug("Generated {} association rules from {} frequent itemsets", rules.size(), patterns.size());
        return rules;
    }
}
