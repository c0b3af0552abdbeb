package com.stewel.mining.assocrules;

/* This file is copyright (c) 2008-2012 Philippe Fournier-Viger
 *
 * This file is part of the SPMF DATA MINING SOFTWARE
 * (http://www.philippe-fournier-viger.com/spmf).
 *
 * SPMF is free software: you can redistribute it and/or modify it under the
 * terms of the GNU General Public License as published by the Free Software
 * Foundation, either version 3 of the License, or (at your option) any later
 * version.
 *
 * SPMF is distributed in the hope that it will be useful, but WITHOUT ANY
 * WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS FOR
 * A PARTICULAR PURPOSE. See the GNU General Public License for more details.
 * You should have received a copy of the GNU General Public License along with
 * SPMF. If not, see <http://www.gnu.org/licenses/>.
 */

import com.google.common.collect.Sets;
import com.stewel.mining.fpgrowth.Itemset;
import com.stewel.mining.fpgrowth.Itemsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Generates association rules from a set of frequent itemsets.
 * <p>
 * Every frequent itemset of size two or more is split into each of its non-empty proper
 * subsets (the antecedent) and the remaining items (the consequent). The confidence of the
 * rule is the support of the itemset divided by the support of the antecedent. Rules whose
 * confidence reaches the minimum confidence are returned, and saved to the repository if the
 * generator was given one.
 * <p>
 * If the size of the database is given, the lift of each rule is computed as well and
 * rules below the minimum lift are dropped.
 */
public class AssociationRuleGenerator<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssociationRuleGenerator.class);

    @Nullable
    private final AssociationRuleRepository<T> associationRuleRepository;

    // parameters
    protected double minconf;
    protected double minlift;
    protected OptionalLong databaseSize = OptionalLong.empty(); // number of transactions in database

    /**
     * Creates a generator that only returns the rules of each run.
     */
    public AssociationRuleGenerator() {
        this.associationRuleRepository = null;
    }

    /**
     * Creates a generator that also saves every rule it generates to the repository.
     */
    public AssociationRuleGenerator(@Nonnull final AssociationRuleRepository<T> associationRuleRepository) {
        this.associationRuleRepository = Objects.requireNonNull(associationRuleRepository);
    }

    /**
     * Run the algorithm
     *
     * @param patterns a set of frequent itemsets
     * @param minconf  the minconf threshold, a confidence above 1 yields no rules
     * @return the rules generated by this run
     */
    public AssociationRules<T> runAlgorithm(final Itemsets<T> patterns, final double minconf) {
        checkConfidence(minconf);
        this.minconf = minconf;
        this.minlift = 0.0;
        this.databaseSize = OptionalLong.empty();
        return runAlgorithm(patterns);
    }

    /**
     * Run the algorithm, computing the lift of every rule.
     *
     * @param patterns     a set of frequent itemsets
     * @param minconf      the minconf threshold
     * @param databaseSize the number of transactions in the database
     * @param minlift      the minlift threshold
     * @return the rules generated by this run
     */
    public AssociationRules<T> runAlgorithm(final Itemsets<T> patterns, final double minconf,
                                            final long databaseSize, final double minlift) {
        checkConfidence(minconf);
        checkArgument(databaseSize > 0, "databaseSize must be positive, got: %s", databaseSize);
        checkArgument(minlift >= 0.0, "minlift must not be negative, got: %s", minlift);
        this.minconf = minconf;
        this.minlift = minlift;
        this.databaseSize = OptionalLong.of(databaseSize);
        return runAlgorithm(patterns);
    }

    private AssociationRules<T> runAlgorithm(final Itemsets<T> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        final ItemsetSupportCalculator<T> supportCalculator = new ItemsetSupportCalculator<>(patterns);
        final List<AssociationRule<T>> rules = new ArrayList<>();

        // For each frequent itemset "lk" of size >= 2
        for (final Map.Entry<Itemset<T>, Long> pattern : patterns.asMap().entrySet()) {
            final Itemset<T> lk = pattern.getKey();
            final long lkSupport = pattern.getValue();
            for (int antecedentSize = 1; antecedentSize < lk.size(); antecedentSize++) {
                for (final Set<T> antecedentItems : Sets.combinations(lk.getItems(), antecedentSize)) {
                    final Itemset<T> antecedent = Itemset.of(antecedentItems);
                    final OptionalLong support = supportCalculator.calculateSupport(antecedent);
                    if (!support.isPresent()) {
                        continue;
                    }
                    // calculate the confidence of the rule : antecedent ==> lk minus antecedent
                    final double conf = lkSupport / (double) support.getAsLong();
                    if (conf < minconf || Double.isInfinite(conf)) {
                        continue;
                    }
                    final Itemset<T> consequent = lk.minus(antecedent);

                    OptionalDouble lift = OptionalDouble.empty();
                    if (databaseSize.isPresent()) {
                        final OptionalLong supportConsequent = supportCalculator.calculateSupport(consequent);
                        if (supportConsequent.isPresent()) {
                            final double size = databaseSize.getAsLong();
                            final double term1 = lkSupport / size;
                            final double term2 = support.getAsLong() / size;
                            final double term3 = supportConsequent.getAsLong() / size;
                            lift = OptionalDouble.of(term1 / (term2 * term3));
                        }
                        // if the lift is not enough
                        if (minlift > 0.0 && (!lift.isPresent() || lift.getAsDouble() < minlift)) {
                            continue;
                        }
                    }

                    final AssociationRule<T> rule = ImmutableAssociationRule.<T>builder()
                            .antecedent(antecedent)
                            .consequent(consequent)
                            .coverage(support.getAsLong())
                            .transactionCount(lkSupport)
                            .confidence(conf)
                            .lift(lift)
                            .build();
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{} => {} #SUP: {} #CONF: {}", antecedent, consequent, lkSupport, conf);
                    }
                    if (associationRuleRepository != null) {
                        associationRuleRepository.save(rule);
                    }
                    rules.add(rule);
                }
            }
        }
        return ImmutableAssociationRules.<T>builder().addAllRules(rules).build();
    }

    private static void checkConfidence(final double minconf) {
        checkArgument(!Double.isNaN(minconf) && minconf >= 0.0,
                "minconf must be a non-negative number, got: %s", minconf);
    }
}
