package com.stewel.mining.fpgrowth;

/* This file is copyright (c) 2008-2013 Philippe Fournier-Viger
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

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This is an implementation of the FPGROWTH algorithm (Han et al., 2004).
 * FPGrowth is described here:
 * <br/><br/>
 * <p>
 * Han, J., Pei, J., & Yin, Y. (2000, May). Mining frequent patterns without candidate generation. In ACM SIGMOD Record (Vol. 29, No. 2, pp. 1-12). ACM
 * <br/><br/>
 * <p>
 * The recursion over conditional trees runs on an explicit stack, so the depth of the
 * search (at most the number of frequent items) does not depend on the size of the call stack.
 * Every frame holds one tree and its suffix, the items the tree is conditioned on. A frame for a
 * conditional tree only holds its parent frame and item until it is popped, and a tree is
 * dropped as soon as its patterns and those of its conditional trees are collected.
 * <p>
 * An instance keeps statistics about its latest run and is not meant to be shared between threads.
 *
 * @see FPTree
 */
public class AlgoFPGrowth<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlgoFPGrowth.class);

    // for statistics
    private long startTimestamp; // start time of the latest execution
    private long endTime; // end time of the latest execution
    private int transactionCount; // transaction count in the database
    private int itemsetCount; // number of freq. itemsets found
    private int conditionalTreeCount; // number of conditional trees built
    private int liveConditionalTrees; // conditional trees currently held
    private int peakConditionalTrees; // most conditional trees held at once

    // parameter
    public final long minimumSupport; // the absolute minimum support

    /**
     * Constructor
     *
     * @param minimumSupport the absolute minimum support, at least 1
     */
    public AlgoFPGrowth(final long minimumSupport) {
        checkArgument(minimumSupport >= 1, "minimumSupport must be at least 1, got: %s", minimumSupport);
        this.minimumSupport = minimumSupport;
    }

    /**
     * Builds the FP tree of the transactions and mines all frequent itemsets from it.
     *
     * @param transactions the transactions, each one a sequence of items
     * @return the frequent itemsets with their support
     */
    public Itemsets<T> runAlgorithm(final Iterable<? extends Iterable<? extends T>> transactions) {
        checkNotNull(transactions, "transactions");
        startTimestamp = System.currentTimeMillis();
        final List<Iterable<? extends T>> database = Lists.newArrayList(transactions);
        transactionCount = database.size();
        final FPTree<T> tree = FPTree.build(database, minimumSupport);
        final Itemsets<T> patterns = mine(tree);
        endTime = System.currentTimeMillis();
        return patterns;
    }

    /**
     * This method mines patterns from a fully built FP tree.
     * <p>
     * Mining does not modify the tree; mining the same tree again yields the same itemsets.
     *
     * @param tree the FP tree, built with this instance's minimum support
     * @return the frequent itemsets with their support
     */
    public Itemsets<T> fpgrowth(final FPTree<T> tree) {
        checkNotNull(tree, "tree");
        startTimestamp = System.currentTimeMillis();
        transactionCount = 0;
        final Itemsets<T> patterns = mine(tree);
        endTime = System.currentTimeMillis();
        return patterns;
    }

    private Itemsets<T> mine(final FPTree<T> tree) {
        checkArgument(tree.minimumSupport() == minimumSupport,
                "tree was built with minimum support %s, expected %s", tree.minimumSupport(), minimumSupport);
        itemsetCount = 0;
        conditionalTreeCount = 0;
        liveConditionalTrees = 0;
        peakConditionalTrees = 0;

        final Itemsets<T> patterns = new Itemsets<>();
        final Itemset<T> rootSuffix = tree.rootItem() == null
                ? Itemset.<T>empty()
                : Itemset.of(tree.rootItem());

        final Deque<Frame<T>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(tree, rootSuffix));
        while (!stack.isEmpty()) {
            final Frame<T> frame = stack.pop();
            final FPTree<T> current = resolve(frame);
            // a conditional tree's suffix is a pattern on its own
            if (current.rootItem() != null) {
                saveItemset(patterns, frame.suffix, current.rootCount());
            }
            // We need to check if there is a single path in the prefix tree or not.
            if (current.hasSinglePath()) {
                addAllCombinationsForPathAndPrefix(patterns, current, frame.suffix);
                release(frame);
            } else {
                fpgrowthMoreThanOnePath(stack, frame);
            }
        }
        return patterns;
    }

    /**
     * Builds the conditional tree of a frame when it is popped, so that at any time only the
     * trees on the path from the root to the current frame exist.
     */
    private FPTree<T> resolve(final Frame<T> frame) {
        if (frame.tree == null) {
            frame.tree = frame.parent.tree.createConditionalTree(frame.item);
            conditionalTreeCount++;
            liveConditionalTrees++;
            peakConditionalTrees = Math.max(peakConditionalTrees, liveConditionalTrees);
        }
        return frame.tree;
    }

    /**
     * Drops the tree of a frame whose patterns are all collected, and the trees of the
     * ancestors left without pending frames.
     */
    private void release(final Frame<T> finished) {
        Frame<T> frame = finished;
        while (frame != null) {
            if (frame.item != null) {
                liveConditionalTrees--;
            }
            frame.tree = null;
            frame = frame.parent;
            if (frame == null || --frame.pendingChildren > 0) {
                return;
            }
        }
    }

    /**
     * Mine an FP-Tree having more than one path: for each frequent item, from the least
     * frequent to the most frequent, schedule the item's conditional tree with the item
     * appended to the suffix. The conditional tree itself is built once its frame is popped.
     *
     * @param stack the pending frames
     * @param frame the frame of a tree with branches
     */
    private void fpgrowthMoreThanOnePath(final Deque<Frame<T>> stack, final Frame<T> frame) {
        final List<T> miningOrder = frame.tree.frequencies().miningOrder();
        frame.pendingChildren = miningOrder.size();
        // pushed in reverse so the least frequent item is popped first
        for (final T item : Lists.reverse(miningOrder)) {
            stack.push(new Frame<>(frame, item, frame.suffix.union(item)));
        }
    }

    /**
     * This method adds all combinations of the items of a single path tree, concatenated with
     * the suffix, to the set of patterns found. On a single path the support of a combination
     * is the smallest count among its items.
     * <p>
     * A path holds at most 30 frequent items, {@link Sets#powerSet} rejects larger sets with an
     * {@link IllegalArgumentException}.
     *
     * @param patterns the patterns found so far
     * @param tree     a tree without branches
     * @param suffix   the items the tree is conditioned on
     */
    private void addAllCombinationsForPathAndPrefix(final Itemsets<T> patterns, final FPTree<T> tree,
                                                    final Itemset<T> suffix) {
        final ItemFrequencies<T> frequencies = tree.frequencies();
        for (final Set<T> combination : Sets.powerSet(frequencies.items())) {
            if (combination.isEmpty()) {
                continue;
            }
            long support = Long.MAX_VALUE;
            for (final T item : combination) {
                support = Math.min(support, frequencies.count(item));
            }
            saveItemset(patterns, suffix.union(combination), support);
        }
    }

    /**
     * Keep a frequent itemset that is found.
     */
    private void saveItemset(final Itemsets<T> patterns, final Itemset<T> itemset, final long support) {
        // increase the number of itemsets found for statistics purpose
        itemsetCount++;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} #SUP: {}", itemset, support);
        }
        patterns.merge(itemset, support);
    }

    public int getItemsetCount() {
        return itemsetCount;
    }

    public int getConditionalTreeCount() {
        return conditionalTreeCount;
    }

    /**
     * Returns the largest number of conditional trees held at the same time during the latest run.
     */
    public int getPeakConditionalTreeCount() {
        return peakConditionalTrees;
    }

    /**
     * Print statistics about the algorithm execution to Logger.
     */
    public void printStats() {
        LOGGER.info("=============  FP-GROWTH - STATS =============");
        final long temps = endTime - startTimestamp;
        LOGGER.info(" Transactions count from database : " + transactionCount);
        LOGGER.info(" Frequent itemsets count : " + itemsetCount);
        LOGGER.info(" Conditional trees built : " + conditionalTreeCount);
        LOGGER.info(" Conditional trees held at once : " + peakConditionalTrees);
        LOGGER.info(" Total time ~ " + temps + " ms");
        LOGGER.info("===================================================");
    }

    private static final class Frame<T> {
        @Nullable
        private final Frame<T> parent;
        @Nullable
        private final T item;
        private final Itemset<T> suffix;
        @Nullable
        private FPTree<T> tree;
        private int pendingChildren;

        private Frame(final FPTree<T> tree, final Itemset<T> suffix) {
            this.parent = null;
            this.item = null;
            this.tree = tree;
            this.suffix = suffix;
        }

        private Frame(final Frame<T> parent, final T item, final Itemset<T> suffix) {
            this.parent = parent;
            this.item = item;
            this.suffix = suffix;
        }
    }
}
