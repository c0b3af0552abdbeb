package com.stewel.mining.fpgrowth;
/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A straightforward implementation of FPTrees as described in Han et. al.
 * <p>
 * A tree owns its frequency table, its header table and its node graph. The root either
 * carries no item (a tree built from caller transactions) or the suffix item a conditional
 * tree was built for, together with that item's count in the parent tree.
 * <p>
 * Nodes are only created and incremented while the tree is built; afterwards the tree is
 * read-only.
 */
public class FPTree<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FPTree.class);

    private final ItemFrequencies<T> frequencies;
    private final FPNode root;
    // item -> first node carrying the item, further occurrences follow FPNode.nodeLink
    private final Map<T, FPNode> headerTable;
    // item -> last node of the occurrence chain, only used while inserting
    private final Map<T, FPNode> chainTails;

    public class FPNode {
        private final FPNode parent;
        private final Map<T, FPNode> childMap;
        @Nullable
        private final T item;
        private long count;
        private FPNode nodeLink;

        private FPNode(@Nullable final FPNode parent, @Nullable final T item, final long count) {
            this.parent = parent;
            this.item = item;
            this.count = count;
            this.childMap = Maps.newLinkedHashMap();
        }

        private void addChild(final FPNode child) {
            this.childMap.put(child.item, child);
        }

        public Collection<FPNode> children() {
            return childMap.values();
        }

        public int numChildren() {
            return childMap.size();
        }

        @Nullable
        public FPNode parent() {
            return parent;
        }

        @Nullable
        public FPNode child(final T childItem) {
            return childMap.get(childItem);
        }

        /**
         * Returns the item of this node, {@code null} only for the root of a tree without suffix.
         */
        @Nullable
        public T item() {
            return item;
        }

        public long count() {
            return count;
        }

        /**
         * Returns the next node elsewhere in the tree carrying the same item.
         */
        @Nullable
        public FPNode nodeLink() {
            return nodeLink;
        }

        private void accumulate(final long incr) {
            count = count + incr;
        }
    }

    private FPTree(final List<WeightedTransaction<T>> transactions, final long minimumSupport,
                   @Nullable final T rootItem, final long rootCount) {
        this.frequencies = ItemFrequencies.count(transactions, minimumSupport);
        this.headerTable = Maps.newLinkedHashMap();
        this.chainTails = Maps.newHashMap();
        this.root = new FPNode(null, rootItem, rootCount);
        for (final WeightedTransaction<T> transaction : transactions) {
            accumulate(transaction.getItems(), transaction.getWeight());
        }
        chainTails.clear();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built tree for suffix '{}' from {} transactions, {} frequent items",
                    rootItem, transactions.size(), frequencies.size());
        }
    }

    /**
     * Builds the tree of a transaction database, every transaction counted once.
     *
     * @param transactions   the transactions
     * @param minimumSupport the absolute minimum support, at least 1
     * @return the tree, its root carries no item
     */
    public static <T> FPTree<T> build(final Iterable<? extends Iterable<? extends T>> transactions,
                                      final long minimumSupport) {
        checkNotNull(transactions, "transactions");
        final List<WeightedTransaction<T>> weighted = new ArrayList<>();
        for (final Iterable<? extends T> transaction : transactions) {
            weighted.add(WeightedTransaction.<T>of(transaction));
        }
        return new FPTree<>(weighted, minimumSupport, null, 0L);
    }

    /**
     * Builds a tree from weighted transactions, with or without a suffix item at its root.
     *
     * @param transactions   the weighted transactions
     * @param minimumSupport the absolute minimum support, at least 1
     * @param rootItem       the suffix item, {@code null} for no suffix
     * @param rootCount      the count of the suffix item; ignored without suffix
     * @return the tree
     */
    public static <T> FPTree<T> build(final List<WeightedTransaction<T>> transactions,
                                      final long minimumSupport,
                                      @Nullable final T rootItem,
                                      final long rootCount) {
        checkNotNull(transactions, "transactions");
        checkArgument(rootItem == null || rootCount > 0,
                "rootCount must be positive for root item '%s', got: %s", rootItem, rootCount);
        return new FPTree<>(transactions, minimumSupport, rootItem, rootItem == null ? 0L : rootCount);
    }

    /**
     * Adds an itemset with the given occurrence count.
     * <p>
     * Infrequent items are dropped, the rest is sorted by the canonical order and inserted
     * starting at the root.
     */
    private void accumulate(final List<T> argItems, final long count) {
        final List<T> items = Lists.newArrayList();
        for (final T item : argItems) {
            if (frequencies.contains(item)) {
                items.add(item);
            }
        }
        items.sort(frequencies.descendingFrequencyOrder());

        FPNode currNode = root;
        for (final T item : items) {
            FPNode next = currNode.child(item);
            if (next == null) {
                next = new FPNode(currNode, item, count);
                currNode.addChild(next);
                linkOccurrence(next);
            } else {
                next.accumulate(count);
            }
            currNode = next;
        }
    }

    private void linkOccurrence(final FPNode node) {
        final FPNode tail = chainTails.get(node.item);
        if (tail == null) {
            headerTable.put(node.item, node);
        } else {
            tail.nodeLink = node;
        }
        chainTails.put(node.item, node);
    }

    /**
     * Returns the root node of the tree.
     */
    public FPNode root() {
        return root;
    }

    /**
     * Returns the suffix item of a conditional tree, {@code null} for a tree without suffix.
     */
    @Nullable
    public T rootItem() {
        return root.item();
    }

    public long rootCount() {
        return root.count();
    }

    public ItemFrequencies<T> frequencies() {
        return frequencies;
    }

    public long minimumSupport() {
        return frequencies.minimumSupport();
    }

    /**
     * Returns the first node carrying the item, or {@code null} if the item is not in the tree.
     */
    @Nullable
    public FPNode header(final T item) {
        return headerTable.get(item);
    }

    /**
     * Returns all nodes carrying the item, in insertion order, by following the occurrence chain.
     */
    public List<FPNode> nodes(final T item) {
        final List<FPNode> nodeList = Lists.newArrayList();
        for (FPNode node = headerTable.get(item); node != null; node = node.nodeLink) {
            nodeList.add(node);
        }
        return nodeList;
    }

    public boolean isEmpty() {
        return root.numChildren() == 0;
    }

    /**
     * Returns true if no node from the root down to the leaf has more than one child.
     */
    public boolean hasSinglePath() {
        FPNode currNode = root;
        while (currNode.numChildren() == 1) {
            currNode = currNode.children().iterator().next();
        }
        return currNode.numChildren() == 0;
    }

    /**
     * Collects the conditional pattern base of an item: for every node carrying the item, the
     * items on the path from its parent up to (excluding) the root, weighted with the node's count.
     *
     * @param targetItem a frequent item of this tree
     * @return the prefix paths, paths of length zero included
     */
    public List<WeightedTransaction<T>> conditionalPatternBase(final T targetItem) {
        checkArgument(frequencies.contains(targetItem), "item '%s' is not frequent in this tree", targetItem);
        final List<WeightedTransaction<T>> prefixPaths = Lists.newArrayList();
        long total = 0;
        for (final FPNode node : nodes(targetItem)) {
            final long pathCount = node.count();
            final List<T> path = Lists.newArrayList();
            FPNode currNode = node.parent();
            while (currNode != root) {
                if (currNode.count() < pathCount)
                    throw new IllegalStateException("node '" + currNode.item() + "' counts " + currNode.count()
                            + " below its descendant '" + targetItem + "' (" + pathCount + ")");
                path.add(currNode.item());
                currNode = currNode.parent();
            }
            prefixPaths.add(new WeightedTransaction<>(path, pathCount));
            total += pathCount;
        }
        if (total != frequencies.count(targetItem))
            throw new IllegalStateException("mismatched counts for targetItem="
                    + targetItem + ", (" + total + " != " + frequencies.count(targetItem) + "); "
                    + "thisTree=" + this + "\n");
        return prefixPaths;
    }

    /**
     * Returns the conditional FP tree of an item: the tree of its conditional pattern base,
     * rooted at the item with the item's count in this tree.
     */
    public FPTree<T> createConditionalTree(final T targetItem) {
        return build(conditionalPatternBase(targetItem), minimumSupport(), targetItem, frequencies.count(targetItem));
    }

    private void toStringHelper(final StringBuilder sb, final FPNode currNode, final String prefix) {
        if (currNode.numChildren() == 0) {
            sb.append(prefix).append("-{item:").append(currNode.item())
                    .append(", cnt:").append(currNode.count()).append("}\n");
        } else {
            final StringBuilder newPre = new StringBuilder(prefix);
            newPre.append("-{item:").append(currNode.item())
                    .append(", cnt:").append(currNode.count()).append('}');
            final StringBuilder fakePre = new StringBuilder();
            while (fakePre.length() < newPre.length()) {
                fakePre.append(' ');
            }
            int i = 0;
            for (final FPNode child : currNode.children())
                toStringHelper(sb, child, (i++ == 0 ? newPre : fakePre).toString() + '-' + i + "->");
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[FPTree\n");
        toStringHelper(sb, root, "  ");
        sb.append("]");
        return sb.toString();
    }

}
