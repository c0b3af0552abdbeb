package com.stewel.mining.fpgrowth;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class FPTreeTest {

    static final List<List<Integer>> TEXTBOOK_TRANSACTIONS = Arrays.asList(
            Arrays.asList(1, 2, 5),
            Arrays.asList(2, 4),
            Arrays.asList(2, 3),
            Arrays.asList(1, 2, 4),
            Arrays.asList(1, 3),
            Arrays.asList(2, 3),
            Arrays.asList(1, 3),
            Arrays.asList(1, 2, 3, 5),
            Arrays.asList(1, 2, 3));

    private FPTree<Integer> tree;

    @Before
    public void setUp() {
        tree = FPTree.build(TEXTBOOK_TRANSACTIONS, 2);
    }

    private static List<Long> counts(final List<FPTree<Integer>.FPNode> nodes) {
        final List<Long> counts = new ArrayList<>();
        for (final FPTree<Integer>.FPNode node : nodes) {
            counts.add(node.count());
        }
        return counts;
    }

    @Test
    public void sharesCommonPrefixes() {
        final FPTree<Integer>.FPNode root = tree.root();
        assertNull(root.item());
        assertNull(tree.rootItem());
        assertEquals(2, root.numChildren());

        final FPTree<Integer>.FPNode two = root.child(2);
        assertEquals(7L, two.count());
        assertEquals(2L, root.child(1).count());

        final FPTree<Integer>.FPNode twoOne = two.child(1);
        assertEquals(4L, twoOne.count());
        assertEquals(1L, two.child(4).count());
        assertEquals(2L, two.child(3).count());
        assertEquals(2L, twoOne.child(3).count());
        assertEquals(1L, twoOne.child(3).child(5).count());
        assertSame(two, twoOne.parent());
    }

    @Test
    public void sortsItemsByDescendingFrequency() {
        assertEquals(Arrays.asList(2, 1, 3, 5, 4), tree.frequencies().canonicalOrder());
        assertEquals(Arrays.asList(4, 5, 3, 1, 2), tree.frequencies().miningOrder());
    }

    @Test
    public void chainsOccurrencesInInsertionOrder() {
        final List<FPTree<Integer>.FPNode> threes = tree.nodes(3);
        assertEquals(Arrays.asList(2L, 2L, 2L), counts(threes));
        assertEquals(Integer.valueOf(2), threes.get(0).parent().item());
        assertEquals(Integer.valueOf(1), threes.get(1).parent().item());
        assertEquals(Integer.valueOf(1), threes.get(2).parent().item());
        assertSame(threes.get(0), tree.header(3));
        assertNull(threes.get(2).nodeLink());

        assertEquals(Arrays.asList(4L, 2L), counts(tree.nodes(1)));
        assertTrue(tree.nodes(42).isEmpty());
    }

    @Test
    public void collectsWeightedPrefixPaths() {
        final List<WeightedTransaction<Integer>> base = tree.conditionalPatternBase(5);
        assertEquals(Arrays.asList(
                new WeightedTransaction<Integer>(Arrays.asList(1, 2), 1),
                new WeightedTransaction<Integer>(Arrays.asList(3, 1, 2), 1)), base);

        final List<WeightedTransaction<Integer>> rootLevel = tree.conditionalPatternBase(2);
        assertEquals(Collections.singletonList(new WeightedTransaction<Integer>(Collections.<Integer>emptyList(), 7)),
                rootLevel);
    }

    @Test
    public void buildsConditionalTreeRootedAtTheSuffix() {
        final FPTree<Integer> conditional = tree.createConditionalTree(5);
        assertEquals(Integer.valueOf(5), conditional.rootItem());
        assertEquals(2L, conditional.rootCount());
        assertEquals(2L, conditional.frequencies().count(1));
        assertEquals(2L, conditional.frequencies().count(2));
        assertFalse(conditional.frequencies().contains(3));
        assertTrue(conditional.hasSinglePath());
    }

    @Test
    public void detectsBranches() {
        assertFalse(tree.hasSinglePath());
        assertFalse(tree.createConditionalTree(3).hasSinglePath());
        assertTrue(tree.createConditionalTree(1).hasSinglePath());
    }

    @Test
    public void equalCountsKeepOneOrderAcrossTransactions() {
        final FPTree<String> ties = FPTree.build(Arrays.asList(
                Arrays.asList("x", "y"),
                Arrays.asList("y", "x")), 1);
        assertEquals(1, ties.root().numChildren());
        assertEquals(2L, ties.root().child("x").child("y").count());
        assertTrue(ties.hasSinglePath());
    }

    @Test
    public void insertsWeightedTransactions() {
        final FPTree<String> weighted = FPTree.build(Arrays.asList(
                new WeightedTransaction<String>(Arrays.asList("a", "b"), 3),
                new WeightedTransaction<String>(Collections.singletonList("a"), 2)), 1, null, 0);
        assertEquals(5L, weighted.root().child("a").count());
        assertEquals(3L, weighted.root().child("a").child("b").count());
    }

    @Test
    public void transactionWithoutFrequentItemsAddsNothing() {
        final FPTree<Integer> sparse = FPTree.build(Arrays.asList(
                Arrays.asList(1, 2),
                Arrays.asList(1),
                Arrays.asList(7, 8)), 2);
        assertEquals(1, sparse.root().numChildren());
        assertEquals(2L, sparse.root().child(1).count());
        assertNull(sparse.root().child(1).child(2));
    }

    @Test
    public void emptyDatabaseGivesAnEmptyTree() {
        final FPTree<Integer> empty = FPTree.build(Collections.<List<Integer>>emptyList(), 3);
        assertTrue(empty.isEmpty());
        assertTrue(empty.hasSinglePath());
        assertTrue(empty.frequencies().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsRootItemWithoutCount() {
        FPTree.build(Collections.<WeightedTransaction<Integer>>emptyList(), 1, 7, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveMinimumSupport() {
        FPTree.build(TEXTBOOK_TRANSACTIONS, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void conditionalPatternBaseNeedsAFrequentItem() {
        tree.conditionalPatternBase(42);
    }
}
