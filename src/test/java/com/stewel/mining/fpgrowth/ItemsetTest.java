package com.stewel.mining.fpgrowth;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ItemsetTest {

    @Test
    public void equalityIgnoresOrder() {
        assertEquals(Itemset.of(3, 1, 2), Itemset.of(1, 2, 3));
        assertEquals(Itemset.of(3, 1, 2).hashCode(), Itemset.of(1, 2, 3).hashCode());
        assertNotEquals(Itemset.of(1, 2), Itemset.of(1, 2, 3));
    }

    @Test
    public void duplicatesCollapse() {
        assertEquals(2, Itemset.of("a", "b", "a").size());
    }

    @Test
    public void unionAndMinus() {
        final Itemset<String> ab = Itemset.of("a", "b");
        assertEquals(Itemset.of("a", "b", "c"), ab.union("c"));
        assertEquals(ab, ab.union("a"));
        assertEquals(Itemset.of("a", "b", "c", "d"), ab.union(Arrays.asList("c", "d")));
        assertEquals(Itemset.of("c"), Itemset.of("a", "b", "c").minus(ab));
        assertTrue(ab.minus(ab).isEmpty());
        assertFalse(ab.contains("c"));
    }

    @Test
    public void printsItemsInInsertionOrder() {
        assertEquals("(2, 1)", Itemset.of(2, 1).toString());
        assertEquals("()", Itemset.empty().toString());
    }
}
