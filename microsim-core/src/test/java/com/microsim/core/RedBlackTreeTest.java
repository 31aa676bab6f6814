package com.microsim.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RedBlackTreeTest {

    private RedBlackTree tree;

    @BeforeEach
    public void setup() {
        tree = new RedBlackTree();
    }

    private PriceLevel createLevel(long price) {
        PriceLevel level = new PriceLevel();
        level.reset();
        level.price = price;
        return level;
    }

    @Test
    public void testRootIsBlack() {
        PriceLevel level = createLevel(100);
        tree.insert(level);

        assertEquals(level, tree.getRoot());
        assertFalse(level.color, "Root must always be BLACK");
        assertNull(level.parent);
        assertEquals(1, tree.size());
    }

    @Test
    public void testUncleRedRecolors() {
        // 10(B) with 5(R) and 15(R); inserting 1 flips colors
        tree.insert(createLevel(10));
        tree.insert(createLevel(5));
        tree.insert(createLevel(15));
        tree.insert(createLevel(1));

        assertFalse(tree.getRoot().color, "Root 10 is Black");
        assertFalse(tree.getRoot().left.color, "Level 5 is Black");
        assertFalse(tree.getRoot().right.color, "Level 15 is Black");
        assertTrue(tree.getRoot().left.left.color, "Level 1 is Red");
    }

    @Test
    public void testLeftLeaningLineRotatesRight() {
        tree.insert(createLevel(10));
        tree.insert(createLevel(5));
        tree.insert(createLevel(1));

        // 5(B) with 1(R) and 10(R)
        assertEquals(5, tree.getRoot().price);
        assertFalse(tree.getRoot().color);
        assertEquals(1, tree.getRoot().left.price);
        assertTrue(tree.getRoot().left.color);
        assertEquals(10, tree.getRoot().right.price);
        assertTrue(tree.getRoot().right.color);
    }

    @Test
    public void testRightLeaningLineRotatesLeft() {
        tree.insert(createLevel(10));
        tree.insert(createLevel(15));
        tree.insert(createLevel(20));

        assertEquals(15, tree.getRoot().price);
        assertFalse(tree.getRoot().color);
        assertEquals(10, tree.getRoot().left.price);
        assertEquals(20, tree.getRoot().right.price);
    }

    @Test
    public void testBestPriceOnBothEnds() {
        tree.insert(createLevel(50));
        tree.insert(createLevel(20));
        tree.insert(createLevel(80));
        tree.insert(createLevel(10));
        tree.insert(createLevel(30));

        assertEquals(10, tree.getBestPrice(true).price, "Best ask is the lowest price");
        assertEquals(80, tree.getBestPrice(false).price, "Best bid is the highest price");
    }

    @Test
    public void testEmptyTree() {
        assertTrue(tree.isEmpty());
        assertNull(tree.getBestPrice(true));
        assertNull(tree.getBestPrice(false));
        assertNull(tree.find(100));
    }

    @Test
    public void testFindAndRemove() {
        PriceLevel a = createLevel(101);
        PriceLevel b = createLevel(99);
        PriceLevel c = createLevel(105);
        tree.insert(a);
        tree.insert(b);
        tree.insert(c);

        assertSame(b, tree.find(99));
        tree.remove(b);
        assertNull(tree.find(99));
        assertEquals(2, tree.size());
        assertEquals(101, tree.getBestPrice(true).price);
    }

    @Test
    public void testRemovingUnknownLevelIsIgnored() {
        tree.insert(createLevel(100));
        tree.remove(createLevel(100)); // same price, different node
        tree.remove(createLevel(7));

        assertEquals(1, tree.size());
        assertNotNull(tree.find(100));
    }

    @Test
    public void testDuplicatePriceIsRejected() {
        tree.insert(createLevel(100));
        assertThrows(IllegalStateException.class, () -> tree.insert(createLevel(100)));
        assertEquals(1, tree.size());
    }

    @Test
    public void testForEachVisitsInPriceOrder() {
        long[] prices = {40, 10, 70, 20, 60, 30, 50};
        for (long price : prices) {
            tree.insert(createLevel(price));
        }

        List<Long> ascending = new ArrayList<>();
        tree.forEach(true, level -> ascending.add(level.price));
        assertEquals(List.of(10L, 20L, 30L, 40L, 50L, 60L, 70L), ascending);

        List<Long> descending = new ArrayList<>();
        tree.forEach(false, level -> descending.add(level.price));
        assertEquals(List.of(70L, 60L, 50L, 40L, 30L, 20L, 10L), descending);
    }
}
