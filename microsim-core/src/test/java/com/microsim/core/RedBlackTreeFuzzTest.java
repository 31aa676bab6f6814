package com.microsim.core;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class RedBlackTreeFuzzTest {

    private static final long SEED = 123456789L;
    private static final int ITERATIONS = 200_000;
    private static final int MAX_PRICE = 100_000;

    // Shadow map to verify presence and order
    private final TreeMap<Long, PriceLevel> shadowMap = new TreeMap<>();
    private final RedBlackTree tree = new RedBlackTree();

    @Test
    public void fuzzTest() {
        Random random = new Random(SEED);
        List<PriceLevel> activeLevels = new ArrayList<>();

        for (int i = 0; i < ITERATIONS; i++) {
            boolean insert = random.nextBoolean();

            if (activeLevels.isEmpty())
                insert = true;
            // Bias towards delete once large to keep the tree churning
            if (activeLevels.size() > 1000)
                insert = random.nextBoolean() && random.nextBoolean();

            if (insert) {
                long price = random.nextInt(MAX_PRICE) + 1;
                if (!shadowMap.containsKey(price)) {
                    PriceLevel level = new PriceLevel();
                    level.reset();
                    level.price = price;

                    tree.insert(level);
                    shadowMap.put(price, level);
                    activeLevels.add(level);
                }
            } else {
                int idx = random.nextInt(activeLevels.size());
                PriceLevel level = activeLevels.get(idx);

                PriceLevel last = activeLevels.get(activeLevels.size() - 1);
                activeLevels.set(idx, last);
                activeLevels.remove(activeLevels.size() - 1);

                tree.remove(level);
                shadowMap.remove(level.price);
            }

            assertEquals(shadowMap.size(), tree.size(), "Size mismatch at op " + i);

            if (i % 100 == 0 || activeLevels.size() < 50) {
                verifyMinMax();
            }

            if (i % 10000 == 0) {
                validateTree();
            }
        }
        validateTree();
    }

    private void verifyMinMax() {
        if (shadowMap.isEmpty()) {
            assertNull(tree.getBestPrice(true), "Tree Min should be null");
            assertNull(tree.getBestPrice(false), "Tree Max should be null");
        } else {
            assertEquals(shadowMap.firstKey(), tree.getBestPrice(true).price, "Min Price Mismatch");
            assertEquals(shadowMap.lastKey(), tree.getBestPrice(false).price, "Max Price Mismatch");
        }
    }

    private void validateTree() {
        PriceLevel root = tree.getRoot();
        if (root == null) {
            assertTrue(shadowMap.isEmpty(), "Tree is empty but shadow map is not");
            return;
        }

        List<Long> treeKeys = new ArrayList<>();
        validateBST(root, Long.MIN_VALUE, Long.MAX_VALUE, treeKeys);
        assertEquals(new ArrayList<>(shadowMap.keySet()), treeKeys, "Tree structure mismatch with Shadow Map");

        List<Long> visited = new ArrayList<>();
        tree.forEach(true, level -> visited.add(level.price));
        assertEquals(treeKeys, visited, "forEach order mismatch");

        assertFalse(root.color, "Root must be BLACK");
        validateColors(root);
        validateBlackHeight(root);
        validateParents(root, null);
    }

    private void validateBST(PriceLevel node, long min, long max, List<Long> keys) {
        if (node == null)
            return;

        assertTrue(node.price > min, "Level " + node.price + " <= min " + min);
        assertTrue(node.price < max, "Level " + node.price + " >= max " + max);

        validateBST(node.left, min, node.price, keys);
        keys.add(node.price);
        validateBST(node.right, node.price, max, keys);
    }

    private void validateColors(PriceLevel node) {
        if (node == null)
            return;

        if (node.color) { // RED
            if (node.left != null)
                assertFalse(node.left.color, "Red node has Red left child");
            if (node.right != null)
                assertFalse(node.right.color, "Red node has Red right child");
        }
        validateColors(node.left);
        validateColors(node.right);
    }

    private int validateBlackHeight(PriceLevel node) {
        if (node == null)
            return 1;

        int leftH = validateBlackHeight(node.left);
        int rightH = validateBlackHeight(node.right);
        assertEquals(leftH, rightH, "Black height mismatch at level " + node.price);

        return leftH + (node.color ? 0 : 1);
    }

    private void validateParents(PriceLevel node, PriceLevel parent) {
        if (node == null)
            return;

        assertEquals(parent, node.parent, "Parent mismatch for level " + node.price);
        validateParents(node.left, node);
        validateParents(node.right, node);
    }
}
