package com.microsim.core;

import java.util.function.Consumer;

/**
 * <h1>Intrusive Red-Black Tree of Price Levels</h1>
 *
 * <p>
 * One tree per book side keeps the price levels sorted so the best price is
 * an O(log N) walk and a level can be dropped in O(log N) when its last order
 * leaves. The {@link PriceLevel} <i>is</i> the node: it carries its own
 * left/right/parent pointers and color, so linking a level allocates nothing.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ol>
 * <li>Every node is RED or BLACK.</li>
 * <li>The root is BLACK.</li>
 * <li>A RED node has no RED child.</li>
 * <li>Every root-to-leaf path has the same number of BLACK nodes.</li>
 * </ol>
 * <p>
 * Prices are unique keys; the {@link OrderBook} guarantees that through its
 * price-to-level map.
 * </p>
 */
public class RedBlackTree {

    private static final boolean RED = true;
    private static final boolean BLACK = false;

    private PriceLevel root;
    private int size;

    public PriceLevel getRoot() {
        return root;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public PriceLevel find(long price) {
        PriceLevel current = root;
        while (current != null) {
            if (price == current.price) {
                return current;
            }
            current = price < current.price ? current.left : current.right;
        }
        return null;
    }

    /**
     * @param min true for the lowest price (best ask), false for the highest
     *            (best bid)
     * @return the extreme level, or null when the tree is empty
     */
    public PriceLevel getBestPrice(boolean min) {
        PriceLevel current = root;
        if (current == null) {
            return null;
        }
        if (min) {
            while (current.left != null) {
                current = current.left;
            }
        } else {
            while (current.right != null) {
                current = current.right;
            }
        }
        return current;
    }

    /**
     * Visits every level in price order.
     *
     * @param ascending true for lowest price first
     */
    public void forEach(boolean ascending, Consumer<PriceLevel> visitor) {
        PriceLevel current = getBestPrice(ascending);
        while (current != null) {
            // Step first: the visitor is allowed to look but not to unlink
            PriceLevel next = ascending ? successor(current) : predecessor(current);
            visitor.accept(current);
            current = next;
        }
    }

    public void insert(PriceLevel node) {
        if (node == null) {
            return;
        }
        node.left = null;
        node.right = null;
        node.parent = null;
        node.color = RED;

        if (root == null) {
            root = node;
            root.color = BLACK;
            size = 1;
            return;
        }

        PriceLevel current = root;
        PriceLevel parent = null;
        while (current != null) {
            parent = current;
            if (node.price < current.price) {
                current = current.left;
            } else if (node.price > current.price) {
                current = current.right;
            } else {
                throw new IllegalStateException("Duplicate price level " + node.price);
            }
        }

        node.parent = parent;
        if (node.price < parent.price) {
            parent.left = node;
        } else {
            parent.right = node;
        }
        size++;
        fixAfterInsert(node);
    }

    /**
     * Unlinks {@code node}. Ignored if the node is not (or no longer) in this
     * tree.
     */
    public void remove(PriceLevel node) {
        if (node == null || find(node.price) != node) {
            return;
        }
        deleteNode(node);
        size--;
    }

    private void fixAfterInsert(PriceLevel node) {
        node.color = RED;

        while (node != null && node != root && isRed(node.parent)) {
            PriceLevel grandparent = grandparentOf(node);
            if (parentOf(node) == leftOf(grandparent)) {
                PriceLevel uncle = rightOf(grandparent);
                if (isRed(uncle)) {
                    // Red uncle: push blackness down from the grandparent
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparent, RED);
                    node = grandparent;
                } else {
                    if (node == rightOf(parentOf(node))) {
                        node = parentOf(node);
                        rotateLeft(node);
                    }
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateRight(grandparentOf(node));
                }
            } else {
                PriceLevel uncle = leftOf(grandparent);
                if (isRed(uncle)) {
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparent, RED);
                    node = grandparent;
                } else {
                    if (node == leftOf(parentOf(node))) {
                        node = parentOf(node);
                        rotateRight(node);
                    }
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateLeft(grandparentOf(node));
                }
            }
        }
        root.color = BLACK;
    }

    private void rotateLeft(PriceLevel p) {
        if (p == null) {
            return;
        }
        PriceLevel r = p.right;
        p.right = r.left;
        if (r.left != null) {
            r.left.parent = p;
        }
        r.parent = p.parent;
        if (p.parent == null) {
            root = r;
        } else if (p.parent.left == p) {
            p.parent.left = r;
        } else {
            p.parent.right = r;
        }
        r.left = p;
        p.parent = r;
    }

    private void rotateRight(PriceLevel p) {
        if (p == null) {
            return;
        }
        PriceLevel l = p.left;
        p.left = l.right;
        if (l.right != null) {
            l.right.parent = p;
        }
        l.parent = p.parent;
        if (p.parent == null) {
            root = l;
        } else if (p.parent.right == p) {
            p.parent.right = l;
        } else {
            p.parent.left = l;
        }
        l.right = p;
        p.parent = l;
    }

    private void deleteNode(PriceLevel node) {
        // Two children: swap the node with its successor so the node ends up
        // with at most one child. Nodes are pooled objects owned by the book,
        // so we relink them instead of copying keys between them.
        if (node.left != null && node.right != null) {
            swapPositions(node, successor(node));
        }

        PriceLevel replacement = node.left != null ? node.left : node.right;

        if (replacement != null) {
            replacement.parent = node.parent;
            if (node.parent == null) {
                root = replacement;
            } else if (node == node.parent.left) {
                node.parent.left = replacement;
            } else {
                node.parent.right = replacement;
            }
            node.left = null;
            node.right = null;
            node.parent = null;

            if (node.color == BLACK) {
                fixAfterDelete(replacement);
            }
        } else if (node.parent == null) {
            root = null;
        } else {
            // Leaf: use the node itself as the phantom for the fix-up, then cut it
            if (node.color == BLACK) {
                fixAfterDelete(node);
            }
            if (node.parent != null) {
                if (node == node.parent.left) {
                    node.parent.left = null;
                } else if (node == node.parent.right) {
                    node.parent.right = null;
                }
                node.parent = null;
            }
        }
    }

    private void fixAfterDelete(PriceLevel x) {
        while (x != root && isBlack(x)) {
            if (x == leftOf(parentOf(x))) {
                PriceLevel sibling = rightOf(parentOf(x));
                if (isRed(sibling)) {
                    setColor(sibling, BLACK);
                    setColor(parentOf(x), RED);
                    rotateLeft(parentOf(x));
                    sibling = rightOf(parentOf(x));
                }
                if (isBlack(leftOf(sibling)) && isBlack(rightOf(sibling))) {
                    setColor(sibling, RED);
                    x = parentOf(x);
                } else {
                    if (isBlack(rightOf(sibling))) {
                        setColor(leftOf(sibling), BLACK);
                        setColor(sibling, RED);
                        rotateRight(sibling);
                        sibling = rightOf(parentOf(x));
                    }
                    setColor(sibling, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    setColor(rightOf(sibling), BLACK);
                    rotateLeft(parentOf(x));
                    x = root;
                }
            } else {
                PriceLevel sibling = leftOf(parentOf(x));
                if (isRed(sibling)) {
                    setColor(sibling, BLACK);
                    setColor(parentOf(x), RED);
                    rotateRight(parentOf(x));
                    sibling = leftOf(parentOf(x));
                }
                if (isBlack(rightOf(sibling)) && isBlack(leftOf(sibling))) {
                    setColor(sibling, RED);
                    x = parentOf(x);
                } else {
                    if (isBlack(leftOf(sibling))) {
                        setColor(rightOf(sibling), BLACK);
                        setColor(sibling, RED);
                        rotateLeft(sibling);
                        sibling = leftOf(parentOf(x));
                    }
                    setColor(sibling, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    setColor(leftOf(sibling), BLACK);
                    rotateRight(parentOf(x));
                    x = root;
                }
            }
        }
        setColor(x, BLACK);
    }

    /**
     * Exchanges the tree positions (links and colors) of {@code x} and its
     * in-order successor {@code y}. {@code y} is either x's right child or
     * somewhere in x's right subtree.
     */
    private void swapPositions(PriceLevel x, PriceLevel y) {
        PriceLevel xParent = x.parent;
        PriceLevel xLeft = x.left;
        PriceLevel xRight = x.right;
        boolean xColor = x.color;

        PriceLevel yParent = y.parent;
        PriceLevel yLeft = y.left;
        PriceLevel yRight = y.right;
        boolean yColor = y.color;

        boolean adjacent = y == xRight;

        y.parent = xParent;
        if (xParent == null) {
            root = y;
        } else if (xParent.left == x) {
            xParent.left = y;
        } else {
            xParent.right = y;
        }

        y.left = xLeft;
        if (xLeft != null) {
            xLeft.parent = y;
        }
        if (adjacent) {
            y.right = x;
        } else {
            y.right = xRight;
            if (xRight != null) {
                xRight.parent = y;
            }
        }
        y.color = xColor;

        if (adjacent) {
            x.parent = y;
        } else {
            x.parent = yParent;
            if (yParent.left == y) {
                yParent.left = x;
            } else {
                yParent.right = x;
            }
        }
        x.left = yLeft;
        if (yLeft != null) {
            yLeft.parent = x;
        }
        x.right = yRight;
        if (yRight != null) {
            yRight.parent = x;
        }
        x.color = yColor;
    }

    PriceLevel successor(PriceLevel t) {
        if (t == null) {
            return null;
        }
        if (t.right != null) {
            PriceLevel p = t.right;
            while (p.left != null) {
                p = p.left;
            }
            return p;
        }
        PriceLevel p = t.parent;
        PriceLevel child = t;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    PriceLevel predecessor(PriceLevel t) {
        if (t == null) {
            return null;
        }
        if (t.left != null) {
            PriceLevel p = t.left;
            while (p.right != null) {
                p = p.right;
            }
            return p;
        }
        PriceLevel p = t.parent;
        PriceLevel child = t;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    private static boolean isRed(PriceLevel p) {
        return p != null && p.color == RED;
    }

    private static boolean isBlack(PriceLevel p) {
        return p == null || p.color == BLACK;
    }

    private static boolean colorOf(PriceLevel p) {
        return p == null ? BLACK : p.color;
    }

    private static PriceLevel parentOf(PriceLevel p) {
        return p == null ? null : p.parent;
    }

    private static PriceLevel grandparentOf(PriceLevel p) {
        return (p != null && p.parent != null) ? p.parent.parent : null;
    }

    private static void setColor(PriceLevel p, boolean c) {
        if (p != null) {
            p.color = c;
        }
    }

    private static PriceLevel leftOf(PriceLevel p) {
        return p == null ? null : p.left;
    }

    private static PriceLevel rightOf(PriceLevel p) {
        return p == null ? null : p.right;
    }
}
