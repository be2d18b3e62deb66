/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.logging.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import com.sidestore.common.Config;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A map that keeps its keys in ascending order, according to a comparator
 * supplied at construction time or to the natural ordering of the keys.</p>
 *
 * <p>The implementation is a red-black tree as described in Cormen,
 * Leiserson, Rivest and Stein, <i>Introduction to Algorithms</i>. Every
 * path from a node to a leaf holds the same number of black nodes and no
 * red node has a red parent, so the height of the tree stays within twice
 * the logarithm of its size, and {@link #get}, {@link #put} and
 * {@link #remove} take logarithmic time.</p>
 *
 * <p>Nodes are kept in an arena of parallel arrays and are referred to by
 * their slot number (a handle). The {@code left}, {@code right} and
 * {@code parent} links are handles, so rotations rewrite a few integers.
 * Slot {@code 0} is the black nil sentinel that stands for every missing
 * child. The slots of removed nodes are chained on a free list and reused.</p>
 *
 * <p>The comparator must be consistent: keys must not change their order
 * while they are in the map. This class is not synchronized.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class SortedTreeMap<K, V> extends AbstractOrderedMap<K, V> {
    private static final Logger logger = Logger.getLogger(SortedTreeMap.class.getName());

    private static final int NIL = 0;
    private static final boolean RED = false;
    private static final boolean BLACK = true;
    private static final int MIN_CAPACITY = 4;

    private final Comparator<? super K> comparator;

    private Object[] keys;
    private Object[] vals;
    private int[] left;
    private int[] right;
    private int[] parent;
    private boolean[] color;

    private int root = NIL;
    private int size;

    // free slots are chained through right[]
    private int free = NIL;

    // slots at or above the limit have never been used
    private int limit;

    private SortedTreeMap(Comparator<? super K> comparator, int expectedSize) {
        checkArgument(expectedSize >= 0, "expectedSize cannot be negative but was: %s", expectedSize);
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        reset(capacityFor(expectedSize));
    }

    // Construction

    /**
     * Construct an empty map, sorted according to the natural ordering
     * of its keys.
     */
    public static <K extends Comparable<? super K>, V> SortedTreeMap<K, V> create() {
        return new SortedTreeMap<>(Comparator.<K>naturalOrder(), Config.INITIAL_CAPACITY.getAsInt());
    }

    /**
     * Construct an empty map, sorted according to the specified comparator.
     *
     * @param c the comparator that will be used to order this map
     * @throws NullPointerException if {@code c} is null
     */
    public static <K, V> SortedTreeMap<K, V> create(Comparator<? super K> c) {
        return new SortedTreeMap<>(c, Config.INITIAL_CAPACITY.getAsInt());
    }

    /**
     * Construct an empty map, sorted according to the specified comparator,
     * that can hold the given number of mappings without growing.
     *
     * @param c the comparator that will be used to order this map
     * @param expectedSize the number of mappings expected
     * @throws IllegalArgumentException if {@code expectedSize} is negative
     */
    public static <K, V> SortedTreeMap<K, V> create(Comparator<? super K> c, int expectedSize) {
        return new SortedTreeMap<>(c, expectedSize);
    }

    /**
     * Construct a map holding the mappings of the given map, sorted according
     * to the natural ordering of the keys.
     */
    public static <K extends Comparable<? super K>, V> SortedTreeMap<K, V> copyOf(Map<? extends K, ? extends V> m) {
        return copyOf(m, Comparator.<K>naturalOrder());
    }

    /**
     * Construct a map holding the mappings of the given map, sorted according
     * to the specified comparator.
     *
     * @throws NullPointerException if {@code c} is null
     */
    public static <K, V> SortedTreeMap<K, V> copyOf(Map<? extends K, ? extends V> m, Comparator<? super K> c) {
        SortedTreeMap<K, V> result = new SortedTreeMap<>(c, m.size());
        result.putAll(m);
        return result;
    }

    /**
     * Construct a map from a sequence of key-value pairs, sorted according
     * to the natural ordering of the keys. Later pairs overwrite earlier
     * values.
     */
    public static <K extends Comparable<? super K>, V> SortedTreeMap<K, V>
    copyOf(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        return copyOf(entries, Comparator.<K>naturalOrder());
    }

    /**
     * Construct a map from a sequence of key-value pairs, sorted according
     * to the specified comparator. Later pairs overwrite earlier values.
     */
    public static <K, V> SortedTreeMap<K, V>
    copyOf(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, Comparator<? super K> c) {
        SortedTreeMap<K, V> result = new SortedTreeMap<>(c, Config.INITIAL_CAPACITY.getAsInt());
        result.putAll(entries);
        return result;
    }

    // one extra slot for the sentinel
    private static int capacityFor(int expectedSize) {
        return Math.min(Math.max(expectedSize, MIN_CAPACITY), Config.MAX_CAPACITY) + 1;
    }

    private void reset(int capacity) {
        keys = new Object[capacity];
        vals = new Object[capacity];
        left = new int[capacity];
        right = new int[capacity];
        parent = new int[capacity];
        color = new boolean[capacity];
        color[NIL] = BLACK;
        root = free = NIL;
        limit = 1;
        size = 0;
    }

    /**
     * Returns the comparator used to order the keys in this map.
     */
    public Comparator<? super K> comparator() {
        return comparator;
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int t) {
        return (K)keys[t];
    }

    @SuppressWarnings("unchecked")
    private V valueAt(int t) {
        return (V)vals[t];
    }

    private int compare(K k, int t) {
        return comparator.compare(k, keyAt(t));
    }

    // Query Operations

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean containsKey(K key) {
        return getNode(key) != NIL;
    }

    @Override
    public boolean containsValue(V value) {
        if (value == null)
            return false;
        for (Map.Entry<K, V> e : this) {
            if (value.equals(e.getValue()))
                return true;
        }
        return false;
    }

    @Override
    public V get(K key) {
        int t = getNode(key);
        return t == NIL ? null : valueAt(t);
    }

    /**
     * Returns the lowest key currently in this map.
     */
    public Optional<K> firstKey() {
        return root == NIL ? Optional.empty() : Optional.of(keyAt(minimum(root)));
    }

    /**
     * Returns the highest key currently in this map.
     */
    public Optional<K> lastKey() {
        return root == NIL ? Optional.empty() : Optional.of(keyAt(maximum(root)));
    }

    private int getNode(K key) {
        if (key == null)
            return NIL;
        int t = root;
        while (t != NIL) {
            int cmp = compare(key, t);
            if (cmp < 0) {
                t = left[t];
            } else if (cmp > 0) {
                t = right[t];
            } else {
                return t;
            }
        }
        return NIL;
    }

    private int minimum(int t) {
        while (left[t] != NIL)
            t = left[t];
        return t;
    }

    private int maximum(int t) {
        while (right[t] != NIL)
            t = right[t];
        return t;
    }

    // Modification Operations

    /**
     * Associates the specified value with the specified key. An existing
     * node is updated in place without rebalancing; a new key gets a new
     * red node that is then rebalanced.
     */
    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        int p = NIL, t = root, cmp = 0;
        while (t != NIL) {
            p = t;
            cmp = compare(key, t);
            if (cmp < 0) {
                t = left[t];
            } else if (cmp > 0) {
                t = right[t];
            } else {
                V oldValue = valueAt(t);
                vals[t] = value;
                return oldValue;
            }
        }

        int z = allocate();
        keys[z] = key;
        vals[z] = value;
        left[z] = right[z] = NIL;
        parent[z] = p;
        color[z] = RED;

        if (p == NIL) {
            root = z;
        } else if (cmp < 0) {
            left[p] = z;
        } else {
            right[p] = z;
        }

        size++;
        modCount++;
        fixAfterInsertion(z);
        return null;
    }

    @Override
    public V remove(K key) {
        int z = getNode(key);
        if (z == NIL)
            return null;

        V oldValue = valueAt(z);
        deleteNode(z);
        size--;
        modCount++;
        return oldValue;
    }

    /**
     * Removes all of the mappings from this map. The whole tree is dropped
     * at once without rebalancing, and the arena shrinks back to the
     * configured default capacity.
     */
    @Override
    public void clear() {
        reset(capacityFor(Config.INITIAL_CAPACITY.getAsInt()));
        modCount++;
    }

    // Arena

    private int allocate() {
        if (free != NIL) {
            int slot = free;
            free = right[slot];
            return slot;
        }
        if (limit == keys.length) {
            grow();
        }
        return limit++;
    }

    private void release(int slot) {
        keys[slot] = null;
        vals[slot] = null;
        left[slot] = parent[slot] = NIL;
        color[slot] = RED;
        right[slot] = free;
        free = slot;
    }

    private void grow() {
        int oldCapacity = keys.length;
        int newCapacity = oldCapacity + (oldCapacity >> 1) + 1;
        logger.fine("growing sorted tree arena from " + oldCapacity + " to " + newCapacity + " slots");
        keys = Arrays.copyOf(keys, newCapacity);
        vals = Arrays.copyOf(vals, newCapacity);
        left = Arrays.copyOf(left, newCapacity);
        right = Arrays.copyOf(right, newCapacity);
        parent = Arrays.copyOf(parent, newCapacity);
        color = Arrays.copyOf(color, newCapacity);
    }

    // Balancing

    private void rotateLeft(int x) {
        int y = right[x];
        right[x] = left[y];
        if (left[y] != NIL)
            parent[left[y]] = x;
        parent[y] = parent[x];
        if (parent[x] == NIL) {
            root = y;
        } else if (x == left[parent[x]]) {
            left[parent[x]] = y;
        } else {
            right[parent[x]] = y;
        }
        left[y] = x;
        parent[x] = y;
    }

    private void rotateRight(int x) {
        int y = left[x];
        left[x] = right[y];
        if (right[y] != NIL)
            parent[right[y]] = x;
        parent[y] = parent[x];
        if (parent[x] == NIL) {
            root = y;
        } else if (x == right[parent[x]]) {
            right[parent[x]] = y;
        } else {
            left[parent[x]] = y;
        }
        right[y] = x;
        parent[x] = y;
    }

    private void fixAfterInsertion(int x) {
        // the parent of the root is the black sentinel
        while (color[parent[x]] == RED) {
            int p = parent[x], g = parent[p];
            if (p == left[g]) {
                int y = right[g];
                if (color[y] == RED) {
                    color[p] = BLACK;
                    color[y] = BLACK;
                    color[g] = RED;
                    x = g;
                } else {
                    if (x == right[p]) {
                        x = p;
                        rotateLeft(x);
                        p = parent[x];
                    }
                    color[p] = BLACK;
                    color[g] = RED;
                    rotateRight(g);
                }
            } else {
                int y = left[g];
                if (color[y] == RED) {
                    color[p] = BLACK;
                    color[y] = BLACK;
                    color[g] = RED;
                    x = g;
                } else {
                    if (x == left[p]) {
                        x = p;
                        rotateRight(x);
                        p = parent[x];
                    }
                    color[p] = BLACK;
                    color[g] = RED;
                    rotateLeft(g);
                }
            }
        }
        color[root] = BLACK;
    }

    /**
     * Replaces the subtree rooted at {@code u} with the subtree rooted at
     * {@code v}. The parent of {@code v} is set even when {@code v} is the
     * sentinel, so that deletion fixup can climb from there.
     */
    private void transplant(int u, int v) {
        int up = parent[u];
        if (up == NIL) {
            root = v;
        } else if (u == left[up]) {
            left[up] = v;
        } else {
            right[up] = v;
        }
        parent[v] = up;
    }

    private void deleteNode(int z) {
        // a node with two children takes over its successor's mapping,
        // and the successor, which has no left child, is removed instead
        if (left[z] != NIL && right[z] != NIL) {
            int s = minimum(right[z]);
            keys[z] = keys[s];
            vals[z] = vals[s];
            z = s;
        }

        int x = (left[z] != NIL) ? left[z] : right[z];
        transplant(z, x);
        if (color[z] == BLACK)
            fixAfterDeletion(x);

        parent[NIL] = NIL;
        release(z);
    }

    private void fixAfterDeletion(int x) {
        while (x != root && color[x] == BLACK) {
            int p = parent[x];
            if (x == left[p]) {
                int w = right[p];
                if (color[w] == RED) {
                    color[w] = BLACK;
                    color[p] = RED;
                    rotateLeft(p);
                    w = right[p];
                }
                if (color[left[w]] == BLACK && color[right[w]] == BLACK) {
                    color[w] = RED;
                    x = p;
                } else {
                    if (color[right[w]] == BLACK) {
                        color[left[w]] = BLACK;
                        color[w] = RED;
                        rotateRight(w);
                        w = right[p];
                    }
                    color[w] = color[p];
                    color[p] = BLACK;
                    color[right[w]] = BLACK;
                    rotateLeft(p);
                    x = root;
                }
            } else {
                int w = left[p];
                if (color[w] == RED) {
                    color[w] = BLACK;
                    color[p] = RED;
                    rotateRight(p);
                    w = left[p];
                }
                if (color[right[w]] == BLACK && color[left[w]] == BLACK) {
                    color[w] = RED;
                    x = p;
                } else {
                    if (color[left[w]] == BLACK) {
                        color[right[w]] = BLACK;
                        color[w] = RED;
                        rotateLeft(w);
                        w = left[p];
                    }
                    color[w] = color[p];
                    color[p] = BLACK;
                    color[left[w]] = BLACK;
                    rotateRight(p);
                    x = root;
                }
            }
        }
        color[x] = BLACK;
    }

    // Views

    @Override
    public ImmutableList<K> keys() {
        ImmutableList.Builder<K> builder = ImmutableList.builderWithExpectedSize(size);
        InOrderWalk walk = new InOrderWalk();
        for (int t; (t = walk.next()) != NIL; )
            builder.add(keyAt(t));
        return builder.build();
    }

    @Override
    public ImmutableList<V> values() {
        ImmutableList.Builder<V> builder = ImmutableList.builderWithExpectedSize(size);
        InOrderWalk walk = new InOrderWalk();
        for (int t; (t = walk.next()) != NIL; )
            builder.add(valueAt(t));
        return builder.build();
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return new EntryIterator();
    }

    /**
     * An iterative in-order traversal. The stack holds the ancestors whose
     * left subtrees are being visited.
     */
    private class InOrderWalk {
        private int[] stack = new int[16];
        private int depth;

        InOrderWalk() {
            pushLeftSpine(root);
        }

        private void pushLeftSpine(int t) {
            for (; t != NIL; t = left[t]) {
                if (depth == stack.length)
                    stack = Arrays.copyOf(stack, depth * 2);
                stack[depth++] = t;
            }
        }

        /**
         * Returns the handle of the next node, or the sentinel when the
         * walk is complete.
         */
        int next() {
            if (depth == 0)
                return NIL;
            int t = stack[--depth];
            pushLeftSpine(right[t]);
            return t;
        }
    }

    private class EntryIterator extends AbstractIterator<Map.Entry<K, V>> {
        private final int expectedModCount = modCount;
        private final InOrderWalk walk = new InOrderWalk();

        @Override
        protected Map.Entry<K, V> computeNext() {
            checkForComodification(expectedModCount);
            int t = walk.next();
            if (t == NIL)
                return endOfData();
            return Maps.immutableEntry(keyAt(t), valueAt(t));
        }
    }

    // Debugging

    /**
     * Returns the number of nodes on the longest path from the root to a
     * leaf. This method is used for debugging purposes only.
     */
    public int height() {
        return height(root);
    }

    private int height(int t) {
        return t == NIL ? 0 : 1 + Math.max(height(left[t]), height(right[t]));
    }

    /**
     * Show the tree that implements the map. This method is used for debugging
     * purposes only.
     */
    public String showTree() {
        return showTree((k, v) -> "(" + k + "," + v + ")");
    }

    /**
     * Shows the tree that implements the map. Elements are shown using the
     * {@code showElem} function, followed by the node color. This method is
     * used for debugging purposes only.
     */
    public String showTree(BiFunction<? super K, ? super V, String> showElem) {
        StringBuilder buf = new StringBuilder();
        showTree(buf, root, showElem, "", "");
        return buf.toString();
    }

    private void showTree(StringBuilder buf, int t, BiFunction<? super K, ? super V, String> elem,
                          String lead, String bars) {
        buf.append(lead);
        if (t == NIL) {
            buf.append("@\n");
            return;
        }

        buf.append(elem.apply(keyAt(t), valueAt(t)))
           .append(color[t] == RED ? " R" : " B")
           .append('\n');
        if (left[t] != NIL || right[t] != NIL) {
            showTree(buf, left[t], elem, bars + "+--", bars + "|  ");
            showTree(buf, right[t], elem, bars + "+--", bars + "   ");
        }
    }

    /**
     * Returns the number of slots in the arena, not counting the sentinel.
     */
    int capacity() {
        return keys.length - 1;
    }

    // Assertions

    /**
     * Test if the internal tree structure is valid: keys are ordered, the
     * red-black coloring rules hold, parent links match child links and the
     * size matches the number of nodes. This method is used for debugging
     * purposes only.
     */
    public boolean valid() {
        if (color[NIL] != BLACK)
            return false;
        if (root != NIL && (color[root] != BLACK || parent[root] != NIL))
            return false;
        return ordered() && balanced(root) >= 0 && linked(root) && validsize();
    }

    private boolean ordered() {
        InOrderWalk walk = new InOrderWalk();
        int prev = NIL;
        for (int t; (t = walk.next()) != NIL; prev = t) {
            if (prev != NIL && compare(keyAt(prev), t) >= 0)
                return false;
        }
        return true;
    }

    /**
     * Returns the black height of the subtree, or -1 if a red node has a red
     * child or the black heights of two sibling subtrees differ.
     */
    private int balanced(int t) {
        if (t == NIL)
            return 1;
        if (color[t] == RED && (color[left[t]] == RED || color[right[t]] == RED))
            return -1;
        int lh = balanced(left[t]), rh = balanced(right[t]);
        if (lh < 0 || rh < 0 || lh != rh)
            return -1;
        return lh + (color[t] == BLACK ? 1 : 0);
    }

    private boolean linked(int t) {
        if (t == NIL)
            return true;
        return (left[t] == NIL || parent[left[t]] == t)
            && (right[t] == NIL || parent[right[t]] == t)
            && linked(left[t]) && linked(right[t]);
    }

    private boolean validsize() {
        return count(root) == size;
    }

    private int count(int t) {
        return t == NIL ? 0 : 1 + count(left[t]) + count(right[t]);
    }
}
