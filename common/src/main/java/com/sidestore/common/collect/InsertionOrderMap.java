/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import com.sidestore.common.Config;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A hash map that iterates its mappings in the order in which their keys
 * were first inserted. Replacing the value of an existing key does not change
 * its position; removing a key and putting it again moves it to the end.</p>
 *
 * <p>Entries are kept in an arena of parallel arrays and are referred to by
 * their slot number (a handle). The insertion order is a doubly linked list
 * threaded through the {@code next} and {@code prev} handle arrays, and a
 * hash index maps each key to its handle. The slots of removed entries are
 * chained on a free list and reused by later insertions.</p>
 *
 * <p>{@link #get}, {@link #put}, {@link #remove} and {@link #containsKey}
 * run in constant average time. {@link #containsValue} scans the list.</p>
 *
 * <p>This class is not synchronized.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class InsertionOrderMap<K, V> extends AbstractOrderedMap<K, V> {
    private static final Logger logger = Logger.getLogger(InsertionOrderMap.class.getName());

    private static final int NIL = -1;
    private static final int MIN_CAPACITY = 4;

    private Map<K, Integer> index;
    private Object[] keys;
    private Object[] vals;
    private int[] next;
    private int[] prev;

    private int head = NIL, tail = NIL;

    // free slots are chained through next[]
    private int free = NIL;

    // slots at or above the limit have never been used
    private int limit;

    /**
     * Construct an empty map with the configured default capacity.
     */
    public InsertionOrderMap() {
        this(Config.INITIAL_CAPACITY.getAsInt());
    }

    /**
     * Construct an empty map that can hold the given number of mappings
     * without growing.
     *
     * @param expectedSize the number of mappings expected
     * @throws IllegalArgumentException if {@code expectedSize} is negative
     */
    public InsertionOrderMap(int expectedSize) {
        checkArgument(expectedSize >= 0, "expectedSize cannot be negative but was: %s", expectedSize);
        reset(capacityFor(expectedSize));
    }

    /**
     * Construct an empty map with the configured default capacity.
     */
    public static <K, V> InsertionOrderMap<K, V> create() {
        return new InsertionOrderMap<>();
    }

    /**
     * Construct a map holding the mappings of the given map, in the given
     * map's iteration order.
     */
    public static <K, V> InsertionOrderMap<K, V> copyOf(Map<? extends K, ? extends V> m) {
        InsertionOrderMap<K, V> result = new InsertionOrderMap<>(m.size());
        result.putAll(m);
        return result;
    }

    /**
     * Construct a map from a sequence of key-value pairs. Keys are ordered
     * by their first occurrence and later pairs overwrite earlier values.
     */
    public static <K, V> InsertionOrderMap<K, V> copyOf(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        InsertionOrderMap<K, V> result = new InsertionOrderMap<>();
        result.putAll(entries);
        return result;
    }

    private static int capacityFor(int expectedSize) {
        return Math.min(Math.max(expectedSize, MIN_CAPACITY), Config.MAX_CAPACITY);
    }

    private void reset(int capacity) {
        index = Maps.newHashMapWithExpectedSize(capacity);
        keys = new Object[capacity];
        vals = new Object[capacity];
        next = new int[capacity];
        prev = new int[capacity];
        head = tail = free = NIL;
        limit = 0;
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int slot) {
        return (K)keys[slot];
    }

    @SuppressWarnings("unchecked")
    private V valueAt(int slot) {
        return (V)vals[slot];
    }

    // Query Operations

    @Override
    public boolean isEmpty() {
        return index.isEmpty();
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    @Override
    public boolean containsValue(V value) {
        if (value == null)
            return false;
        for (int e = head; e != NIL; e = next[e]) {
            if (value.equals(vals[e]))
                return true;
        }
        return false;
    }

    @Override
    public V get(K key) {
        Integer e = index.get(key);
        return e == null ? null : valueAt(e);
    }

    /**
     * Returns the first inserted key still present in this map.
     */
    public Optional<K> firstKey() {
        return head == NIL ? Optional.empty() : Optional.of(keyAt(head));
    }

    /**
     * Returns the most recently inserted key still present in this map.
     */
    public Optional<K> lastKey() {
        return tail == NIL ? Optional.empty() : Optional.of(keyAt(tail));
    }

    // Modification Operations

    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        Integer e = index.get(key);
        if (e != null) {
            V oldValue = valueAt(e);
            vals[e] = value;
            return oldValue;
        }

        int slot = allocate();
        keys[slot] = key;
        vals[slot] = value;
        linkLast(slot);
        index.put(key, slot);
        modCount++;
        return null;
    }

    @Override
    public V remove(K key) {
        Integer e = index.remove(key);
        if (e == null)
            return null;

        V oldValue = valueAt(e);
        unlink(e);
        release(e);
        modCount++;
        return oldValue;
    }

    /**
     * Removes all of the mappings from this map. The arena is discarded
     * as a whole and replaced by a fresh one of the configured default
     * capacity, whatever size the map was created with.
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
            free = next[slot];
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
        prev[slot] = NIL;
        next[slot] = free;
        free = slot;
    }

    private void grow() {
        int oldCapacity = keys.length;
        int newCapacity = oldCapacity + (oldCapacity >> 1) + 1;
        logger.fine("growing insertion order arena from " + oldCapacity + " to " + newCapacity + " slots");
        keys = Arrays.copyOf(keys, newCapacity);
        vals = Arrays.copyOf(vals, newCapacity);
        next = Arrays.copyOf(next, newCapacity);
        prev = Arrays.copyOf(prev, newCapacity);
    }

    // Order list

    private void linkLast(int e) {
        prev[e] = tail;
        next[e] = NIL;
        if (tail == NIL) {
            head = e;
        } else {
            next[tail] = e;
        }
        tail = e;
    }

    private void unlink(int e) {
        int p = prev[e], n = next[e];
        if (p == NIL) {
            head = n;
        } else {
            next[p] = n;
        }
        if (n == NIL) {
            tail = p;
        } else {
            prev[n] = p;
        }
    }

    // Views

    @Override
    public ImmutableList<K> keys() {
        ImmutableList.Builder<K> builder = ImmutableList.builderWithExpectedSize(size());
        for (int e = head; e != NIL; e = next[e])
            builder.add(keyAt(e));
        return builder.build();
    }

    @Override
    public ImmutableList<V> values() {
        ImmutableList.Builder<V> builder = ImmutableList.builderWithExpectedSize(size());
        for (int e = head; e != NIL; e = next[e])
            builder.add(valueAt(e));
        return builder.build();
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return new EntryIterator();
    }

    private class EntryIterator extends AbstractIterator<Map.Entry<K, V>> {
        private final int expectedModCount = modCount;
        private int cursor = head;

        @Override
        protected Map.Entry<K, V> computeNext() {
            checkForComodification(expectedModCount);
            if (cursor == NIL)
                return endOfData();
            int e = cursor;
            cursor = next[e];
            return Maps.immutableEntry(keyAt(e), valueAt(e));
        }
    }

    /**
     * Returns the number of slots in the arena.
     */
    int capacity() {
        return keys.length;
    }

    // Assertions

    /**
     * Test if the internal list and index structure is valid. This method
     * is used for debugging purposes only.
     */
    public boolean valid() {
        int count = 0, last = NIL;
        for (int e = head; e != NIL; e = next[e]) {
            if (prev[e] != last || count >= limit)
                return false;
            Integer indexed = index.get(keyAt(e));
            if (indexed == null || indexed != e)
                return false;
            last = e;
            count++;
        }
        return last == tail && count == index.size();
    }
}
