/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * <p>A mutable map from keys to values that iterates its mappings in a
 * defined order. The order is a property of the implementation: the
 * {@link InsertionOrderMap} iterates keys in the order they were first
 * inserted, the {@link SortedTreeMap} iterates keys in ascending order.</p>
 *
 * <p>Neither keys nor values may be {@code null}, so a {@code null} result
 * from {@link #get}, {@link #put} or {@link #remove} always means that
 * no mapping was present.</p>
 *
 * <p>Implementations are not synchronized. If a map is shared between
 * threads, access to it must be synchronized externally.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface OrderedMap<K, V> extends Iterable<Map.Entry<K, V>> {
    // Query Operations

    /**
     * Returns {@code true} if this map contains no key-value mappings.
     *
     * @return {@code true} if this map contains no key-value mappings
     */
    boolean isEmpty();

    /**
     * Returns the number of key-value mappings in this map.
     *
     * @return the number of key-value mappings in this map
     */
    int size();

    /**
     * Returns {@code true} if this map contains a mapping for the specified
     * key.
     *
     * @param key key whose presence in this map is to be tested
     * @return {@code true} if this map contains a mapping for the specified key
     */
    boolean containsKey(K key);

    /**
     * Returns {@code true} if this map maps one or more keys to the specified
     * value. This operation requires a linear scan of the map.
     *
     * @param value value whose presence in this map is to be tested
     */
    boolean containsValue(V value);

    /**
     * Returns the value to which the specified key is mapped, or {@code null}
     * if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     */
    V get(K key);

    /**
     * Lookup the value to which the specified key is mapped.  Returns
     * {@code Optional.empty()} if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @return the value to which the specified key is mapped, or
     *         {@code Optional.empty()} if this map contains no mapping
     *         for the key
     */
    default Optional<V> lookup(K key) {
        return Optional.ofNullable(get(key));
    }

    /**
     * Returns the value to which the specified key is mapped, or the given
     * fallback if this map contains no mapping for the key. The map is not
     * modified.
     *
     * @param key the key whose associated value is to be returned
     * @param fallback the value returned when the key is absent
     */
    default V getOrDefault(K key, V fallback) {
        V value = get(key);
        return value != null ? value : fallback;
    }

    // Modification Operations

    /**
     * Associates the specified value with the specified key. If the map
     * previously contained a mapping for the key, the old value is replaced
     * in place and the key keeps its position in the iteration order.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the previous value associated with the key, or {@code null}
     *         if there was no mapping for the key
     * @throws NullPointerException if the key or value is null
     */
    V put(K key, V value);

    /**
     * Removes the mapping for a key from this map if it is present.
     *
     * @param key key whose mapping is to be removed from the map
     * @return the previous value associated with the key, or {@code null}
     *         if there was no mapping for the key
     */
    V remove(K key);

    /**
     * Removes all of the mappings from this map.
     */
    void clear();

    /**
     * Returns the value to which the specified key is mapped. If the key
     * is absent, the fallback is first inserted for it and then returned.
     *
     * @param key key with which the value is to be associated
     * @param fallback the value to insert when the key is absent
     * @return the current (existing or inserted) value for the key
     */
    default V getOrPut(K key, V fallback) {
        V value = get(key);
        if (value == null) {
            put(key, fallback);
            value = fallback;
        }
        return value;
    }

    /**
     * If the specified key is not already associated with a value, compute
     * its value using the given mapping function and enter it into this map.
     * If the function returns {@code null} no mapping is recorded.
     *
     * @param key key with which the specified value is to be associated
     * @param mappingFunction the function to compute a value
     * @return the current (existing or computed) value associated with the
     *         specified key, or {@code null} if the computed value is null
     */
    default V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(mappingFunction);
        V value = get(key);
        if (value == null) {
            value = mappingFunction.apply(key);
            if (value != null) {
                put(key, value);
            }
        }
        return value;
    }

    // Bulk Operations

    /**
     * Copies all of the mappings from the specified map to this map. New keys
     * are added in the iteration order of the given map.
     */
    default void putAll(Map<? extends K, ? extends V> m) {
        m.forEach(this::put);
    }

    /**
     * Copies all of the given key-value pairs to this map, in order.
     */
    default void putAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            put(e.getKey(), e.getValue());
        }
    }

    /**
     * Perform the given action for each entry in this map, in iteration order,
     * until all entries have been processed or the action throws an exception.
     *
     * @param action an action to perform on each elements
     */
    default void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action);
        for (Map.Entry<K, V> e : this) {
            action.accept(e.getKey(), e.getValue());
        }
    }

    // Views

    /**
     * Returns a snapshot list of the keys contained in this map, in
     * iteration order.
     */
    ImmutableList<K> keys();

    /**
     * Returns a snapshot list of the values contained in this map, in the
     * iteration order of their keys.
     */
    ImmutableList<V> values();

    /**
     * Returns a snapshot list of the mappings contained in this map, in
     * iteration order.
     */
    default ImmutableList<Map.Entry<K, V>> entries() {
        return ImmutableList.copyOf(iterator());
    }

    /**
     * Returns an iterator over the mappings of this map in iteration order.
     * Every call starts a new pass from the first mapping. The iterator is
     * fail-fast: it throws {@link java.util.ConcurrentModificationException}
     * when this map is structurally modified after the iterator was created.
     */
    @Override
    Iterator<Map.Entry<K, V>> iterator();

    /**
     * Returns a {@link Map} view of this map. The view reads and writes
     * through to this map and iterates in the same order.
     */
    Map<K, V> asMap();
}
