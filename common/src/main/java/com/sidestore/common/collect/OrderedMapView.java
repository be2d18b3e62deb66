/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import com.google.common.collect.Iterators;

/**
 * A {@link Map} view of an {@link OrderedMap}. All operations read and write
 * through to the backing map, and the collection views iterate in the
 * backing map's order.
 */
class OrderedMapView<K, V> extends AbstractMap<K, V> {
    private final OrderedMap<K, V> backing;

    OrderedMapView(OrderedMap<K, V> backing) {
        this.backing = Objects.requireNonNull(backing);
    }

    @Override
    public boolean isEmpty() {
        return backing.isEmpty();
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean containsKey(Object key) {
        return key != null && backing.containsKey((K)key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean containsValue(Object value) {
        return value != null && backing.containsValue((V)value);
    }

    @Override
    @SuppressWarnings("unchecked")
    public V get(Object key) {
        return key == null ? null : backing.get((K)key);
    }

    @Override
    public V put(K key, V value) {
        return backing.put(key, value);
    }

    @Override
    @SuppressWarnings("unchecked")
    public V remove(Object key) {
        return key == null ? null : backing.remove((K)key);
    }

    @Override
    public void clear() {
        backing.clear();
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super V> action) {
        backing.forEach(action);
    }

    /**
     * Removes every mapping that satisfies the given predicate. The mappings
     * are taken from a snapshot so the backing map may change underneath.
     */
    boolean removeEntriesIf(Predicate<? super Map.Entry<K,V>> filter) {
        Objects.requireNonNull(filter);
        boolean modified = false;
        for (Map.Entry<K, V> e : backing.entries()) {
            if (filter.test(e)) {
                backing.remove(e.getKey());
                modified = true;
            }
        }
        return modified;
    }

    // Views

    private KeySet keySet;
    private Values values;
    private EntrySet entrySet;

    @Override
    public Set<K> keySet() {
        KeySet ks = keySet;
        return (ks != null) ? ks : (keySet = new KeySet());
    }

    @Override
    public Collection<V> values() {
        Values vs = values;
        return (vs != null) ? vs : (values = new Values());
    }

    @Override
    public Set<Map.Entry<K,V>> entrySet() {
        EntrySet es = entrySet;
        return (es != null) ? es : (entrySet = new EntrySet());
    }

    class KeySet extends AbstractSet<K> {
        @Override
        public Iterator<K> iterator() {
            return Iterators.transform(backing.iterator(), Map.Entry::getKey);
        }

        @Override
        public boolean isEmpty() {
            return backing.isEmpty();
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public boolean contains(Object o) {
            return OrderedMapView.this.containsKey(o);
        }

        @Override
        public boolean remove(Object o) {
            return OrderedMapView.this.remove(o) != null;
        }

        @Override
        public boolean removeIf(Predicate<? super K> filter) {
            Objects.requireNonNull(filter);
            return removeEntriesIf(e -> filter.test(e.getKey()));
        }

        @Override
        public boolean removeAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> c.contains(e.getKey()));
        }

        @Override
        public boolean retainAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> !c.contains(e.getKey()));
        }

        @Override
        public void clear() {
            backing.clear();
        }
    }

    class Values extends AbstractCollection<V> {
        @Override
        public Iterator<V> iterator() {
            return Iterators.transform(backing.iterator(), Map.Entry::getValue);
        }

        @Override
        public boolean isEmpty() {
            return backing.isEmpty();
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public boolean contains(Object o) {
            return OrderedMapView.this.containsValue(o);
        }

        @Override
        public boolean remove(Object o) {
            for (Map.Entry<K, V> e : backing.entries()) {
                if (e.getValue().equals(o)) {
                    backing.remove(e.getKey());
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean removeIf(Predicate<? super V> filter) {
            Objects.requireNonNull(filter);
            return removeEntriesIf(e -> filter.test(e.getValue()));
        }

        @Override
        public boolean removeAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> c.contains(e.getValue()));
        }

        @Override
        public boolean retainAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> !c.contains(e.getValue()));
        }

        @Override
        public void clear() {
            backing.clear();
        }
    }

    class EntrySet extends AbstractSet<Map.Entry<K,V>> {
        @Override
        public Iterator<Map.Entry<K,V>> iterator() {
            return backing.iterator();
        }

        @Override
        public boolean isEmpty() {
            return backing.isEmpty();
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Map.Entry))
                return false;
            Map.Entry<?,?> entry = (Map.Entry<?,?>)o;
            Object value = OrderedMapView.this.get(entry.getKey());
            return value != null && value.equals(entry.getValue());
        }

        @Override
        public boolean remove(Object o) {
            if (contains(o)) {
                OrderedMapView.this.remove(((Map.Entry<?,?>)o).getKey());
                return true;
            }
            return false;
        }

        @Override
        public boolean removeIf(Predicate<? super Map.Entry<K,V>> filter) {
            Objects.requireNonNull(filter);
            return removeEntriesIf(e -> filter.test(e));
        }

        @Override
        public boolean removeAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> c.contains(e));
        }

        @Override
        public boolean retainAll(Collection<?> c) {
            Objects.requireNonNull(c);
            return removeEntriesIf(e -> !c.contains(e));
        }

        @Override
        public void clear() {
            backing.clear();
        }
    }
}
