/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.ConcurrentModificationException;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Skeletal implementation of the {@link OrderedMap} interface. Provides
 * {@code java.util.Map} compatible equality, the {@code Map} view and
 * structural modification tracking for fail-fast iterators.
 */
abstract class AbstractOrderedMap<K, V> implements OrderedMap<K, V> {
    /**
     * The number of times this map has been structurally modified.
     */
    int modCount;

    private OrderedMapView<K, V> mapView;

    @Override
    public Map<K, V> asMap() {
        OrderedMapView<K, V> mv = mapView;
        return (mv != null) ? mv : (mapView = new OrderedMapView<>(this));
    }

    final void checkForComodification(int expectedModCount) {
        if (modCount != expectedModCount)
            throw new ConcurrentModificationException();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof OrderedMap))
            return false;

        @SuppressWarnings("unchecked")
        OrderedMap<Object, Object> other = (OrderedMap<Object, Object>)obj;
        if (other.size() != size())
            return false;

        try {
            for (Map.Entry<K, V> e : this) {
                if (!Objects.equals(e.getValue(), other.get(e.getKey())))
                    return false;
            }
        } catch (ClassCastException ex) {
            return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<K, V> e : this)
            h += e.hashCode();
        return h;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (Map.Entry<K, V> e : this)
            sj.add(e.getKey() + "=" + e.getValue());
        return sj.toString();
    }
}
