/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common.collect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.junit.Test;
import static org.junit.Assert.*;

public class OrderedMapViewTest {
    private static InsertionOrderMap<String, Integer> sample() {
        InsertionOrderMap<String, Integer> m = new InsertionOrderMap<>();
        m.put("c", 3);
        m.put("a", 1);
        m.put("b", 2);
        return m;
    }

    @Test
    public void test_view_iterates_in_map_order() {
        InsertionOrderMap<String, Integer> m = sample();
        Map<String, Integer> view = m.asMap();
        assertEquals(Arrays.asList("c", "a", "b"), new ArrayList<>(view.keySet()));
        assertEquals(Arrays.asList(3, 1, 2), new ArrayList<>(view.values()));
        assertEquals("{c=3, a=1, b=2}", view.toString());

        SortedTreeMap<String, Integer> t = SortedTreeMap.copyOf(view);
        assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(t.asMap().keySet()));
    }

    @Test
    public void test_view_writes_through() {
        InsertionOrderMap<String, Integer> m = sample();
        Map<String, Integer> view = m.asMap();

        assertNull(view.put("d", 4));
        assertEquals(Integer.valueOf(4), m.get("d"));
        assertEquals(Integer.valueOf(1), view.remove("a"));
        assertFalse(m.containsKey("a"));
        assertNull(view.remove(42));

        assertTrue(view.keySet().remove("b"));
        assertTrue(view.values().remove(3));
        assertEquals(ImmutableList.of("d"), m.keys());

        assertTrue(view.entrySet().remove(Maps.immutableEntry("d", 4)));
        assertTrue(m.isEmpty());
        assertTrue(view.isEmpty());
    }

    @Test
    public void test_view_queries() {
        SortedTreeMap<String, Integer> t = SortedTreeMap.create();
        t.putAll(ImmutableMap.of("x", 1, "y", 2));
        Map<String, Integer> view = t.asMap();

        assertEquals(2, view.size());
        assertTrue(view.containsKey("x"));
        assertFalse(view.containsKey(null));
        assertTrue(view.containsValue(2));
        assertNull(view.get(null));
        assertTrue(view.entrySet().contains(Maps.immutableEntry("y", 2)));
        assertFalse(view.entrySet().contains(Maps.immutableEntry("y", 3)));
        assertEquals(ImmutableMap.of("x", 1, "y", 2), view);
        assertSame(view, t.asMap());

        view.clear();
        assertTrue(t.isEmpty());
    }

    @Test
    public void test_view_bulk_removal() {
        InsertionOrderMap<String, Integer> m = sample();
        assertTrue(m.asMap().keySet().retainAll(ImmutableSet.of("a", "b")));
        assertEquals(ImmutableList.of("a", "b"), m.keys());
        assertFalse(m.asMap().keySet().retainAll(ImmutableSet.of("a", "b", "z")));

        m = sample();
        assertTrue(m.asMap().entrySet().removeIf(e -> e.getValue() > 1));
        assertEquals(ImmutableList.of("a"), m.keys());
        assertFalse(m.asMap().entrySet().removeIf(e -> e.getValue() > 1));

        m = sample();
        assertTrue(m.asMap().keySet().removeAll(Arrays.asList("a", "b", "c", "d")));
        assertTrue(m.isEmpty());
        assertTrue(m.valid());
    }

    @Test
    public void test_values_bulk_removal() {
        SortedTreeMap<String, Integer> t = SortedTreeMap.copyOf(sample().asMap());
        assertTrue(t.asMap().values().removeAll(ImmutableSet.of(1, 3)));
        assertEquals(ImmutableList.of("b"), t.keys());
        assertTrue(t.valid());

        t = SortedTreeMap.copyOf(sample().asMap());
        assertTrue(t.asMap().values().retainAll(ImmutableSet.of(3)));
        assertEquals(ImmutableList.of("c"), t.keys());

        t = SortedTreeMap.copyOf(sample().asMap());
        assertTrue(t.asMap().values().removeIf(v -> v % 2 == 1));
        assertEquals(ImmutableMap.of("b", 2), t.asMap());
        assertTrue(t.valid());
    }

    @Test
    public void test_entry_set_bulk_removal() {
        InsertionOrderMap<String, Integer> m = sample();
        Set<Map.Entry<String, Integer>> entries = m.asMap().entrySet();
        assertTrue(entries.removeAll(ImmutableList.of(Maps.immutableEntry("c", 3), Maps.immutableEntry("a", 9))));
        assertEquals(ImmutableList.of("a", "b"), m.keys());

        assertTrue(entries.retainAll(ImmutableSet.of(Maps.immutableEntry("b", 2))));
        assertEquals(ImmutableMap.of("b", 2), m.asMap());
        assertTrue(m.valid());
    }
}
