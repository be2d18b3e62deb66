/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common;

import java.util.Optional;

import org.junit.After;
import org.junit.Test;
import static org.junit.Assert.*;

import com.sidestore.common.collect.InsertionOrderMap;
import com.sidestore.common.collect.SortedTreeMap;

public class ConfigTest {
    private static final String KEY = "sidestore.test.capacity";

    @After
    public void cleanup() {
        System.clearProperty(KEY);
        System.clearProperty(Config.CAPACITY_KEY);
    }

    @Test
    public void test_default_value() {
        assertEquals(Optional.empty(), Config.get(KEY));
        assertEquals(7, Config.getInt(KEY, 7));
    }

    @Test
    public void test_system_property() {
        System.setProperty(KEY, " 32 ");
        assertEquals(Optional.of("32"), Config.get(KEY));
        assertEquals(32, Config.getInt(KEY, 7));
        assertEquals(32, Config.intProperty(KEY, 7).getAsInt());
    }

    @Test
    public void test_invalid_value_falls_back() {
        System.setProperty(KEY, "many");
        assertEquals(7, Config.getInt(KEY, 7));
        System.setProperty(KEY, "-3");
        assertEquals(7, Config.getInt(KEY, 7));
    }

    @Test
    public void test_oversized_capacity_falls_back() {
        System.setProperty(Config.CAPACITY_KEY, String.valueOf(Integer.MAX_VALUE));
        assertEquals(Config.DEFAULT_CAPACITY, Config.INITIAL_CAPACITY.getAsInt());
        assertEquals(Integer.MAX_VALUE, Config.getInt(Config.CAPACITY_KEY, 7));
        assertEquals(7, Config.getInt(Config.CAPACITY_KEY, 7, 100));

        SortedTreeMap<String, Integer> t = SortedTreeMap.create();
        t.put("x", 1);
        assertTrue(t.valid());
        InsertionOrderMap<String, Integer> m = new InsertionOrderMap<>();
        m.put("x", 1);
        assertTrue(m.valid());
    }

    @Test
    public void test_configured_capacity() {
        System.setProperty(Config.CAPACITY_KEY, "2");
        assertEquals(2, Config.INITIAL_CAPACITY.getAsInt());

        InsertionOrderMap<Integer, Integer> m = new InsertionOrderMap<>();
        for (int i = 0; i < 100; i++) {
            m.put(i, i);
        }
        assertEquals(100, m.size());
        assertTrue(m.valid());
    }
}
