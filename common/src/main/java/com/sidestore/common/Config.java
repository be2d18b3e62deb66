/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.sidestore.common;

import java.util.Optional;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tuning properties for the container library. A property is looked up
 * as a JVM system property first, then as an environment variable, and
 * falls back to a built-in default.
 */
public final class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    private Config() {}

    public static final String CAPACITY_KEY = "SIDESTORE_COLLECT_CAPACITY";
    public static final int DEFAULT_CAPACITY = 16;

    /**
     * The largest arena capacity a container will preallocate.
     */
    public static final int MAX_CAPACITY = 1 << 30;

    /**
     * The initial arena capacity used by containers constructed without
     * an explicit size.
     */
    public static final IntSupplier INITIAL_CAPACITY = intProperty(CAPACITY_KEY, DEFAULT_CAPACITY, MAX_CAPACITY);

    public static Optional<String> get(String key) {
        String value = System.getProperty(key);
        if (value == null)
            value = System.getenv(key);
        return Optional.ofNullable(value).map(String::trim).filter(s -> !s.isEmpty());
    }

    public static int getInt(String key, int deflt) {
        return getInt(key, deflt, Integer.MAX_VALUE);
    }

    /**
     * Returns the integer value of a property, or {@code deflt} if the
     * property is missing, unparsable, negative or greater than {@code max}.
     */
    public static int getInt(String key, int deflt, int max) {
        Optional<String> value = get(key);
        if (value.isPresent()) {
            try {
                int n = Integer.parseInt(value.get());
                if (n >= 0 && n <= max)
                    return n;
            } catch (NumberFormatException ex) {
                // fall through to the warning below
            }
            logger.log(Level.WARNING, "Ignoring invalid value \"" + value.get() + "\" for " + key
                                      + ", using " + deflt);
        }
        return deflt;
    }

    public static IntSupplier intProperty(String key, int deflt) {
        return () -> getInt(key, deflt);
    }

    public static IntSupplier intProperty(String key, int deflt, int max) {
        return () -> getInt(key, deflt, max);
    }
}
