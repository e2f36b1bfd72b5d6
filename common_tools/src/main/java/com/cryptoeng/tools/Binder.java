/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.tools;

import java.util.HashMap;
import java.util.Map;

/**
 * String-keyed map with typed getters, used to carry parsed configuration. Nested maps are
 * returned as binders too.
 */
public class Binder extends HashMap<String, Object> {

    /**
     * Convert "key, value" pairs from varargs into a Binder.
     *
     * @param args key, value pairs. Can be 0 length or any even length.
     *
     * @return filled Binder instance
     */
    static public Binder fromKeysValues(Object... args) {
        if ((args.length & 1) == 1)
            throw new IllegalArgumentException("keyValuePairs should be even sized array");
        Binder map = new Binder();
        for (int i = 0; i < args.length; i += 2)
            map.put(args[i].toString(), args[i + 1]);
        return map;
    }

    public Binder(Map<String, ?> copyFrom) {
        super.putAll(copyFrom);
    }

    public Binder() {
    }

    /**
     * Convert some map to the binder. Do nothing if it is already a binder.
     *
     * @param x source map, null gives an empty binder
     */
    @SuppressWarnings("unchecked")
    static public Binder from(Object x) {
        if (x == null)
            return new Binder();
        if (x instanceof Binder)
            return (Binder) x;
        if (x instanceof Map)
            return new Binder((Map<String, ?>) x);
        throw new IllegalArgumentException("can't convert to binder: " + x.getClass().getCanonicalName());
    }

    /**
     * Return Binder for the key, or empty binder if it does not exist.
     */
    public Binder getBinder(String key) {
        return from(get(key));
    }

    public Integer getInt(String key, Integer defaultValue) {
        Object o = get(key);
        if (o == null)
            return defaultValue;
        if (o instanceof String) {
            return Integer.valueOf(((String) o).trim());
        } else if (o instanceof Number) {
            return ((Number) o).intValue();
        }
        throw new IllegalArgumentException("can't convert to integer: " + o.getClass().getCanonicalName());
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object o = get(key);
        if (o == null)
            return defaultValue;
        if (o instanceof Boolean)
            return (Boolean) o;
        if (o instanceof String)
            return Boolean.valueOf(((String) o).trim());
        throw new IllegalArgumentException("can't convert to boolean: " + o.getClass().getCanonicalName());
    }
}
