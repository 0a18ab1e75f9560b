package com.graphkit.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The values accumulated by one execute() call: the caller's inputs plus every
 * value produced by the plan's steps, with later writes replacing earlier ones.
 *
 * Values may be null; use {@link #contains(String)} to test presence.
 */
public final class Solution {
    private final Map<String, Object> values;

    Solution(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Object get(String name) {
        return values.get(name);
    }

    /** Typed accessor; throws ClassCastException on a type mismatch. */
    public <T> T get(String name, Class<T> type) {
        Object v = values.get(name);
        if (v != null && !type.isInstance(v))
            throw new ClassCastException("Value '" + name + "' is " + v.getClass().getName()
                    + ", expected " + type.getName());
        return type.cast(v);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** All values, in insertion order. */
    public Map<String, Object> values() {
        return values;
    }

    /** The subset of values with the given names; absent names are skipped. */
    public Map<String, Object> select(Collection<String> names) {
        Map<String, Object> out = new LinkedHashMap<>(names.size() * 2);
        for (String n : names)
            if (values.containsKey(n))
                out.put(n, values.get(n));
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Solution" + values;
    }
}
