package com.graphkit.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call accumulating store. Not thread-safe: exactly one thread mutates it
 * during an execution.
 */
final class ValueStore {
    private final Map<String, Object> values;
    private final Map<String, List<Object>> overwrites = new LinkedHashMap<>();

    ValueStore(Map<String, ?> seed) {
        this.values = new LinkedHashMap<>(seed);
    }

    boolean contains(String name) {
        return values.containsKey(name);
    }

    Object get(String name) {
        return values.get(name);
    }

    /** Writes a value, recording the displaced one if the name was present. */
    void put(String name, Object value) {
        if (values.containsKey(name))
            overwrites.computeIfAbsent(name, k -> new ArrayList<>()).add(values.get(name));
        values.put(name, value);
    }

    void putAll(Map<String, Object> produced) {
        for (Map.Entry<String, Object> e : produced.entrySet())
            put(e.getKey(), e.getValue());
    }

    ExecutionResult toResult() {
        return new ExecutionResult(new Solution(values), new Overwrites(overwrites));
    }
}
