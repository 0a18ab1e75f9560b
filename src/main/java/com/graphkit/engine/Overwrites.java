package com.graphkit.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Values displaced during one execute() call.
 *
 * Whenever a step writes a name already present in the solution, the previous
 * value is appended to that name's history. Histories are ordered oldest
 * first; the final value lives in the {@link Solution}.
 */
public final class Overwrites {
    private final Map<String, List<Object>> history;

    Overwrites(Map<String, List<Object>> history) {
        Map<String, List<Object>> copy = new LinkedHashMap<>(history.size() * 2);
        history.forEach((k, v) -> copy.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        this.history = Collections.unmodifiableMap(copy);
    }

    /** The displaced values of a name, oldest first; empty if never overwritten. */
    public List<Object> get(String name) {
        List<Object> h = history.get(name);
        return h != null ? h : List.of();
    }

    public Set<String> names() {
        return history.keySet();
    }

    public boolean isEmpty() {
        return history.isEmpty();
    }

    public Map<String, List<Object>> asMap() {
        return history;
    }

    @Override
    public String toString() {
        return "Overwrites" + history;
    }
}
