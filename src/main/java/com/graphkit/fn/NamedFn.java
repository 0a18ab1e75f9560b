package com.graphkit.fn;

import java.util.Map;

/**
 * Operation body working on named values.
 *
 * Receives the needs keyed by name and returns the provides keyed by name.
 * Use it when an operation has many inputs or when outputs are easier to build
 * as a map.
 */
@FunctionalInterface
public interface NamedFn {
    Map<String, Object> apply(Map<String, Object> inputs) throws Exception;
}
