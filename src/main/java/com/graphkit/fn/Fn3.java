package com.graphkit.fn;

/**
 * Positional operation body with 3 inputs.
 */
@FunctionalInterface
public interface Fn3 {
    Object apply(Object a, Object b, Object c) throws Exception;
}
