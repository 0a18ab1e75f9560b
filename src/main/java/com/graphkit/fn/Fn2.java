package com.graphkit.fn;

/**
 * Positional operation body with 2 inputs.
 *
 * <p>
 * Used by {@link com.graphkit.dsl.OperationBuilder#fn2(Fn2)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (a, b) -> (Integer) a + (Integer) b}</li>
 * <li>{@code (a, b) -> new Object[] { a, b }}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2 {
    /**
     * Applies the function.
     *
     * @param a First need.
     * @param b Second need.
     * @return The output(s).
     */
    Object apply(Object a, Object b) throws Exception;
}
