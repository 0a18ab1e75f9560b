package com.graphkit.fn;

/**
 * Positional operation body with 1 input.
 *
 * <p>
 * Used by {@link com.graphkit.dsl.OperationBuilder#fn1(Fn1)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code x -> (Integer) x * 2}</li>
 * <li>{@code String::valueOf}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Applies the function.
     *
     * @param a The first need.
     * @return The single output, or an {@code Object[]}/{@code List} with one
     *         entry per provide.
     */
    Object apply(Object a) throws Exception;
}
