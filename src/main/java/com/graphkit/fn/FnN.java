package com.graphkit.fn;

/**
 * Positional operation body with any number of inputs.
 *
 * The argument array is freshly allocated per invocation, in the order of the
 * operation's needs. Implementations may keep it.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Computes the outputs from the needs.
     *
     * @param args One entry per need.
     * @return The output(s).
     */
    Object apply(Object[] args) throws Exception;
}
