package com.graphkit.engine;

import java.util.Map;

/**
 * Runs a compiled {@link Plan} against concrete values.
 *
 * Failure is atomic per call: either the full result is returned or an
 * exception is thrown and no partial solution is exposed.
 */
public interface PlanExecutor extends AutoCloseable {

    /**
     * Executes the plan.
     *
     * @param plan   A plan compiled by {@link PlanCompiler}.
     * @param values Input values; must contain every name in
     *               {@link Plan#requiredInputs()}. Extra values are copied
     *               into the solution unchanged.
     * @return The solution and the overwrites recorded while executing.
     * @throws com.graphkit.exception.MissingInputException       if a required
     *                                                            input is absent.
     * @throws com.graphkit.exception.OperationExecutionException if a step fails.
     */
    ExecutionResult execute(Plan plan, Map<String, ?> values);

    /** Releases owned resources. The default implementation owns none. */
    @Override
    default void close() {
    }
}
