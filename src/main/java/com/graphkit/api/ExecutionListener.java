package com.graphkit.api;

/**
 * Observability interface for monitoring plan execution.
 *
 * Implementations can be registered through the execution settings to receive
 * callbacks during an execute() call. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long each operation takes.
 * - Debugging: Tracing which steps ran, and in what order.
 * - Metrics: Counting executions or failures per operation.
 *
 * Threading:
 * Callbacks are always issued on the thread that called execute(), also when
 * steps run on a worker pool. A listener shared by concurrent executions must
 * be thread-safe.
 */
public interface ExecutionListener {

    /**
     * Called immediately before the first step runs.
     *
     * @param executionId Process-wide increasing id of this execute() call.
     * @param stepCount   Number of steps in the plan.
     */
    void onExecutionStart(long executionId, int stepCount);

    /**
     * Called after a step's outputs have been merged into the solution.
     *
     * @param executionId   Id of the execute() call.
     * @param stepIndex     Position of the step in the plan.
     * @param operationName Name of the operation.
     * @param durationNanos Time spent inside the operation body.
     */
    void onStepCompleted(long executionId, int stepIndex, String operationName, long durationNanos);

    /**
     * Called when a step fails.
     *
     * @param executionId   Id of the execute() call.
     * @param stepIndex     Position of the step in the plan.
     * @param operationName Name of the failing operation.
     * @param error         The failure, unwrapped from the operation body.
     */
    void onStepError(long executionId, int stepIndex, String operationName, Throwable error);

    /**
     * Called when the execute() call finishes, successfully or not.
     *
     * @param executionId    Id of the execute() call.
     * @param stepsCompleted Number of steps whose outputs were merged.
     */
    void onExecutionEnd(long executionId, int stepsCompleted);
}
