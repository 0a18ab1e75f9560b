package com.graphkit.engine;

/**
 * Factory for the executor matching a set of {@link ExecutionSettings}.
 */
public final class PlanExecutors {

    private PlanExecutors() {
    }

    /**
     * Creates an executor for the configured method. The caller owns the result
     * and must close it; closing a sequential executor is a no-op, closing a
     * parallel one shuts its worker pool down.
     */
    public static PlanExecutor create(ExecutionSettings settings) {
        if (settings == null)
            settings = ExecutionSettings.defaults();
        switch (settings.getMethod()) {
            case PARALLEL:
                return new ParallelPlanExecutor(settings);
            case SEQUENTIAL:
            default:
                return new SequentialPlanExecutor(settings.getListener());
        }
    }
}
