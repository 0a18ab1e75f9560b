package com.graphkit.engine;

/** How the steps of a plan are scheduled. */
public enum ExecutionMethod {
    /** One step after the other, on the calling thread. */
    SEQUENTIAL,
    /** Independent steps concurrently on a bounded worker pool. */
    PARALLEL
}
