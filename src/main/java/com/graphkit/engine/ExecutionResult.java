package com.graphkit.engine;

/** The outcome of a successful execute() call. */
public record ExecutionResult(Solution solution, Overwrites overwrites) {
}
