package com.graphkit.exception;

import java.util.List;

/**
 * The operations form a dependency cycle.
 *
 * The cycle path alternates operation and data names and ends with the name it
 * started with, e.g. {@code [opA, y, opB, x, opA]}.
 */
public class CyclicGraphException extends GraphKitException {
    private final List<String> cycle;
    private final List<String> operationNames;

    public CyclicGraphException(List<String> cycle, List<String> operationNames) {
        super("Cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
        this.operationNames = List.copyOf(operationNames);
    }

    /** The full cycle as an ordered sequence of operation and data names. */
    public List<String> cycle() {
        return cycle;
    }

    /** The operations on the cycle, in cycle order, each listed once. */
    public List<String> operationNames() {
        return operationNames;
    }
}
