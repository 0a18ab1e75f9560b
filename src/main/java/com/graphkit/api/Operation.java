package com.graphkit.api;

import java.util.List;
import java.util.Map;

/**
 * A named computation over named values.
 *
 * This interface is the fundamental unit of work in a GraphKit network. Every
 * operation -- whether a simple lambda or a whole composed network --
 * implements it.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every operation has a name that is unique within the network it
 * is composed into. The name is used for diagnostics and error reporting.
 *
 * 2. Contract: needs() and provides() declare which named values the operation
 * consumes and produces. The network is wired purely from these names.
 *
 * 3. Computation: invoke() receives exactly the declared needs and must return
 * a value for every declared provide.
 *
 * Implementations must be immutable once created; the same instance may be
 * invoked concurrently by independent executions.
 */
public interface Operation {

    /**
     * Returns the unique name of this operation.
     *
     * @return The operation name.
     */
    String name();

    /**
     * Returns the names of the values this operation consumes, in declaration
     * order. Names are unique within the list.
     *
     * @return Immutable list of input names; empty, never null.
     */
    List<String> needs();

    /**
     * Returns the names of the values this operation produces, in declaration
     * order. Must not be empty for an operation to be composed.
     *
     * @return Immutable list of output names, never null.
     */
    List<String> provides();

    /**
     * Static parameters attached to this operation at declaration time.
     *
     * @return Immutable parameter map; empty by default.
     */
    default Map<String, Object> params() {
        return Map.of();
    }

    /**
     * Runs the computation.
     *
     * Return Value Contract:
     * The returned map must contain a key for every name in provides(). Values
     * may be null. Keys that are not declared in provides() are ignored by the
     * executor.
     *
     * @param inputs One entry per name in needs().
     * @return The produced values keyed by name.
     * @throws Exception Any failure of the computation. The executor wraps it
     *                   with the operation name.
     */
    Map<String, Object> invoke(Map<String, Object> inputs) throws Exception;
}
