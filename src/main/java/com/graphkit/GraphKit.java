package com.graphkit;

import com.graphkit.api.Operation;
import com.graphkit.dsl.OperationBuilder;
import com.graphkit.engine.ExecutionResult;
import com.graphkit.engine.ExecutionSettings;
import com.graphkit.engine.Network;
import com.graphkit.engine.NetworkBuilder;
import com.graphkit.engine.Plan;
import com.graphkit.engine.PlanCompiler;
import com.graphkit.engine.PlanExecutor;
import com.graphkit.engine.PlanExecutors;
import com.graphkit.op.NetworkOperation;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * GraphKit -- dataflow computation graphs over named values.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Operations</b> declare the names they need and the names they
 * provide.</li>
 * <li><b>Composing</b> operations wires them into a {@link Network}: a
 * bipartite graph of operation and data nodes, checked for duplicates and
 * cycles.</li>
 * <li><b>Compiling</b> a network for the available inputs and the wanted
 * outputs yields a {@link Plan}: the minimal set of operations, in a
 * deterministic dependency order.</li>
 * <li><b>Executing</b> a plan against values yields the solution and the
 * values overwritten along the way.</li>
 * </ul>
 *
 * <pre>
 * Operation add = GraphKit.operation("add").needs("a", "b").provides("sum")
 *         .fn2((a, b) -> (Integer) a + (Integer) b);
 * Operation dbl = GraphKit.operation("double").needs("sum").provides("doubled")
 *         .fn1(s -> (Integer) s * 2);
 *
 * Network net = GraphKit.network(add, dbl);
 * Plan plan = GraphKit.compile(net, List.of("a", "b"), List.of("doubled"));
 * ExecutionResult r = GraphKit.execute(plan, Map.of("a", 2, "b", 3));
 * </pre>
 */
public final class GraphKit {

    private GraphKit() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: declare a new operation.
     *
     * @param name Name, unique within the network the operation is composed into.
     * @return A new {@link OperationBuilder}.
     */
    public static OperationBuilder operation(String name) {
        return OperationBuilder.create(name);
    }

    /** Composes operations into a validated network. */
    public static Network network(Operation... operations) {
        return NetworkBuilder.compose(Arrays.asList(operations));
    }

    public static Network network(Collection<? extends Operation> operations) {
        return NetworkBuilder.compose(operations);
    }

    /**
     * Composes operations into a reusable operation with sequential execution.
     */
    public static NetworkOperation compose(String name, Operation... operations) {
        return new NetworkOperation(name, List.of(operations), ExecutionSettings.defaults());
    }

    public static NetworkOperation compose(String name, ExecutionSettings settings, Operation... operations) {
        return new NetworkOperation(name, List.of(operations), settings);
    }

    public static Plan compile(Network network, Collection<String> inputs, Collection<String> outputs) {
        return PlanCompiler.compile(network, inputs, outputs);
    }

    /** Executes the plan on the calling thread. */
    public static ExecutionResult execute(Plan plan, Map<String, ?> values) {
        return execute(plan, values, ExecutionSettings.defaults());
    }

    /** Executes the plan with a short-lived executor configured by the settings. */
    public static ExecutionResult execute(Plan plan, Map<String, ?> values, ExecutionSettings settings) {
        try (PlanExecutor executor = PlanExecutors.create(settings)) {
            return executor.execute(plan, values);
        }
    }
}
