package com.graphkit.op;

import com.graphkit.api.Operation;
import com.graphkit.engine.ExecutionMethod;
import com.graphkit.engine.ExecutionResult;
import com.graphkit.engine.ExecutionSettings;
import com.graphkit.engine.Network;
import com.graphkit.engine.NetworkBuilder;
import com.graphkit.engine.ParallelPlanExecutor;
import com.graphkit.engine.Plan;
import com.graphkit.engine.PlanCompiler;
import com.graphkit.engine.PlanExecutor;
import com.graphkit.engine.SequentialPlanExecutor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * A composed network packaged as a single {@link Operation}.
 *
 * Its needs are the names some member consumes but no member produces; its
 * provides are everything the members produce. Because it is an Operation
 * itself, a NetworkOperation can be composed into a larger network.
 *
 * Plans are compiled on first use and cached per request shape (the set of
 * supplied input names and the set of requested outputs), so repeated calls
 * with the same shape skip compilation.
 *
 * The execution method can be switched at any time; a PARALLEL executor owns a
 * worker pool that is created on first use and released by {@link #close()}.
 */
@Log4j2
public final class NetworkOperation implements Operation, AutoCloseable {
    private final String name;
    private final Network network;
    private final ExecutionSettings settings;
    private final List<String> needs;
    private final List<String> provides;
    private final Map<PlanKey, Plan> plans = new ConcurrentHashMap<>();
    private final PlanExecutor sequential;

    private volatile ExecutionMethod method;
    private volatile Map<String, List<Object>> overwritesCollector;
    private ParallelPlanExecutor parallel;

    public NetworkOperation(String name, Collection<? extends Operation> operations, ExecutionSettings settings) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Operation name must not be blank");
        this.name = name;
        this.network = NetworkBuilder.compose(operations);
        this.settings = settings != null ? settings : ExecutionSettings.defaults();
        this.method = this.settings.getMethod();
        this.sequential = new SequentialPlanExecutor(this.settings.getListener());

        Set<String> produced = new LinkedHashSet<>();
        Set<String> consumed = new LinkedHashSet<>();
        for (Operation op : network.operations()) {
            produced.addAll(op.provides());
            consumed.addAll(op.needs());
        }
        consumed.removeAll(produced);
        this.needs = Collections.unmodifiableList(new ArrayList<>(consumed));
        this.provides = Collections.unmodifiableList(new ArrayList<>(produced));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> needs() {
        return needs;
    }

    @Override
    public List<String> provides() {
        return provides;
    }

    public Network network() {
        return network;
    }

    public ExecutionMethod getExecutionMethod() {
        return method;
    }

    public void setExecutionMethod(ExecutionMethod method) {
        if (method == null)
            throw new IllegalArgumentException("method must not be null");
        this.method = method;
    }

    /**
     * Installs a map that receives the overwrites of every subsequent execution;
     * histories of successive calls are appended. Pass null to stop collecting.
     */
    public void setOverwritesCollector(Map<String, List<Object>> collector) {
        this.overwritesCollector = collector;
    }

    /**
     * Returns the cached plan for the request shape, compiling it on first use.
     *
     * @param outputs The requested outputs, or null for everything computable.
     */
    public Plan plan(Collection<String> inputs, Collection<String> outputs) {
        PlanKey key = new PlanKey(new HashSet<>(inputs), outputs == null ? null : new HashSet<>(outputs));
        return plans.computeIfAbsent(key, k -> {
            log.debug("Compiling plan for '{}': inputs={} outputs={}", name, k.inputs(),
                    k.outputs() == null ? "*" : k.outputs());
            return outputs == null
                    ? PlanCompiler.compileAll(network, inputs)
                    : PlanCompiler.compile(network, inputs, outputs);
        });
    }

    /** Computes everything reachable from the values; returns all values. */
    public Map<String, Object> compute(Map<String, ?> values) {
        return execute(values, null).solution().values();
    }

    /** Computes and returns only the requested outputs. */
    public Map<String, Object> compute(Map<String, ?> values, Collection<String> outputs) {
        if (outputs == null)
            throw new IllegalArgumentException("outputs must not be null");
        return execute(values, outputs).solution().select(outputs);
    }

    /**
     * Runs the plan for (values, outputs) with the current execution method.
     *
     * @param outputs The requested outputs, or null for everything computable.
     */
    public ExecutionResult execute(Map<String, ?> values, Collection<String> outputs) {
        if (values == null)
            throw new IllegalArgumentException("values must not be null");
        Plan plan = plan(values.keySet(), outputs);
        ExecutionResult result = executor().execute(plan, values);

        Map<String, List<Object>> collector = overwritesCollector;
        if (collector != null && !result.overwrites().isEmpty()) {
            synchronized (collector) {
                result.overwrites().asMap()
                        .forEach((k, v) -> collector.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            }
        }
        return result;
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> inputs) {
        return compute(inputs, provides);
    }

    @Override
    public synchronized void close() {
        if (parallel != null) {
            parallel.close();
            parallel = null;
        }
    }

    private PlanExecutor executor() {
        if (method == ExecutionMethod.SEQUENTIAL)
            return sequential;
        synchronized (this) {
            if (parallel == null)
                parallel = new ParallelPlanExecutor(settings);
            return parallel;
        }
    }

    @Override
    public String toString() {
        return "NetworkOperation(name='" + name + "', needs=" + needs + ", provides=" + provides + ")";
    }

    private record PlanKey(Set<String> inputs, Set<String> outputs) {
    }
}
