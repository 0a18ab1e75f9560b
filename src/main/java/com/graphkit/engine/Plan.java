package com.graphkit.engine;

import com.graphkit.api.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * An ordered, dependency-respecting sequence of operations for one
 * (inputs, outputs) request.
 *
 * Invariant: every need of step j is either a required input or provided by a
 * step at a position strictly below j.
 *
 * Alongside the steps, the plan keeps two index tables computed at compile time:
 * - dependencies(j): the earlier steps that provide any need of step j, in
 * ascending position order; dependents(i) is its inverse.
 * - needSource(j, k): the position of the latest earlier step providing the
 * k-th need of step j, or -1 when the value comes from the inputs.
 *
 * A Plan carries no execution state and may be executed concurrently.
 */
public final class Plan {
    private final Network network;
    private final int[] stepOps;
    private final int[][] dependencies;
    private final int[][] dependents;
    private final int[][] needSources;
    private final Set<String> requestedInputs;
    private final Set<String> requiredInputs;
    private final Set<String> providedOutputs;

    Plan(Network network, int[] stepOps, int[][] dependencies, int[][] dependents, int[][] needSources,
            Set<String> requestedInputs, Set<String> requiredInputs, Set<String> providedOutputs) {
        this.network = network;
        this.stepOps = stepOps;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.needSources = needSources;
        this.requestedInputs = Collections.unmodifiableSet(requestedInputs);
        this.requiredInputs = Collections.unmodifiableSet(requiredInputs);
        this.providedOutputs = Collections.unmodifiableSet(providedOutputs);
    }

    public Network network() {
        return network;
    }

    public int stepCount() {
        return stepOps.length;
    }

    /** The operation run at the given step position. */
    public Operation step(int j) {
        return network.operation(stepOps[j]);
    }

    /** The network operation index of the given step. */
    public int stepOperationIndex(int j) {
        return stepOps[j];
    }

    public List<Operation> steps() {
        List<Operation> steps = new ArrayList<>(stepOps.length);
        for (int oi : stepOps)
            steps.add(network.operation(oi));
        return Collections.unmodifiableList(steps);
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>(stepOps.length);
        for (int oi : stepOps)
            names.add(network.operationName(oi));
        return Collections.unmodifiableList(names);
    }

    public int dependencyCount(int j) {
        return dependencies[j].length;
    }

    public int dependency(int j, int i) {
        return dependencies[j][i];
    }

    public int dependentCount(int j) {
        return dependents[j].length;
    }

    public int dependent(int j, int i) {
        return dependents[j][i];
    }

    /**
     * Position of the step whose output feeds the k-th need of step j, or -1 if
     * the need is read from the inputs.
     */
    public int needSource(int j, int k) {
        return needSources[j][k];
    }

    /** The input names this plan was compiled for, in request order. */
    public Set<String> requestedInputs() {
        return requestedInputs;
    }

    /** Inputs that execute() requires to be present in the supplied values. */
    public Set<String> requiredInputs() {
        return requiredInputs;
    }

    /** Outputs guaranteed to be in the solution after a successful execution. */
    public Set<String> providedOutputs() {
        return providedOutputs;
    }

    @Override
    public String toString() {
        return "Plan(steps=" + stepNames() + ", requiredInputs=" + requiredInputs
                + ", providedOutputs=" + providedOutputs + ")";
    }
}
