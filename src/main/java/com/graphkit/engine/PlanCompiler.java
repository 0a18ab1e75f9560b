package com.graphkit.engine;

import com.graphkit.exception.CyclicGraphException;
import com.graphkit.exception.UnsatisfiableOutputException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a {@link Network} into a {@link Plan} for one (inputs, outputs)
 * request.
 *
 * Algorithm:
 *
 * 1. Backward reachability: starting from the requested outputs, walk
 * data -> producing operations -> their needs -> ... to bound the candidate
 * operations. Data nodes that are supplied as inputs are not expanded; a given
 * value is never recomputed only to satisfy a need.
 *
 * 2. Forward feasibility: starting from the inputs, an operation becomes
 * runnable once all of its needs are available, which in turn makes its
 * provides available. Iterated to a fixed point with per-operation missing-need
 * counters. Candidates that never become runnable are dropped.
 *
 * 3. Backward re-prune: the backward walk is repeated over runnable operations
 * only, so operations that merely fed a dropped operation do not survive.
 *
 * 4. Ordering: Kahn's algorithm over producer -> consumer edges between the
 * survivors, with a frontier ordered by declaration index. This is what makes
 * the "last writer wins" outcome for shared output names deterministic.
 *
 * 5. Verification: every requested output must be an input or be provided by
 * a surviving step.
 *
 * Compilation is a pure function of its arguments: compiling the same request
 * twice yields identical step orders.
 */
public final class PlanCompiler {
    private static final Logger log = LogManager.getLogger(PlanCompiler.class);

    private PlanCompiler() {
    }

    /**
     * Compiles the minimal plan computing {@code outputs} from {@code inputs}.
     *
     * @throws UnsatisfiableOutputException if some output cannot be produced.
     */
    public static Plan compile(Network network, Collection<String> inputs, Collection<String> outputs) {
        if (outputs == null)
            throw new IllegalArgumentException("outputs must not be null; use compileAll to compute everything");
        return doCompile(network, inputs, outputs);
    }

    /**
     * Compiles a plan computing everything that can be computed from
     * {@code inputs}. No backward pruning takes place.
     */
    public static Plan compileAll(Network network, Collection<String> inputs) {
        return doCompile(network, inputs, null);
    }

    private static Plan doCompile(Network net, Collection<String> inputs, Collection<String> outputs) {
        final int o = net.operationCount();
        final int d = net.dataCount();

        Set<String> inputSet = names("inputs", inputs);
        Set<String> outputSet = outputs == null ? null : names("outputs", outputs);

        boolean[] isInput = new boolean[d];
        for (String in : inputSet) {
            int di = net.findDataIndex(in);
            if (di >= 0)
                isInput[di] = true;
        }

        // 1. Backward reachability
        boolean[] candidate;
        if (outputSet != null) {
            candidate = reachBackward(net, outputSet, isInput, null);
        } else {
            candidate = new boolean[o];
            Arrays.fill(candidate, true);
        }

        // 2. Forward feasibility
        boolean[] runnable = reachForward(net, candidate, isInput);

        // 3. Backward re-prune over runnable operations
        boolean[] survivor = outputSet != null ? reachBackward(net, outputSet, isInput, runnable) : runnable;

        // 4. Ordering
        int[] stepOps = order(net, survivor);

        // 5. Verification
        boolean[] produced = new boolean[d];
        for (int oi : stepOps)
            for (int i = 0; i < net.provideCount(oi); i++)
                produced[net.provide(oi, i)] = true;

        Set<String> providedOutputs = new LinkedHashSet<>();
        if (outputSet != null) {
            List<String> unreachable = new ArrayList<>();
            for (String out : outputSet) {
                int di = net.findDataIndex(out);
                if (inputSet.contains(out) || (di >= 0 && produced[di]))
                    providedOutputs.add(out);
                else
                    unreachable.add(out);
            }
            if (!unreachable.isEmpty())
                throw new UnsatisfiableOutputException(unreachable);
        } else {
            providedOutputs.addAll(inputSet);
            for (int oi : stepOps)
                for (int i = 0; i < net.provideCount(oi); i++)
                    providedOutputs.add(net.dataName(net.provide(oi, i)));
        }

        Plan plan = link(net, stepOps, inputSet, providedOutputs);
        log.debug("Compiled plan: inputs={} outputs={} steps={}", inputSet,
                outputSet == null ? "*" : outputSet, plan.stepNames());
        return plan;
    }

    /**
     * Marks every operation (restricted to {@code allowed}, if given) that can
     * contribute to the outputs without recomputing an input.
     */
    private static boolean[] reachBackward(Network net, Set<String> outputs, boolean[] isInput, boolean[] allowed) {
        boolean[] reached = new boolean[net.operationCount()];
        boolean[] visited = new boolean[net.dataCount()];
        Deque<Integer> work = new ArrayDeque<>();
        for (String out : outputs) {
            int di = net.findDataIndex(out);
            if (di >= 0 && !isInput[di] && !visited[di]) {
                visited[di] = true;
                work.push(di);
            }
        }
        while (!work.isEmpty()) {
            int di = work.pop();
            for (int i = 0; i < net.producerCount(di); i++) {
                int oi = net.producer(di, i);
                if (reached[oi] || (allowed != null && !allowed[oi]))
                    continue;
                reached[oi] = true;
                for (int k = 0; k < net.needCount(oi); k++) {
                    int need = net.need(oi, k);
                    if (!visited[need] && !isInput[need]) {
                        visited[need] = true;
                        work.push(need);
                    }
                }
            }
        }
        return reached;
    }

    /** Fixed point of "all needs available -> runnable -> provides available". */
    private static boolean[] reachForward(Network net, boolean[] candidate, boolean[] isInput) {
        final int o = net.operationCount();
        boolean[] available = isInput.clone();
        boolean[] runnable = new boolean[o];
        int[] missing = new int[o];
        Deque<Integer> ready = new ArrayDeque<>();

        for (int oi = 0; oi < o; oi++) {
            if (!candidate[oi])
                continue;
            for (int k = 0; k < net.needCount(oi); k++)
                if (!available[net.need(oi, k)])
                    missing[oi]++;
            if (missing[oi] == 0)
                ready.add(oi);
        }

        while (!ready.isEmpty()) {
            int oi = ready.poll();
            runnable[oi] = true;
            for (int i = 0; i < net.provideCount(oi); i++) {
                int di = net.provide(oi, i);
                if (available[di])
                    continue;
                available[di] = true;
                for (int c = 0; c < net.consumerCount(di); c++) {
                    int consumer = net.consumer(di, c);
                    if (candidate[consumer] && --missing[consumer] == 0)
                        ready.add(consumer);
                }
            }
        }
        return runnable;
    }

    /** Kahn's algorithm over survivors; ties broken by declaration index. */
    private static int[] order(Network net, boolean[] survivor) {
        final int o = net.operationCount();
        int[] inDegree = new int[o];
        int count = 0;
        for (int oi = 0; oi < o; oi++) {
            if (!survivor[oi])
                continue;
            count++;
            for (int i = 0; i < net.provideCount(oi); i++) {
                int di = net.provide(oi, i);
                for (int c = 0; c < net.consumerCount(di); c++) {
                    int consumer = net.consumer(di, c);
                    if (survivor[consumer] && consumer != oi)
                        inDegree[consumer]++;
                }
            }
        }

        PriorityQueue<Integer> frontier = new PriorityQueue<>();
        for (int oi = 0; oi < o; oi++)
            if (survivor[oi] && inDegree[oi] == 0)
                frontier.add(oi);

        int[] steps = new int[count];
        int n = 0;
        while (!frontier.isEmpty()) {
            int oi = frontier.poll();
            steps[n++] = oi;
            for (int i = 0; i < net.provideCount(oi); i++) {
                int di = net.provide(oi, i);
                for (int c = 0; c < net.consumerCount(di); c++) {
                    int consumer = net.consumer(di, c);
                    if (survivor[consumer] && consumer != oi && --inDegree[consumer] == 0)
                        frontier.add(consumer);
                }
            }
        }

        if (n != count) {
            // Unreachable for networks built by NetworkBuilder.
            CycleDetector.Cycle cycle = CycleDetector.findCycle(net, survivor);
            if (cycle != null)
                throw new CyclicGraphException(cycle.path(), cycle.operations());
            List<String> stuck = new ArrayList<>();
            for (int oi = 0; oi < o; oi++)
                if (survivor[oi] && inDegree[oi] > 0)
                    stuck.add(net.operationName(oi));
            throw new CyclicGraphException(stuck, stuck);
        }
        return steps;
    }

    /** Computes the dependency tables and input sets for the ordered steps. */
    private static Plan link(Network net, int[] stepOps, Set<String> inputSet, Set<String> providedOutputs) {
        final int n = stepOps.length;
        int[] position = new int[net.operationCount()];
        Arrays.fill(position, -1);
        for (int j = 0; j < n; j++)
            position[stepOps[j]] = j;

        int[][] dependencies = new int[n][];
        int[][] needSources = new int[n][];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int j = 0; j < n; j++)
            dependents.add(new ArrayList<>());

        Set<String> neededInputs = new LinkedHashSet<>();
        for (int j = 0; j < n; j++) {
            int oi = stepOps[j];
            TreeSet<Integer> deps = new TreeSet<>();
            needSources[j] = new int[net.needCount(oi)];
            for (int k = 0; k < net.needCount(oi); k++) {
                int di = net.need(oi, k);
                int latest = -1;
                for (int p = 0; p < net.producerCount(di); p++) {
                    int pos = position[net.producer(di, p)];
                    if (pos >= 0 && pos < j) {
                        deps.add(pos);
                        latest = Math.max(latest, pos);
                    }
                }
                needSources[j][k] = latest;
                String name = net.dataName(di);
                if (inputSet.contains(name))
                    neededInputs.add(name);
            }
            dependencies[j] = deps.stream().mapToInt(Integer::intValue).toArray();
            for (int dep : dependencies[j])
                dependents.get(dep).add(j);
        }

        int[][] dependentsArr = new int[n][];
        for (int j = 0; j < n; j++)
            dependentsArr[j] = dependents.get(j).stream().mapToInt(Integer::intValue).toArray();

        Set<String> requiredInputs = new LinkedHashSet<>();
        for (String in : inputSet)
            if (neededInputs.contains(in) || providedOutputs.contains(in))
                requiredInputs.add(in);

        return new Plan(net, stepOps, dependencies, dependentsArr, needSources,
                new LinkedHashSet<>(inputSet), requiredInputs, providedOutputs);
    }

    private static Set<String> names(String what, Collection<String> names) {
        Set<String> set = new LinkedHashSet<>();
        if (names == null)
            return set;
        for (String n : names) {
            if (n == null)
                throw new IllegalArgumentException("null name in " + what);
            set.add(n);
        }
        return set;
    }
}
