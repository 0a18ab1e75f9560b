package com.graphkit.engine;

import com.graphkit.api.Operation;
import com.graphkit.exception.CyclicGraphException;
import com.graphkit.exception.DuplicateOperationException;
import com.graphkit.exception.EmptyOutputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Builder for constructing a {@link Network} from a set of operations.
 * <p>
 * Validates structural integrity as operations are added (duplicate names,
 * empty outputs, blank names) and runs the cycle check when building.
 *
 * Usage Pattern:
 * 1. Create a builder: NetworkBuilder b = NetworkBuilder.create();
 * 2. Add operations: b.add(op1).add(op2);
 * 3. Build: Network net = b.build();
 *
 * Or in one go: Network net = NetworkBuilder.compose(List.of(op1, op2));
 */
@Log4j2
public final class NetworkBuilder {
    private final List<Operation> operations = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    // Flag to prevent reuse after building
    private boolean built;

    private NetworkBuilder() {
    }

    public static NetworkBuilder create() {
        return new NetworkBuilder();
    }

    /**
     * Composes the given operations into a validated network.
     *
     * @throws IllegalArgumentException    if an operation has a blank name or a
     *                                     null needs or provides list.
     * @throws DuplicateOperationException if two operations share a name.
     * @throws EmptyOutputException        if an operation provides nothing.
     * @throws CyclicGraphException        if the operations form a cycle.
     */
    public static Network compose(Collection<? extends Operation> operations) {
        NetworkBuilder b = create();
        for (Operation op : operations)
            b.add(op);
        return b.build();
    }

    public NetworkBuilder add(Operation op) {
        checkNotBuilt();
        if (op == null)
            throw new IllegalArgumentException("Operation must not be null");
        String name = op.name();
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Operation name must not be blank: " + op);
        if (op.needs() == null || op.provides() == null)
            throw new IllegalArgumentException("Operation '" + name + "' must declare non-null needs and provides");
        if (!names.add(name))
            throw new DuplicateOperationException(name);
        if (op.provides().isEmpty())
            throw new EmptyOutputException(name);
        checkDataNames(name, op.needs());
        checkDataNames(name, op.provides());
        operations.add(op);
        return this;
    }

    public NetworkBuilder addAll(Collection<? extends Operation> ops) {
        for (Operation op : ops)
            add(op);
        return this;
    }

    /**
     * Builds the network.
     * <p>
     * Creates data nodes lazily in first-appearance order, wires edges into CSR
     * arrays and performs the cycle check.
     */
    public Network build() {
        checkNotBuilt();
        built = true;

        int o = operations.size();
        Operation[] ops = operations.toArray(new Operation[0]);
        Map<String, Integer> opIdx = new HashMap<>(o * 2);
        Map<String, Integer> dataIdx = new HashMap<>();
        List<String> dataNames = new ArrayList<>();

        // 1. Intern data names and collect per-op adjacency
        int[][] needs = new int[o][];
        int[][] provides = new int[o][];
        for (int oi = 0; oi < o; oi++) {
            opIdx.put(ops[oi].name(), oi);
            needs[oi] = intern(ops[oi].needs(), dataIdx, dataNames);
            provides[oi] = intern(ops[oi].provides(), dataIdx, dataNames);
        }
        int d = dataNames.size();

        // 2. Invert into data -> producers / consumers
        List<List<Integer>> producers = new ArrayList<>(d);
        List<List<Integer>> consumers = new ArrayList<>(d);
        for (int di = 0; di < d; di++) {
            producers.add(new ArrayList<>());
            consumers.add(new ArrayList<>());
        }
        for (int oi = 0; oi < o; oi++) {
            for (int di : needs[oi])
                consumers.get(di).add(oi);
            for (int di : provides[oi])
                producers.get(di).add(oi);
        }

        // 3. Flatten to CSR
        int[] needsOffset = offsets(needs);
        int[] providesOffset = offsets(provides);
        int[] producersOffset = offsets(producers);
        int[] consumersOffset = offsets(consumers);

        Network network = new Network(ops, dataNames.toArray(new String[0]),
                Collections.unmodifiableMap(opIdx), Collections.unmodifiableMap(dataIdx),
                needsOffset, flatten(needs, needsOffset), providesOffset, flatten(provides, providesOffset),
                producersOffset, flatten(producers, producersOffset),
                consumersOffset, flatten(consumers, consumersOffset));

        // 4. Reject cycles
        CycleDetector.Cycle cycle = CycleDetector.findCycle(network, null);
        if (cycle != null)
            throw new CyclicGraphException(cycle.path(), cycle.operations());

        log.debug("Composed {}", network);
        return network;
    }

    private static int[] intern(List<String> names, Map<String, Integer> dataIdx, List<String> dataNames) {
        Set<Integer> unique = new LinkedHashSet<>();
        for (String n : names) {
            Integer idx = dataIdx.get(n);
            if (idx == null) {
                idx = dataNames.size();
                dataIdx.put(n, idx);
                dataNames.add(n);
            }
            unique.add(idx);
        }
        return unique.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] offsets(int[][] rows) {
        int[] offsets = new int[rows.length + 1];
        for (int i = 0; i < rows.length; i++)
            offsets[i + 1] = offsets[i] + rows[i].length;
        return offsets;
    }

    private static int[] offsets(List<List<Integer>> rows) {
        int[] offsets = new int[rows.size() + 1];
        for (int i = 0; i < rows.size(); i++)
            offsets[i + 1] = offsets[i] + rows.get(i).size();
        return offsets;
    }

    private static int[] flatten(int[][] rows, int[] offsets) {
        int[] flat = new int[offsets[rows.length]];
        for (int i = 0; i < rows.length; i++)
            System.arraycopy(rows[i], 0, flat, offsets[i], rows[i].length);
        return flat;
    }

    private static int[] flatten(List<List<Integer>> rows, int[] offsets) {
        int[] flat = new int[offsets[rows.size()]];
        for (int i = 0; i < rows.size(); i++) {
            List<Integer> row = rows.get(i);
            for (int j = 0; j < row.size(); j++)
                flat[offsets[i] + j] = row.get(j);
        }
        return flat;
    }

    private static void checkDataNames(String opName, List<String> names) {
        for (String n : names)
            if (n == null || n.isBlank())
                throw new IllegalArgumentException("Operation '" + opName + "' declares a blank data name");
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("NetworkBuilder already built");
    }
}
