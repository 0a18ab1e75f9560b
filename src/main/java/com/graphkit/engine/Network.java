package com.graphkit.engine;

import com.graphkit.api.Operation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Network -- CSR-encoded bipartite graph of operation and data nodes.
 *
 * This class represents the immutable structure of the graph after it has been
 * composed. Every node is addressed by a stable integer index:
 *
 * - Operation nodes are indexed in declaration order (0..O-1).
 * - Data nodes are indexed in order of first appearance across the operations,
 * needs before provides (0..D-1).
 *
 * Data layout (Compressed Sparse Row):
 * Instead of letting nodes hold references to each other, every adjacency is
 * flattened into one int array plus an offset array. The needs of operation i
 * are stored in needsList[needsOffset[i]] inclusive to
 * needsList[needsOffset[i+1]] exclusive; provides, producers and consumers use
 * the same scheme.
 *
 * Benefits:
 * 1. Immutable: no arrays are exposed, so a Network can be traversed
 * concurrently without synchronization.
 * 2. Compact: edges are index pairs, which keeps serialization and
 * visualization trivial.
 *
 * Instances are created by {@link NetworkBuilder}; every Network handed out is
 * validated and acyclic.
 */
public final class Network {
    private final Operation[] operations;
    private final String[] dataNames;
    private final Map<String, Integer> operationIndex;
    private final Map<String, Integer> dataIndex;

    // op -> data
    private final int[] needsOffset, needsList;
    private final int[] providesOffset, providesList;

    // data -> op
    private final int[] producersOffset, producersList;
    private final int[] consumersOffset, consumersList;

    Network(Operation[] operations, String[] dataNames,
            Map<String, Integer> operationIndex, Map<String, Integer> dataIndex,
            int[] needsOffset, int[] needsList, int[] providesOffset, int[] providesList,
            int[] producersOffset, int[] producersList, int[] consumersOffset, int[] consumersList) {
        this.operations = operations;
        this.dataNames = dataNames;
        this.operationIndex = operationIndex;
        this.dataIndex = dataIndex;
        this.needsOffset = needsOffset;
        this.needsList = needsList;
        this.providesOffset = providesOffset;
        this.providesList = providesList;
        this.producersOffset = producersOffset;
        this.producersList = producersList;
        this.consumersOffset = consumersOffset;
        this.consumersList = consumersList;
    }

    // ── Operation nodes ──────────────────────────────────────────

    public int operationCount() {
        return operations.length;
    }

    /** Returns the operation at the given declaration index. */
    public Operation operation(int oi) {
        return operations[oi];
    }

    public String operationName(int oi) {
        return operations[oi].name();
    }

    /** Resolves an operation name to its index. O(1) hash lookup. */
    public int operationIndex(String name) {
        Integer idx = operationIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown operation: " + name);
        return idx;
    }

    public boolean hasOperation(String name) {
        return operationIndex.containsKey(name);
    }

    /** All operations in declaration order. */
    public List<Operation> operations() {
        return Collections.unmodifiableList(Arrays.asList(operations));
    }

    public int needCount(int oi) {
        return needsOffset[oi + 1] - needsOffset[oi];
    }

    /** Data index of the i-th need of operation oi. */
    public int need(int oi, int i) {
        return needsList[needsOffset[oi] + i];
    }

    public int provideCount(int oi) {
        return providesOffset[oi + 1] - providesOffset[oi];
    }

    /** Data index of the i-th provide of operation oi. */
    public int provide(int oi, int i) {
        return providesList[providesOffset[oi] + i];
    }

    // ── Data nodes ───────────────────────────────────────────────

    public int dataCount() {
        return dataNames.length;
    }

    public String dataName(int di) {
        return dataNames[di];
    }

    /** Resolves a data name to its index. */
    public int dataIndex(String name) {
        int idx = findDataIndex(name);
        if (idx < 0)
            throw new IllegalArgumentException("Unknown data node: " + name);
        return idx;
    }

    /** Resolves a data name to its index, or -1 when the network has no such node. */
    public int findDataIndex(String name) {
        Integer idx = dataIndex.get(name);
        return idx == null ? -1 : idx;
    }

    public boolean hasData(String name) {
        return dataIndex.containsKey(name);
    }

    /** All data names in first-appearance order. */
    public List<String> dataNames() {
        return Collections.unmodifiableList(Arrays.asList(dataNames));
    }

    public int producerCount(int di) {
        return producersOffset[di + 1] - producersOffset[di];
    }

    /** Operation index of the i-th producer of data node di, in declaration order. */
    public int producer(int di, int i) {
        return producersList[producersOffset[di] + i];
    }

    public int consumerCount(int di) {
        return consumersOffset[di + 1] - consumersOffset[di];
    }

    /** Operation index of the i-th consumer of data node di, in declaration order. */
    public int consumer(int di, int i) {
        return consumersList[consumersOffset[di] + i];
    }

    /** Total number of data→operation and operation→data edges. */
    public int edgeCount() {
        return needsList.length + providesList.length;
    }

    @Override
    public String toString() {
        return "Network(operations=" + operations.length + ", data=" + dataNames.length
                + ", edges=" + edgeCount() + ")";
    }
}
