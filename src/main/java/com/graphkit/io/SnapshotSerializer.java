package com.graphkit.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphkit.api.Operation;
import com.graphkit.engine.Network;
import com.graphkit.engine.Plan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts networks and plans to {@link NetworkSnapshot}s and snapshots to
 * JSON.
 *
 * Param values are rendered with {@code String.valueOf}; a snapshot describes
 * structure and is not meant to recreate operations.
 */
public final class SnapshotSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SnapshotSerializer() {
    }

    public static NetworkSnapshot of(Network network) {
        NetworkSnapshot snapshot = new NetworkSnapshot();

        List<NetworkSnapshot.OperationDef> ops = new ArrayList<>(network.operationCount());
        for (Operation op : network.operations()) {
            NetworkSnapshot.OperationDef def = new NetworkSnapshot.OperationDef();
            def.setName(op.name());
            def.setType(op.getClass().getSimpleName());
            def.setNeeds(new ArrayList<>(op.needs()));
            def.setProvides(new ArrayList<>(op.provides()));
            if (!op.params().isEmpty()) {
                Map<String, String> params = new LinkedHashMap<>();
                op.params().forEach((k, v) -> params.put(k, String.valueOf(v)));
                def.setParams(params);
            }
            ops.add(def);
        }
        snapshot.setOperations(ops);

        List<NetworkSnapshot.DataDef> data = new ArrayList<>(network.dataCount());
        for (int di = 0; di < network.dataCount(); di++) {
            NetworkSnapshot.DataDef def = new NetworkSnapshot.DataDef();
            def.setName(network.dataName(di));
            List<String> producers = new ArrayList<>();
            for (int i = 0; i < network.producerCount(di); i++)
                producers.add(network.operationName(network.producer(di, i)));
            List<String> consumers = new ArrayList<>();
            for (int i = 0; i < network.consumerCount(di); i++)
                consumers.add(network.operationName(network.consumer(di, i)));
            def.setProducers(producers);
            def.setConsumers(consumers);
            data.add(def);
        }
        snapshot.setData(data);
        return snapshot;
    }

    /** Snapshot of the plan's network with the plan section filled in. */
    public static NetworkSnapshot of(Plan plan) {
        NetworkSnapshot snapshot = of(plan.network());
        NetworkSnapshot.PlanDef def = new NetworkSnapshot.PlanDef();
        def.setSteps(new ArrayList<>(plan.stepNames()));
        List<List<Integer>> deps = new ArrayList<>(plan.stepCount());
        for (int j = 0; j < plan.stepCount(); j++) {
            List<Integer> row = new ArrayList<>(plan.dependencyCount(j));
            for (int i = 0; i < plan.dependencyCount(j); i++)
                row.add(plan.dependency(j, i));
            deps.add(row);
        }
        def.setDependencies(deps);
        def.setRequiredInputs(new ArrayList<>(plan.requiredInputs()));
        def.setProvidedOutputs(new ArrayList<>(plan.providedOutputs()));
        snapshot.setPlan(def);
        return snapshot;
    }

    public static String toJson(NetworkSnapshot snapshot) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    public static String toJson(Network network) {
        return toJson(of(network));
    }

    public static String toJson(Plan plan) {
        return toJson(of(plan));
    }

    public static NetworkSnapshot fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, NetworkSnapshot.class);
    }
}
