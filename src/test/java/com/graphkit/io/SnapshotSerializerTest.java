package com.graphkit.io;

import com.graphkit.GraphKit;
import com.graphkit.engine.Network;
import com.graphkit.engine.Plan;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SnapshotSerializerTest {

    private final Network network = GraphKit.network(
            GraphKit.operation("add").needs("a", "b").provides("sum").param("mode", 1)
                    .fn2((a, b) -> (Integer) a + (Integer) b),
            GraphKit.operation("double").needs("sum").provides("doubled")
                    .fn1(s -> (Integer) s * 2));

    @Test
    public void testNetworkSnapshot() {
        NetworkSnapshot snapshot = SnapshotSerializer.of(network);
        assertEquals(2, snapshot.getOperations().size());
        NetworkSnapshot.OperationDef add = snapshot.getOperations().get(0);
        assertEquals("add", add.getName());
        assertEquals("FunctionalOperation", add.getType());
        assertEquals(List.of("a", "b"), add.getNeeds());
        assertEquals("1", add.getParams().get("mode"));

        NetworkSnapshot.DataDef sum = snapshot.getData().get(2);
        assertEquals("sum", sum.getName());
        assertEquals(List.of("add"), sum.getProducers());
        assertEquals(List.of("double"), sum.getConsumers());
        assertNull(snapshot.getPlan());
    }

    @Test
    public void testPlanJsonReadsBack() throws Exception {
        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("doubled"));
        String json = SnapshotSerializer.toJson(plan);
        assertTrue(json.contains("\"requiredInputs\""));

        NetworkSnapshot back = SnapshotSerializer.fromJson(json);
        assertEquals(SnapshotSerializer.of(plan).getOperations(), back.getOperations());
        assertEquals(List.of("a", "b"), back.getPlan().getRequiredInputs());
        assertEquals(List.of("add", "double"), back.getPlan().getSteps());
        assertEquals(List.of(List.of(), List.of(0)), back.getPlan().getDependencies());
    }

    @Test
    public void testNetworkJsonOmitsPlan() {
        assertFalse(SnapshotSerializer.toJson(network).contains("\"plan\""));
    }
}
