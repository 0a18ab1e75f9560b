package com.graphkit.engine;

import com.graphkit.GraphKit;
import com.graphkit.api.Operation;
import com.graphkit.exception.CyclicGraphException;
import com.graphkit.exception.DuplicateOperationException;
import com.graphkit.exception.EmptyOutputException;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class NetworkBuilderTest {

    private static Operation op(String name, List<String> needs, List<String> provides) {
        return GraphKit.operation(name).needs(needs).provides(provides).fn(in -> Map.of());
    }

    @Test
    public void testEmptyNetwork() {
        Network net = NetworkBuilder.create().build();
        assertEquals(0, net.operationCount());
        assertEquals(0, net.dataCount());
        assertEquals(0, net.edgeCount());
    }

    @Test
    public void testDataNodesInFirstAppearanceOrder() {
        Network net = NetworkBuilder.create()
                .add(op("add", List.of("a", "b"), List.of("sum")))
                .add(op("double", List.of("sum"), List.of("doubled")))
                .build();

        assertEquals(2, net.operationCount());
        assertEquals(List.of("a", "b", "sum", "doubled"), net.dataNames());
        assertEquals(0, net.operationIndex("add"));
        assertEquals(1, net.operationIndex("double"));
        assertEquals(5, net.edgeCount());

        // sum is written by add and read by double
        int sum = net.dataIndex("sum");
        assertEquals(1, net.producerCount(sum));
        assertEquals(0, net.producer(sum, 0));
        assertEquals(1, net.consumerCount(sum));
        assertEquals(1, net.consumer(sum, 0));

        // a is an input: no producers
        assertEquals(0, net.producerCount(net.dataIndex("a")));
        assertEquals(-1, net.findDataIndex("missing"));
        assertFalse(net.hasData("missing"));
    }

    @Test
    public void testSharedOutputHasTwoProducers() {
        Network net = NetworkBuilder.compose(List.of(
                op("first", List.of("a"), List.of("z")),
                op("second", List.of("b"), List.of("z"))));
        int z = net.dataIndex("z");
        assertEquals(2, net.producerCount(z));
        assertEquals(0, net.producer(z, 0));
        assertEquals(1, net.producer(z, 1));
    }

    @Test
    public void testDuplicateOperationName() {
        NetworkBuilder b = NetworkBuilder.create().add(op("add", List.of("a"), List.of("x")));
        try {
            b.add(op("add", List.of("b"), List.of("y")));
            fail("Should have thrown DuplicateOperationException");
        } catch (DuplicateOperationException e) {
            assertEquals("add", e.operationName());
        }
    }

    @Test
    public void testEmptyOutputs() {
        try {
            NetworkBuilder.create().add(op("sink", List.of("a"), List.of()));
            fail("Should have thrown EmptyOutputException");
        } catch (EmptyOutputException e) {
            assertEquals("sink", e.operationName());
        }
    }

    @Test
    public void testCycleDetection() {
        // A: x -> y, B: y -> x
        try {
            NetworkBuilder.compose(List.of(
                    op("A", List.of("x"), List.of("y")),
                    op("B", List.of("y"), List.of("x"))));
            fail("Should have thrown CyclicGraphException");
        } catch (CyclicGraphException e) {
            assertEquals(List.of("A", "y", "B", "x", "A"), e.cycle());
            assertEquals(List.of("A", "B"), e.operationNames());
            assertTrue(e.getMessage().contains("A -> y -> B -> x -> A"));
        }
    }

    @Test
    public void testSelfLoopIsCycle() {
        try {
            NetworkBuilder.compose(List.of(op("inc", List.of("x"), List.of("x"))));
            fail("Should have thrown CyclicGraphException");
        } catch (CyclicGraphException e) {
            assertEquals(List.of("inc", "x", "inc"), e.cycle());
            assertEquals(List.of("inc"), e.operationNames());
        }
    }

    @Test
    public void testCycleBehindAcyclicPrefix() {
        try {
            NetworkBuilder.compose(List.of(
                    op("src", List.of("a"), List.of("x")),
                    op("B", List.of("x", "z"), List.of("y")),
                    op("C", List.of("y"), List.of("z"))));
            fail("Should have thrown CyclicGraphException");
        } catch (CyclicGraphException e) {
            assertEquals(List.of("B", "C"), e.operationNames());
            assertEquals(e.cycle().get(0), e.cycle().get(e.cycle().size() - 1));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullOperationRejected() {
        NetworkBuilder.create().add(null);
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderCannotBeReused() {
        NetworkBuilder b = NetworkBuilder.create().add(op("add", List.of("a"), List.of("x")));
        b.build();
        b.add(op("other", List.of("a"), List.of("y")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOperationIndex() {
        Network net = NetworkBuilder.compose(List.of(op("add", List.of("a"), List.of("x"))));
        net.operationIndex("nope");
    }

    /** Hand-written operation that bypasses the builder's list handling. */
    private static Operation custom(List<String> needs, List<String> provides) {
        return new Operation() {
            @Override
            public String name() {
                return "custom";
            }

            @Override
            public List<String> needs() {
                return needs;
            }

            @Override
            public List<String> provides() {
                return provides;
            }

            @Override
            public Map<String, Object> invoke(Map<String, Object> inputs) {
                return Map.of("x", 1);
            }
        };
    }

    @Test
    public void testNullNeedsRejected() {
        try {
            NetworkBuilder.create().add(custom(null, List.of("x")));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("custom"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullProvidesRejected() {
        NetworkBuilder.create().add(custom(List.of("a"), null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullNeedsRejectedWhenComposingNetworkOperation() {
        GraphKit.compose("outer", custom(null, List.of("x")));
    }

    @Test
    public void testEmptyNeedsRunOnBothExecutors() {
        Network net = NetworkBuilder.compose(List.of(custom(List.of(), List.of("x"))));
        Plan plan = PlanCompiler.compile(net, List.of(), List.of("x"));
        assertEquals(1, new SequentialPlanExecutor().execute(plan, Map.of()).solution().get("x"));
        try (ParallelPlanExecutor parallel = new ParallelPlanExecutor(
                ExecutionSettings.builder().method(ExecutionMethod.PARALLEL).parallelism(2).build())) {
            assertEquals(1, parallel.execute(plan, Map.of()).solution().get("x"));
        }
    }
}
