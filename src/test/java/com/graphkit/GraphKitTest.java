package com.graphkit;

import com.graphkit.api.Operation;
import com.graphkit.engine.ExecutionMethod;
import com.graphkit.engine.ExecutionResult;
import com.graphkit.engine.ExecutionSettings;
import com.graphkit.engine.Network;
import com.graphkit.engine.Plan;
import com.graphkit.exception.CyclicGraphException;
import com.graphkit.exception.UnsatisfiableOutputException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphKitTest {

    private static final Operation ADD = GraphKit.operation("add").needs("a", "b").provides("sum")
            .fn2((a, b) -> (Integer) a + (Integer) b);
    private static final Operation DOUBLE = GraphKit.operation("double").needs("sum").provides("doubled")
            .fn1(s -> (Integer) s * 2);

    @Test
    public void testAddDoubleScenario() {
        Network network = GraphKit.network(ADD, DOUBLE);
        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("doubled"));
        assertEquals(List.of("add", "double"), plan.stepNames());

        ExecutionResult result = GraphKit.execute(plan, Map.of("a", 2, "b", 3));
        assertEquals(Map.of("a", 2, "b", 3, "sum", 5, "doubled", 10), result.solution().values());
        assertTrue(result.overwrites().isEmpty());
    }

    @Test
    public void testRequestingSumPrunesDouble() {
        Plan plan = GraphKit.compile(GraphKit.network(ADD, DOUBLE), List.of("a", "b"), List.of("sum"));
        assertEquals(List.of("add"), plan.stepNames());
        assertTrue(plan.providedOutputs().contains("sum"));
    }

    @Test
    public void testUnknownOutputIsNamed() {
        try {
            GraphKit.compile(GraphKit.network(ADD, DOUBLE), List.of("a", "b"), List.of("unknown"));
            fail("Should have thrown UnsatisfiableOutputException");
        } catch (UnsatisfiableOutputException e) {
            assertEquals(List.of("unknown"), e.unreachable());
            assertTrue(e.getMessage().contains("unknown"));
        }
    }

    @Test(expected = CyclicGraphException.class)
    public void testCycleRejectedAtCompose() {
        GraphKit.network(
                GraphKit.operation("A").needs("x").provides("y").fn1(x -> x),
                GraphKit.operation("B").needs("y").provides("x").fn1(y -> y));
    }

    @Test
    public void testEveryStepIsNecessary() {
        List<Operation> ops = List.of(
                ADD, DOUBLE,
                GraphKit.operation("square").needs("a").provides("sq").fn1(a -> (Integer) a * (Integer) a),
                GraphKit.operation("combine").needs("doubled", "sq").provides("total")
                        .fn2((d, s) -> (Integer) d + (Integer) s),
                GraphKit.operation("unrelated").needs("b").provides("noise").fn1(b -> b));
        Plan plan = GraphKit.compile(GraphKit.network(ops), List.of("a", "b"), List.of("total"));
        assertEquals(List.of("add", "double", "square", "combine"), plan.stepNames());

        // Dropping any single step from the network makes the request unsatisfiable
        for (String removed : plan.stepNames()) {
            List<Operation> without = new ArrayList<>();
            for (Operation op : ops)
                if (!op.name().equals(removed))
                    without.add(op);
            try {
                GraphKit.compile(GraphKit.network(without), List.of("a", "b"), List.of("total"));
                fail("Plan still satisfiable without " + removed);
            } catch (UnsatisfiableOutputException e) {
                assertEquals(List.of("total"), e.unreachable());
            }
        }
    }

    @Test
    public void testParallelEqualsSequential() {
        List<Operation> ops = new ArrayList<>();
        ops.add(GraphKit.operation("seed").needs("x").provides("v0", "log").fn1(x -> new Object[] { x, "seed" }));
        for (int i = 1; i <= 8; i++) {
            String tag = "step" + i;
            ops.add(GraphKit.operation(tag).needs("v0").provides("v" + i, "log")
                    .fn1(v -> new Object[] { (Integer) v + tag.length(), tag }));
        }
        ops.add(GraphKit.operation("sum").needs("v1", "v2", "v3", "v4", "v5", "v6", "v7", "v8").provides("total")
                .fnN(args -> {
                    int total = 0;
                    for (Object o : args)
                        total += (Integer) o;
                    return total;
                }));
        Plan plan = GraphKit.compile(GraphKit.network(ops), List.of("x"), List.of("total", "log"));

        ExecutionResult sequential = GraphKit.execute(plan, Map.of("x", 1));
        ExecutionResult parallel = GraphKit.execute(plan, Map.of("x", 1),
                ExecutionSettings.builder().method(ExecutionMethod.PARALLEL).parallelism(4).build());

        assertEquals(sequential.solution().values(), parallel.solution().values());
        assertEquals(sequential.overwrites().asMap(), parallel.overwrites().asMap());
        assertEquals("step8", parallel.solution().get("log"));
        assertEquals(List.of("seed", "step1", "step2", "step3", "step4", "step5", "step6", "step7"),
                parallel.overwrites().get("log"));
    }
}
