package com.graphkit.util;

import com.graphkit.GraphKit;
import com.graphkit.engine.Network;
import com.graphkit.engine.Plan;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private Network network;

    @Before
    public void setUp() {
        network = GraphKit.network(
                GraphKit.operation("add").needs("a", "b").provides("sum").param("mode", "fast")
                        .fn2((a, b) -> (Integer) a + (Integer) b),
                GraphKit.operation("double").needs("sum").provides("doubled")
                        .fn1(s -> (Integer) s * 2));
    }

    @Test
    public void testMermaidEdges() {
        String mermaid = new GraphExplain(network).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("data_0 --> op_0;"));
        assertTrue(mermaid.contains("op_0 --> data_2;"));
        assertTrue(mermaid.contains("data_2 --> op_1;"));
        assertFalse(mermaid.contains("classDef"));
    }

    @Test
    public void testMermaidMarksPlan() {
        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("sum"));
        String mermaid = new GraphExplain(plan).toMermaid();
        assertTrue(mermaid.contains("op_0[\"0. add\"];"));
        assertTrue(mermaid.contains("class op_1 pruned;"));
        assertTrue(mermaid.contains("class data_0 input;"));
        assertTrue(mermaid.contains("class data_2 output;"));
    }

    @Test
    public void testDot() {
        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("sum"));
        String dot = new GraphExplain(plan).toDot();
        assertTrue(dot.startsWith("digraph network {"));
        assertTrue(dot.contains("op_0 -> data_2;"));
        assertTrue(dot.contains("op_1 [label=\"double\", shape=box, style=dashed];"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void testSimilarNamesGetDistinctNodes() {
        Network similar = GraphKit.network(
                GraphKit.operation("join").needs("a-b", "a_b").provides("out")
                        .fn2((x, y) -> x));
        String dot = new GraphExplain(similar).toDot();
        assertTrue(dot.contains("data_0 [label=\"a-b\", shape=ellipse];"));
        assertTrue(dot.contains("data_1 [label=\"a_b\", shape=ellipse];"));
        assertTrue(dot.contains("data_0 -> op_0;"));
        assertTrue(dot.contains("data_1 -> op_0;"));

        String mermaid = new GraphExplain(similar).toMermaid();
        assertTrue(mermaid.contains("data_0([\"a-b\"]);"));
        assertTrue(mermaid.contains("data_1([\"a_b\"]);"));
    }

    @Test
    public void testExplainOperation() {
        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("sum"));
        GraphExplain explain = new GraphExplain(plan);
        String add = explain.explainOperation("add");
        assertTrue(add.contains("Needs: [a, b]"));
        assertTrue(add.contains("Params: {mode=fast}"));
        assertTrue(add.contains("Plan step: 0"));
        assertTrue(explain.explainOperation("double").contains("Plan step: pruned"));
    }

    @Test
    public void testExplainData() {
        String sum = new GraphExplain(network).explainData("sum");
        assertTrue(sum.contains("Producers (1): add"));
        assertTrue(sum.contains("Consumers (1): double"));
    }

    @Test
    public void testDumps() {
        assertTrue(new GraphExplain(network).dumpTopology().contains("[1] double [sum] -> [doubled]"));

        Plan plan = GraphKit.compile(network, List.of("a", "b"), List.of("doubled"));
        String dump = new GraphExplain(plan).dumpPlan();
        assertTrue(dump.contains("Plan (2 steps):"));
        assertTrue(dump.contains("1. double [sum] -> [doubled]  after 0"));
    }

    @Test(expected = IllegalStateException.class)
    public void testDumpPlanRequiresPlan() {
        new GraphExplain(network).dumpPlan();
    }
}
