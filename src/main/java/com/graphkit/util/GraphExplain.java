package com.graphkit.util;

import com.graphkit.api.Operation;
import com.graphkit.engine.Network;
import com.graphkit.engine.Plan;

import java.util.Arrays;
import java.util.Set;

/**
 * Diagnostic utility for inspecting network and plan structure.
 *
 * <p>
 * Generates human-readable text, Mermaid and Graphviz DOT renderings of a
 * {@link Network}. When constructed from a {@link Plan}, the renderings also
 * mark the plan's steps (with their position), its required inputs and its
 * provided outputs; operations pruned from the plan are drawn dimmed.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * documentation. Allocates strings freely.
 */
public final class GraphExplain {
    private final Network network;
    private final Plan plan;
    private final int[] stepOf;

    public GraphExplain(Network network) {
        this(network, null);
    }

    public GraphExplain(Plan plan) {
        this(plan.network(), plan);
    }

    private GraphExplain(Network network, Plan plan) {
        this.network = network;
        this.plan = plan;
        this.stepOf = new int[network.operationCount()];
        Arrays.fill(stepOf, -1);
        if (plan != null)
            for (int j = 0; j < plan.stepCount(); j++)
                stepOf[plan.stepOperationIndex(j)] = j;
    }

    /**
     * Dumps the declaration of a single operation and its wiring.
     */
    public String explainOperation(String operationName) {
        int oi = network.operationIndex(operationName);
        Operation op = network.operation(oi);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Operation: ").append(operationName).append('\n')
                .append("  Index: ").append(oi).append('\n')
                .append("  Type: ").append(op.getClass().getSimpleName()).append('\n')
                .append("  Needs: ").append(op.needs()).append('\n')
                .append("  Provides: ").append(op.provides()).append('\n');
        if (!op.params().isEmpty())
            sb.append("  Params: ").append(op.params()).append('\n');
        if (plan != null)
            sb.append("  Plan step: ").append(stepOf[oi] >= 0 ? String.valueOf(stepOf[oi]) : "pruned").append('\n');
        return sb.toString();
    }

    /**
     * Dumps the producers and consumers of a data node.
     */
    public String explainData(String dataName) {
        int di = network.dataIndex(dataName);
        StringBuilder sb = new StringBuilder(128);
        sb.append("Data: ").append(dataName).append('\n');
        sb.append("  Producers (").append(network.producerCount(di)).append("): ");
        for (int i = 0; i < network.producerCount(di); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(network.operationName(network.producer(di, i)));
        }
        sb.append('\n').append("  Consumers (").append(network.consumerCount(di)).append("): ");
        for (int i = 0; i < network.consumerCount(di); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(network.operationName(network.consumer(di, i)));
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the network in declaration order, one operation per line.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Network (").append(network.operationCount()).append(" operations, ")
                .append(network.dataCount()).append(" data):\n");
        for (int oi = 0; oi < network.operationCount(); oi++) {
            Operation op = network.operation(oi);
            sb.append("  [").append(oi).append("] ").append(op.name())
                    .append(' ').append(op.needs()).append(" -> ").append(op.provides()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the plan steps in execution order with their dependencies.
     */
    public String dumpPlan() {
        if (plan == null)
            throw new IllegalStateException("No plan to dump; construct GraphExplain from a Plan");
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Plan (").append(plan.stepCount()).append(" steps):\n")
                .append("  Required inputs: ").append(plan.requiredInputs()).append('\n')
                .append("  Provided outputs: ").append(plan.providedOutputs()).append('\n');
        for (int j = 0; j < plan.stepCount(); j++) {
            Operation op = plan.step(j);
            sb.append("  ").append(j).append(". ").append(op.name())
                    .append(' ').append(op.needs()).append(" -> ").append(op.provides());
            if (plan.dependencyCount(j) > 0) {
                sb.append("  after ");
                for (int i = 0; i < plan.dependencyCount(j); i++) {
                    if (i > 0)
                        sb.append(", ");
                    sb.append(plan.dependency(j, i));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart.
     * <p>
     * Operations are boxes, data nodes are rounded. Edges run from needed data to
     * the operation and from the operation to the data it provides.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare data nodes
        for (int di = 0; di < network.dataCount(); di++) {
            String name = network.dataName(di);
            sb.append("  ").append(dataId(di)).append("([\"").append(mermaidLabel(name)).append("\"]);\n");
        }

        // 2. Declare operations
        for (int oi = 0; oi < network.operationCount(); oi++) {
            String name = network.operationName(oi);
            String label = stepOf[oi] >= 0 ? stepOf[oi] + ". " + name : name;
            sb.append("  ").append(opId(oi)).append("[\"").append(mermaidLabel(label)).append("\"];\n");
        }

        // 3. Edges
        for (int oi = 0; oi < network.operationCount(); oi++) {
            String op = opId(oi);
            for (int k = 0; k < network.needCount(oi); k++)
                sb.append("  ").append(dataId(network.need(oi, k))).append(" --> ").append(op).append(";\n");
            for (int k = 0; k < network.provideCount(oi); k++)
                sb.append("  ").append(op).append(" --> ").append(dataId(network.provide(oi, k))).append(";\n");
        }

        // 4. Plan styling
        if (plan != null) {
            sb.append("  classDef input fill:#d4edda;\n");
            sb.append("  classDef output fill:#cce5ff;\n");
            sb.append("  classDef pruned opacity:0.4;\n");
            for (String in : plan.requiredInputs())
                if (network.hasData(in))
                    sb.append("  class ").append(dataId(network.dataIndex(in))).append(" input;\n");
            for (String out : plan.providedOutputs())
                if (network.hasData(out) && !plan.requiredInputs().contains(out))
                    sb.append("  class ").append(dataId(network.dataIndex(out))).append(" output;\n");
            for (int oi = 0; oi < network.operationCount(); oi++)
                if (stepOf[oi] < 0)
                    sb.append("  class ").append(opId(oi)).append(" pruned;\n");
        }
        return sb.toString();
    }

    /**
     * Generates a Graphviz DOT digraph with the same shape conventions as
     * {@link #toMermaid()}.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("digraph network {\n");
        sb.append("  rankdir=TB;\n");
        Set<String> inputs = plan != null ? plan.requiredInputs() : Set.of();
        Set<String> outputs = plan != null ? plan.providedOutputs() : Set.of();

        for (int di = 0; di < network.dataCount(); di++) {
            String name = network.dataName(di);
            sb.append("  ").append(dataId(di)).append(" [label=\"").append(escape(name)).append("\", shape=ellipse");
            if (inputs.contains(name))
                sb.append(", style=filled, fillcolor=\"#d4edda\"");
            else if (outputs.contains(name))
                sb.append(", style=filled, fillcolor=\"#cce5ff\"");
            sb.append("];\n");
        }
        for (int oi = 0; oi < network.operationCount(); oi++) {
            String name = network.operationName(oi);
            String label = stepOf[oi] >= 0 ? stepOf[oi] + ". " + name : name;
            sb.append("  ").append(opId(oi)).append(" [label=\"").append(escape(label)).append("\", shape=box");
            if (plan != null && stepOf[oi] < 0)
                sb.append(", style=dashed");
            sb.append("];\n");
        }
        for (int oi = 0; oi < network.operationCount(); oi++) {
            String op = opId(oi);
            for (int k = 0; k < network.needCount(oi); k++)
                sb.append("  ").append(dataId(network.need(oi, k))).append(" -> ").append(op).append(";\n");
            for (int k = 0; k < network.provideCount(oi); k++)
                sb.append("  ").append(op).append(" -> ").append(dataId(network.provide(oi, k))).append(";\n");
        }
        return sb.append("}\n").toString();
    }

    // Node ids come from the arena indices; names only ever appear in labels.
    private static String opId(int oi) {
        return "op_" + oi;
    }

    private static String dataId(int di) {
        return "data_" + di;
    }

    private static String mermaidLabel(String s) {
        return s.replace("\"", "#quot;");
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
