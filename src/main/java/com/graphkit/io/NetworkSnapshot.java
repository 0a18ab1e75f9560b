package com.graphkit.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a network's structure and, optionally, of a plan
 * compiled from it. Values are never part of a snapshot.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NetworkSnapshot {
    private List<OperationDef> operations;
    private List<DataDef> data;
    private PlanDef plan;

    /** One operation, in declaration order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class OperationDef {
        private String name, type;
        private List<String> needs, provides;
        private Map<String, String> params;
    }

    /** One data node with the operations writing and reading it. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DataDef {
        private String name;
        private List<String> producers, consumers;
    }

    /** Step order and boundary names of a compiled plan. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PlanDef {
        private List<String> steps;
        private List<List<Integer>> dependencies;
        private List<String> requiredInputs, providedOutputs;
    }
}
