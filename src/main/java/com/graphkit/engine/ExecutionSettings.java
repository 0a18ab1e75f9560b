package com.graphkit.engine;

import com.graphkit.api.ExecutionListener;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Configuration for plan execution.
 *
 * <pre>
 * ExecutionSettings settings = ExecutionSettings.builder()
 *         .method(ExecutionMethod.PARALLEL)
 *         .parallelism(4)
 *         .build();
 * </pre>
 */
@Getter
@Builder
@ToString
public final class ExecutionSettings {

    @Builder.Default
    private final ExecutionMethod method = ExecutionMethod.SEQUENTIAL;

    // --- worker pool (PARALLEL only) ---
    @Builder.Default
    private final int parallelism = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    private final String threadNamePrefix = "graphkit-worker";

    // --- observability ---
    private final ExecutionListener listener;

    public static ExecutionSettings defaults() {
        return builder().build();
    }
}
