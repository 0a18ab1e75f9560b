package com.graphkit.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An operation body failed, or broke its output contract, during execute.
 *
 * Besides the operation name and cause, the exception carries a diagnostics
 * map salvaged from the failing step ({@code operation}, {@code needs},
 * {@code provides}, {@code inputs}) so deep graphs can be debugged without a
 * debugger session.
 */
public class OperationExecutionException extends GraphKitException {
    private final String operationName;
    private final Map<String, Object> diagnostics;

    public OperationExecutionException(String operationName, Throwable cause, Map<String, Object> diagnostics) {
        super("Operation '" + operationName + "' failed: " + describe(cause), cause);
        this.operationName = operationName;
        this.diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public String operationName() {
        return operationName;
    }

    public Map<String, Object> diagnostics() {
        return diagnostics;
    }

    private static String describe(Throwable cause) {
        if (cause == null)
            return "unknown cause";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
