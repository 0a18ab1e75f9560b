package com.graphkit.exception;

/**
 * A step was reached before one of its needs was available.
 *
 * Plans produced by the compiler never trigger this; seeing it means an engine
 * bug, not a user error.
 */
public class InternalConsistencyException extends GraphKitException {
    private final String operationName;
    private final String missingNeed;

    public InternalConsistencyException(String operationName, String missingNeed) {
        super("Operation '" + operationName + "' scheduled before its need '" + missingNeed + "' was available");
        this.operationName = operationName;
        this.missingNeed = missingNeed;
    }

    public String operationName() {
        return operationName;
    }

    public String missingNeed() {
        return missingNeed;
    }
}
