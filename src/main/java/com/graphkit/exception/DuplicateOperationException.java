package com.graphkit.exception;

/** Two operations passed to compose share the same name. */
public class DuplicateOperationException extends GraphKitException {
    private final String operationName;

    public DuplicateOperationException(String operationName) {
        super("Duplicate operation name: " + operationName);
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }
}
