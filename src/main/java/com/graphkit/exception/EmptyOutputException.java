package com.graphkit.exception;

/** An operation passed to compose declares no outputs. */
public class EmptyOutputException extends GraphKitException {
    private final String operationName;

    public EmptyOutputException(String operationName) {
        super("Operation '" + operationName + "' provides no outputs");
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }
}
