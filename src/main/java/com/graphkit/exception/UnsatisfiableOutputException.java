package com.graphkit.exception;

import java.util.List;

/** Requested outputs cannot be produced from the requested inputs. */
public class UnsatisfiableOutputException extends GraphKitException {
    private final List<String> unreachable;

    public UnsatisfiableOutputException(List<String> unreachable) {
        super("Unreachable outputs " + unreachable + " for the given inputs");
        this.unreachable = List.copyOf(unreachable);
    }

    /** The requested output names that failed, in request order. */
    public List<String> unreachable() {
        return unreachable;
    }
}
