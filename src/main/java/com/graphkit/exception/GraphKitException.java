package com.graphkit.exception;

/**
 * Base class of every error raised by the engine.
 *
 * Unchecked so that compose, compile and execute can be chained fluently.
 * Subclasses carry the structured data (operation names, data names, cycle
 * paths) needed to pinpoint the responsible node.
 */
public class GraphKitException extends RuntimeException {

    public GraphKitException(String message) {
        super(message);
    }

    public GraphKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
