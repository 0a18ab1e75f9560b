package com.graphkit.exception;

import java.util.List;

/** The values passed to execute do not cover the plan's required inputs. */
public class MissingInputException extends GraphKitException {
    private final List<String> missing;

    public MissingInputException(List<String> missing) {
        super("Missing required inputs: " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
