package com.libsl.asg;

/** Base class for failures raised while linking or querying the semantic graph. */
public class SemanticException extends RuntimeException {
    public SemanticException(String message) {
        super(message);
    }

    public SemanticException(String message, Throwable cause) {
        super(message, cause);
    }
}
