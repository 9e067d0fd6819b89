package com.libsl.loader.semantic;

import com.libsl.asg.SemanticException;
import com.libsl.loader.ast.SourceLocation;

/** Name or type that could not be resolved, reported at the syntax node that mentioned it. */
public final class ResolutionException extends SemanticException {
    private final SourceLocation location;

    public ResolutionException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public ResolutionException(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
