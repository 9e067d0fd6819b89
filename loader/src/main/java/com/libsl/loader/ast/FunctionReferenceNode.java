package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** Guard entry of a shift: a function name, optionally with argument types to pick one overload. */
public final class FunctionReferenceNode {
    private final SourceLocation location;
    private final String name;
    private final List<TypeReferenceNode> argumentTypes;

    public FunctionReferenceNode(SourceLocation location, String name, List<TypeReferenceNode> argumentTypes) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.argumentTypes = argumentTypes == null ? null : List.copyOf(argumentTypes);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public boolean hasSignature() {
        return argumentTypes != null;
    }

    /** Argument types written in parentheses, or {@code null} when the entry names every overload. */
    public List<TypeReferenceNode> getArgumentTypes() {
        return argumentTypes;
    }
}
