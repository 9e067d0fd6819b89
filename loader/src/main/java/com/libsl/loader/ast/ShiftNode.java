package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** {@code shift (s1, s2) -> s3 (f, g(Int));} */
public final class ShiftNode {
    private final SourceLocation location;
    private final List<String> sources;
    private final String target;
    private final List<FunctionReferenceNode> functions;

    public ShiftNode(
            SourceLocation location,
            List<String> sources,
            String target,
            List<FunctionReferenceNode> functions) {
        this.location = Objects.requireNonNull(location, "location");
        this.sources = List.copyOf(sources);
        this.target = Objects.requireNonNull(target, "target");
        this.functions = List.copyOf(functions);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<String> getSources() {
        return sources;
    }

    public String getTarget() {
        return target;
    }

    public List<FunctionReferenceNode> getFunctions() {
        return functions;
    }
}
