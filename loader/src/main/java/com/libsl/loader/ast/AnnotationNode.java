package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

public final class AnnotationNode {
    private final SourceLocation location;
    private final String name;
    private final List<ExpressionNode> values;

    public AnnotationNode(SourceLocation location, String name, List<ExpressionNode> values) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.values = List.copyOf(values);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public List<ExpressionNode> getValues() {
        return values;
    }
}
