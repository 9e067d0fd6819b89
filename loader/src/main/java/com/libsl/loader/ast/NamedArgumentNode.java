package com.libsl.loader.ast;

import java.util.Objects;

public final class NamedArgumentNode {
    private final SourceLocation location;
    private final String name;
    private final ExpressionNode value;

    public NamedArgumentNode(SourceLocation location, String name, ExpressionNode value) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public ExpressionNode getValue() {
        return value;
    }
}
