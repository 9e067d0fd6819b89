package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

public final class ActionNode implements StatementNode {
    private final SourceLocation location;
    private final String name;
    private final List<ExpressionNode> arguments;

    public ActionNode(SourceLocation location, String name, List<ExpressionNode> arguments) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public List<ExpressionNode> getArguments() {
        return arguments;
    }
}
