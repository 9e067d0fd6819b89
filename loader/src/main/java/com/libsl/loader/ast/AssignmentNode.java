package com.libsl.loader.ast;

import java.util.Objects;

public final class AssignmentNode implements StatementNode {
    private final SourceLocation location;
    private final AccessNode target;
    private final ExpressionNode value;

    public AssignmentNode(SourceLocation location, AccessNode target, ExpressionNode value) {
        this.location = Objects.requireNonNull(location, "location");
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public AccessNode getTarget() {
        return target;
    }

    public ExpressionNode getValue() {
        return value;
    }
}
