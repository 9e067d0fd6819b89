package com.libsl.loader.ast;

import com.libsl.asg.ContractKind;
import java.util.Objects;

public final class ContractNode {
    private final SourceLocation location;
    private final String name;
    private final ContractKind kind;
    private final ExpressionNode expression;

    public ContractNode(SourceLocation location, String name, ContractKind kind, ExpressionNode expression) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public ContractKind getKind() {
        return kind;
    }

    public ExpressionNode getExpression() {
        return expression;
    }
}
