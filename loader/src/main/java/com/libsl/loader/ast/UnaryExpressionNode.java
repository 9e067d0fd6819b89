package com.libsl.loader.ast;

import com.libsl.asg.ArithmeticUnaryOp;
import java.util.Objects;

public final class UnaryExpressionNode implements ExpressionNode {
    private final SourceLocation location;
    private final ArithmeticUnaryOp op;
    private final ExpressionNode value;

    public UnaryExpressionNode(SourceLocation location, ArithmeticUnaryOp op, ExpressionNode value) {
        this.location = Objects.requireNonNull(location, "location");
        this.op = Objects.requireNonNull(op, "op");
        this.value = Objects.requireNonNull(value, "value");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public ArithmeticUnaryOp getOp() {
        return op;
    }

    public ExpressionNode getValue() {
        return value;
    }
}
