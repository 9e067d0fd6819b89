package com.libsl.loader.ast;

import com.libsl.asg.ArithmeticBinaryOps;
import java.util.Objects;

public final class BinaryExpressionNode implements ExpressionNode {
    private final SourceLocation location;
    private final ArithmeticBinaryOps op;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinaryExpressionNode(
            SourceLocation location,
            ArithmeticBinaryOps op,
            ExpressionNode left,
            ExpressionNode right) {
        this.location = Objects.requireNonNull(location, "location");
        this.op = Objects.requireNonNull(op, "op");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public ArithmeticBinaryOps getOp() {
        return op;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }
}
