package com.libsl.asg;

import java.util.Objects;

public final class BinaryOpExpression extends Expression {
    private final Expression left;
    private final Expression right;
    private final ArithmeticBinaryOps op;

    public BinaryOpExpression(Expression left, Expression right, ArithmeticBinaryOps op) {
        this.left = adopt(Objects.requireNonNull(left, "left"));
        this.right = adopt(Objects.requireNonNull(right, "right"));
        this.op = Objects.requireNonNull(op, "op");
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public ArithmeticBinaryOps getOp() {
        return op;
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.getSymbol() + " " + right + ")";
    }
}
