package com.libsl.asg;

import java.util.Objects;

public final class UnaryOpExpression extends Expression {
    private final Expression value;
    private final ArithmeticUnaryOp op;

    public UnaryOpExpression(Expression value, ArithmeticUnaryOp op) {
        this.value = adopt(Objects.requireNonNull(value, "value"));
        this.op = Objects.requireNonNull(op, "op");
    }

    public Expression getValue() {
        return value;
    }

    public ArithmeticUnaryOp getOp() {
        return op;
    }

    @Override
    public String toString() {
        return op.getSymbol() + value;
    }
}
