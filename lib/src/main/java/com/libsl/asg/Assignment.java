package com.libsl.asg;

import java.util.Objects;

public final class Assignment extends Statement {
    private final QualifiedAccess left;
    private final Expression value;

    public Assignment(QualifiedAccess left, Expression value) {
        this.left = adopt(Objects.requireNonNull(left, "left"));
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public QualifiedAccess getLeft() {
        return left;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return left + " = " + value;
    }
}
