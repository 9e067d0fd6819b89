package com.libsl.asg;

public final class IntegerLiteral extends Atomic {
    private final int value;

    public IntegerLiteral(int value) {
        this.value = value;
    }

    @Override
    public Integer getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
