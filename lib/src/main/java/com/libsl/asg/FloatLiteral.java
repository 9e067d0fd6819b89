package com.libsl.asg;

public final class FloatLiteral extends Atomic {
    private final float value;

    public FloatLiteral(float value) {
        this.value = value;
    }

    @Override
    public Float getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
