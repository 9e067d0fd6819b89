package com.libsl.asg;

import java.util.Objects;

public final class StringLiteral extends Atomic {
    private final String value;

    public StringLiteral(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
