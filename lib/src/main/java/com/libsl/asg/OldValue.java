package com.libsl.asg;

import java.util.Objects;

/** Value of an access at function entry; meaningful in post-conditions. */
public final class OldValue extends Expression {
    private final QualifiedAccess value;

    public OldValue(QualifiedAccess value) {
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public QualifiedAccess getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "old(" + value + ")";
    }
}
