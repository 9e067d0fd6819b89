package com.libsl.asg.type;

import com.libsl.asg.Atomic;
import java.util.Objects;

public final class EnumEntry {
    private final String name;
    private final Atomic value;

    public EnumEntry(String name, Atomic value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getName() {
        return name;
    }

    public Atomic getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
