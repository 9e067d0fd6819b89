package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.Objects;

/** Root step naming a declared semantic type, as in {@code Color.Red}. */
public final class AccessAlias extends QualifiedAccess {
    private final Type type;

    public AccessAlias(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "alias[" + type.getFullName() + "]." + getChildAccess();
    }
}
