package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.Objects;

/** {@code [index]} step; its type is the element type of the indexed array. */
public final class ArrayAccess extends QualifiedAccess {
    private final Type type;
    private Expression index;

    public ArrayAccess(Expression index, Type type) {
        this.type = Objects.requireNonNull(type, "type");
        this.index = adopt(index);
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = adopt(index);
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.getFullName() + "[" + index + "]" + (getChildAccess() == null ? "" : "." + getChildAccess());
    }
}
