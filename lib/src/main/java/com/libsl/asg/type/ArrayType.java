package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.Objects;

/** {@code array<Element>}; the generic parameter is the element type. */
public final class ArrayType implements Type {
    private final String name;
    private final boolean pointer;
    private final Type generic;
    private final LslContext context;

    public ArrayType(String name, boolean pointer, Type generic, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.pointer = pointer;
        this.generic = Objects.requireNonNull(generic, "generic");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isPointer() {
        return pointer;
    }

    @Override
    public Type getGeneric() {
        return generic;
    }

    @Override
    public LslContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return getFullName() + "<" + generic.getFullName() + ">";
    }
}
