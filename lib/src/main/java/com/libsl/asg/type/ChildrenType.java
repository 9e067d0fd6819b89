package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.Objects;

/** Value space of an enum or enum-like semantic type, named after its parent. */
public final class ChildrenType implements Type {
    private final String name;
    private final LslContext context;

    public ChildrenType(String name, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isPointer() {
        return false;
    }

    @Override
    public Type getGeneric() {
        return null;
    }

    @Override
    public LslContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "ChildrenType(" + name + ")";
    }
}
