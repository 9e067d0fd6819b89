package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.Objects;

/** Semantic type declared as {@code Name(RealType);}. */
public final class SimpleType implements Type {
    private final String name;
    private final boolean pointer;
    private final LslContext context;
    private Type realType;

    public SimpleType(String name, boolean pointer, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.pointer = pointer;
        this.context = Objects.requireNonNull(context, "context");
    }

    public Type getRealType() {
        return realType;
    }

    public void bindRealType(Type realType) {
        if (this.realType != null) {
            throw new IllegalStateException("real type of " + name + " is already bound");
        }
        this.realType = Objects.requireNonNull(realType, "realType");
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
        return null;
    }

    @Override
    public LslContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "SimpleType(" + getFullName() + " -> " + (realType == null ? "?" : realType.getFullName()) + ")";
    }
}
