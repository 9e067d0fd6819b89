package com.libsl.asg;

import com.libsl.asg.type.Type;

public final class FunctionArgument extends Variable {
    private final int index;
    private final Annotation annotation;

    public FunctionArgument(String name, Type type, int index, Annotation annotation) {
        super(name, type);
        this.index = index;
        this.annotation = adopt(annotation);
    }

    /** Zero-based position in the argument list. */
    public int getIndex() {
        return index;
    }

    public Annotation getAnnotation() {
        return annotation;
    }

    public Function getFunction() {
        if (getParent() instanceof Function function) {
            return function;
        }
        throw new IllegalStateException("argument " + getName() + " is not attached to a function");
    }

    @Override
    public String getFullName() {
        return getFunction().getName() + "." + getName();
    }
}
