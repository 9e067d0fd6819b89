package com.libsl.asg;

import com.libsl.asg.type.Type;

/** Synthetic {@code result} of a function with a return type. */
public final class ResultVariable extends Variable {
    public static final String NAME = "result";

    public ResultVariable(Type type) {
        super(NAME, type);
    }
}
