package com.libsl.asg;

import java.util.Objects;

/** Constructor variable paired with the expression a constructor call initialises it with. */
public final class ArgumentWithValue {
    private final Variable variable;
    private final Expression init;

    public ArgumentWithValue(Variable variable, Expression init) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.init = Objects.requireNonNull(init, "init");
    }

    public Variable getVariable() {
        return variable;
    }

    public Expression getInit() {
        return init;
    }

    @Override
    public String toString() {
        return variable.getName() + " = " + init;
    }
}
