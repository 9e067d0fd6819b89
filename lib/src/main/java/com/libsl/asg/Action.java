package com.libsl.asg;

import java.util.List;
import java.util.Objects;

/** Semantic action {@code action NAME(args);} interpreted by downstream consumers. */
public final class Action extends Statement {
    private final String name;
    private final List<Expression> arguments;

    public Action(String name, List<Expression> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
        this.arguments.forEach(this::adopt);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return "action " + name + arguments;
    }
}
