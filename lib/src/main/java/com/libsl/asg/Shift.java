package com.libsl.asg;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Transition {@code from -> to}, triggered by a call of any of its guard functions. */
public final class Shift extends Node {
    private final State from;
    private final State to;
    private final List<Function> functions;

    public Shift(State from, State to, List<Function> functions) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.functions = List.copyOf(functions);
    }

    public State getFrom() {
        return from;
    }

    public State getTo() {
        return to;
    }

    public List<Function> getFunctions() {
        return functions;
    }

    @Override
    public String toString() {
        return from.getName()
                + " -> "
                + to.getName()
                + functions.stream().map(Function::getName).collect(Collectors.joining(", ", " (", ")"));
    }
}
