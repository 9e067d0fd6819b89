package com.libsl.asg;

import java.util.List;
import java.util.Objects;

/** {@code @target} on an argument: the function acts on the automaton passed in that argument. */
public final class TargetAnnotation extends Annotation {
    public static final String NAME = "target";

    private final Automaton targetAutomaton;

    public TargetAnnotation(String name, List<Expression> values, Automaton targetAutomaton) {
        super(name, values);
        this.targetAutomaton = Objects.requireNonNull(targetAutomaton, "targetAutomaton");
    }

    public TargetAnnotation(String name, Automaton targetAutomaton) {
        this(name, List.of(), targetAutomaton);
    }

    public Automaton getTargetAutomaton() {
        return targetAutomaton;
    }

    @Override
    public String toString() {
        return "TargetAnnotation(name='" + getName() + "', values=" + getValues() + ", target="
                + targetAutomaton.getName() + ")";
    }
}
