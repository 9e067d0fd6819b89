package com.libsl.asg;

import java.util.List;
import java.util.Objects;

/** {@code new Automaton(state = s, field = expr, ...)}. */
public final class CallAutomatonConstructor extends Atomic {
    private final Automaton automaton;
    private final List<ArgumentWithValue> args;
    private final State state;

    public CallAutomatonConstructor(Automaton automaton, List<ArgumentWithValue> args, State state) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.args = List.copyOf(args);
        this.state = Objects.requireNonNull(state, "state");
        for (ArgumentWithValue arg : this.args) {
            adopt(arg.getInit());
        }
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public List<ArgumentWithValue> getArgs() {
        return args;
    }

    /** Runtime state the new instance starts in. */
    public State getState() {
        return state;
    }

    @Override
    public Object getValue() {
        return null;
    }

    @Override
    public String toString() {
        return "new " + automaton.getName() + "(state = " + state.getName() + (args.isEmpty() ? "" : ", ")
                + String.join(", ", args.stream().map(ArgumentWithValue::toString).toList()) + ")";
    }
}
