package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.Objects;

/** Root step {@code Automaton(arg)}: the automaton instance passed as function argument {@code arg}. */
public final class AutomatonGetter extends QualifiedAccess {
    private final Automaton automaton;
    private final FunctionArgument arg;

    public AutomatonGetter(Automaton automaton, FunctionArgument arg) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.arg = Objects.requireNonNull(arg, "arg");
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public FunctionArgument getArg() {
        return arg;
    }

    @Override
    public Type getType() {
        return automaton.getType();
    }

    @Override
    public String toString() {
        return automaton.getName() + "(" + arg.getName() + ")." + getChildAccess();
    }
}
