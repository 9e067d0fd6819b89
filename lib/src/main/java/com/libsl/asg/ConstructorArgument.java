package com.libsl.asg;

import com.libsl.asg.type.Type;

/** Constructor parameter of an automaton; its initializer, if any, is the default used by constructor calls. */
public final class ConstructorArgument extends Variable {
    public ConstructorArgument(String name, Type type) {
        super(name, type);
    }

    public Automaton getAutomaton() {
        if (getParent() instanceof Automaton automaton) {
            return automaton;
        }
        throw new IllegalStateException("constructor variable " + getName() + " is not attached to an automaton");
    }

    @Override
    public String getFullName() {
        return getAutomaton().getName() + "." + getName();
    }
}
