package com.libsl.asg;

import com.libsl.asg.type.Type;

public final class AutomatonVariableDeclaration extends Variable {
    public AutomatonVariableDeclaration(String name, Type type) {
        super(name, type);
    }

    public Automaton getAutomaton() {
        if (getParent() instanceof Automaton automaton) {
            return automaton;
        }
        throw new IllegalStateException("variable " + getName() + " is not attached to an automaton");
    }

    @Override
    public String getFullName() {
        return getAutomaton().getName() + "." + getName();
    }
}
