package com.libsl.asg;

import java.util.Objects;

public final class State extends Node {
    private final String name;
    private final StateKind kind;
    private final boolean self;
    private final boolean any;

    public State(String name, StateKind kind) {
        this(name, kind, false, false);
    }

    public State(String name, StateKind kind, boolean self, boolean any) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.self = self;
        this.any = any;
    }

    public String getName() {
        return name;
    }

    public StateKind getKind() {
        return kind;
    }

    /** Target marker meaning "stay in the source state". */
    public boolean isSelf() {
        return self;
    }

    /** Source marker meaning "from every state". */
    public boolean isAny() {
        return any;
    }

    public Automaton getAutomaton() {
        if (getParent() instanceof Automaton automaton) {
            return automaton;
        }
        throw new IllegalStateException("state " + name + " is not attached to an automaton");
    }

    @Override
    public String toString() {
        return "State(" + name + ", " + kind + ")";
    }
}
