package com.libsl.loader.ast;

import com.libsl.asg.StateKind;
import java.util.Objects;

public final class StateNode {
    private final SourceLocation location;
    private final String name;
    private final StateKind kind;

    public StateNode(SourceLocation location, String name, StateKind kind) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public StateKind getKind() {
        return kind;
    }
}
