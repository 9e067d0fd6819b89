package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** {@code new Automaton(name = value, ...)} with arguments still unresolved. */
public final class ConstructorCallNode implements ExpressionNode {
    private final SourceLocation location;
    private final String automatonName;
    private final List<NamedArgumentNode> arguments;

    public ConstructorCallNode(SourceLocation location, String automatonName, List<NamedArgumentNode> arguments) {
        this.location = Objects.requireNonNull(location, "location");
        this.automatonName = Objects.requireNonNull(automatonName, "automatonName");
        this.arguments = List.copyOf(arguments);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getAutomatonName() {
        return automatonName;
    }

    public List<NamedArgumentNode> getArguments() {
        return arguments;
    }
}
