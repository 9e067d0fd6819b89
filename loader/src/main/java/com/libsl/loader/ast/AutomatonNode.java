package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

public final class AutomatonNode implements DeclarationNode {
    private final SourceLocation location;
    private final String name;
    private final TypeReferenceNode type;
    private final List<VariableNode> constructorVariables;
    private final List<StateNode> states;
    private final List<ShiftNode> shifts;
    private final List<VariableNode> variables;
    private final List<FunctionNode> functions;

    public AutomatonNode(
            SourceLocation location,
            String name,
            TypeReferenceNode type,
            List<VariableNode> constructorVariables,
            List<StateNode> states,
            List<ShiftNode> shifts,
            List<VariableNode> variables,
            List<FunctionNode> functions) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.constructorVariables = List.copyOf(constructorVariables);
        this.states = List.copyOf(states);
        this.shifts = List.copyOf(shifts);
        this.variables = List.copyOf(variables);
        this.functions = List.copyOf(functions);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public TypeReferenceNode getType() {
        return type;
    }

    public List<VariableNode> getConstructorVariables() {
        return constructorVariables;
    }

    public List<StateNode> getStates() {
        return states;
    }

    public List<ShiftNode> getShifts() {
        return shifts;
    }

    public List<VariableNode> getVariables() {
        return variables;
    }

    public List<FunctionNode> getFunctions() {
        return functions;
    }
}
