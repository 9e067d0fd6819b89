package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed state machine describing the valid call sequences of one library component. The {@code functions} and
 * {@code variables} views are computed on every call; in particular the extension functions are read from the owning
 * {@link Library} at that moment and never copied into the automaton.
 */
public final class Automaton extends Node {
    private final String name;
    private final Type type;
    private final List<State> states = new ArrayList<>();
    private final List<Shift> shifts = new ArrayList<>();
    private final List<AutomatonVariableDeclaration> internalVariables = new ArrayList<>();
    private final List<ConstructorArgument> constructorVariables = new ArrayList<>();
    private final List<Function> localFunctions = new ArrayList<>();
    private State anyState;
    private State selfState;

    public Automaton(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public void addState(State state) {
        states.add(adopt(state));
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    public Optional<State> findState(String stateName) {
        return states.stream().filter(state -> state.getName().equals(stateName)).findFirst();
    }

    /** Wildcard source used by {@code shift any -> ...}; not listed in {@link #getStates()}. */
    public State getAnyState() {
        if (anyState == null) {
            anyState = adopt(new State("any", StateKind.SIMPLE, false, true));
        }
        return anyState;
    }

    /** Self target used by {@code shift ... -> self}; not listed in {@link #getStates()}. */
    public State getSelfState() {
        if (selfState == null) {
            selfState = adopt(new State("self", StateKind.SIMPLE, true, false));
        }
        return selfState;
    }

    public void addShift(Shift shift) {
        shifts.add(adopt(shift));
    }

    public List<Shift> getShifts() {
        return Collections.unmodifiableList(shifts);
    }

    public void addInternalVariable(AutomatonVariableDeclaration variable) {
        internalVariables.add(adopt(variable));
    }

    public List<AutomatonVariableDeclaration> getInternalVariables() {
        return Collections.unmodifiableList(internalVariables);
    }

    public void addConstructorVariable(ConstructorArgument variable) {
        constructorVariables.add(adopt(variable));
    }

    public List<ConstructorArgument> getConstructorVariables() {
        return Collections.unmodifiableList(constructorVariables);
    }

    public void addLocalFunction(Function function) {
        localFunctions.add(adopt(function));
    }

    public List<Function> getLocalFunctions() {
        return Collections.unmodifiableList(localFunctions);
    }

    /** Local functions followed by the extension functions registered for this automaton's name. */
    public List<Function> getFunctions() {
        List<Function> functions = new ArrayList<>(localFunctions);
        if (getParent() instanceof Library library) {
            functions.addAll(library.getExtensionFunctions(name));
        }
        return functions;
    }

    /** Internal variables followed by constructor variables. */
    public List<Variable> getVariables() {
        List<Variable> variables = new ArrayList<>(internalVariables);
        variables.addAll(constructorVariables);
        return variables;
    }

    public Optional<Variable> findVariable(String variableName) {
        return getVariables().stream().filter(variable -> variable.getName().equals(variableName)).findFirst();
    }

    @Override
    public String toString() {
        return "Automaton(" + name + ": " + type.getFullName() + ")";
    }
}
