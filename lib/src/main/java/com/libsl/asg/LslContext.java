package com.libsl.asg;

import com.libsl.asg.type.RealType;
import com.libsl.asg.type.Type;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name-resolution context shared by every node of one library. Registration keeps the first declaration of a name
 * and reports later ones through the return value; lookups never fall back to a default.
 */
public final class LslContext {
    private final Map<String, Type> types = new LinkedHashMap<>();
    private final Map<String, Automaton> automata = new LinkedHashMap<>();
    private final Map<String, GlobalVariableDeclaration> globalVariables = new LinkedHashMap<>();
    private final Map<String, RealType> realTypes = new LinkedHashMap<>();

    public boolean registerType(Type type) {
        return types.putIfAbsent(type.getName(), type) == null;
    }

    public Optional<Type> resolveType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public Collection<Type> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    public boolean registerAutomaton(Automaton automaton) {
        return automata.putIfAbsent(automaton.getName(), automaton) == null;
    }

    public Optional<Automaton> resolveAutomaton(String name) {
        return Optional.ofNullable(automata.get(name));
    }

    public boolean registerGlobalVariable(GlobalVariableDeclaration variable) {
        return globalVariables.putIfAbsent(variable.getName(), variable) == null;
    }

    public Optional<GlobalVariableDeclaration> resolveGlobalVariable(String name) {
        return Optional.ofNullable(globalVariables.get(name));
    }

    /** Records a real type mentioned by a declaration so that it can be referenced by name in expressions. */
    public void registerRealType(RealType realType) {
        realTypes.putIfAbsent(realType.getName(), realType);
    }

    public Optional<RealType> resolveRealType(String name) {
        return Optional.ofNullable(realTypes.get(name));
    }
}
