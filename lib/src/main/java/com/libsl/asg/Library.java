package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the semantic graph of one compiled unit. Declarations are added while the graph is being built; every
 * {@code add} method keeps the library and its {@link LslContext} in step and answers {@code false} for a duplicate
 * name, which is then left out of both.
 */
public final class Library extends Node {
    private final MetaNode metadata;
    private final List<String> imports;
    private final List<String> includes;
    private final LslContext context;
    private final List<Type> semanticTypes = new ArrayList<>();
    private final List<Automaton> automata = new ArrayList<>();
    private final Map<String, List<Function>> extensionFunctions = new LinkedHashMap<>();
    private final Map<String, GlobalVariableDeclaration> globalVariables = new LinkedHashMap<>();

    public Library(MetaNode metadata, List<String> imports, List<String> includes, LslContext context) {
        this.metadata = adopt(Objects.requireNonNull(metadata, "metadata"));
        this.imports = List.copyOf(imports);
        this.includes = List.copyOf(includes);
        this.context = Objects.requireNonNull(context, "context");
    }

    public MetaNode getMetadata() {
        return metadata;
    }

    public List<String> getImports() {
        return imports;
    }

    public List<String> getIncludes() {
        return includes;
    }

    public LslContext getContext() {
        return context;
    }

    public boolean addSemanticType(Type type) {
        if (!context.registerType(type)) {
            return false;
        }
        semanticTypes.add(type);
        return true;
    }

    public List<Type> getSemanticTypes() {
        return Collections.unmodifiableList(semanticTypes);
    }

    public boolean addAutomaton(Automaton automaton) {
        if (!context.registerAutomaton(automaton)) {
            return false;
        }
        automata.add(adopt(automaton));
        return true;
    }

    public List<Automaton> getAutomata() {
        return Collections.unmodifiableList(automata);
    }

    /** Registers a function declared as {@code Automaton.name} outside the automaton body. */
    public void addExtensionFunction(Function function) {
        extensionFunctions
                .computeIfAbsent(function.getAutomatonName(), key -> new ArrayList<>())
                .add(adopt(function));
    }

    public Map<String, List<Function>> getExtensionFunctions() {
        return Collections.unmodifiableMap(extensionFunctions);
    }

    public List<Function> getExtensionFunctions(String automatonName) {
        List<Function> functions = extensionFunctions.get(automatonName);
        return functions == null ? List.of() : Collections.unmodifiableList(functions);
    }

    public boolean addGlobalVariable(GlobalVariableDeclaration variable) {
        if (!context.registerGlobalVariable(variable)) {
            return false;
        }
        globalVariables.put(variable.getName(), adopt(variable));
        return true;
    }

    public Map<String, GlobalVariableDeclaration> getGlobalVariables() {
        return Collections.unmodifiableMap(globalVariables);
    }
}
