package com.libsl.loader.semantic;

import com.libsl.asg.Annotation;
import com.libsl.asg.Automaton;
import com.libsl.asg.AutomatonVariableDeclaration;
import com.libsl.asg.ConstructorArgument;
import com.libsl.asg.Function;
import com.libsl.asg.FunctionArgument;
import com.libsl.asg.GlobalVariableDeclaration;
import com.libsl.asg.Library;
import com.libsl.asg.MetaNode;
import com.libsl.asg.ResultVariable;
import com.libsl.asg.SemanticException;
import com.libsl.asg.State;
import com.libsl.asg.TargetAnnotation;
import com.libsl.asg.TypeAnnotation;
import com.libsl.asg.Variable;
import com.libsl.asg.type.EnumEntry;
import com.libsl.asg.type.EnumLikeSemanticType;
import com.libsl.asg.type.EnumType;
import com.libsl.asg.type.SimpleType;
import com.libsl.asg.type.StructuredType;
import com.libsl.asg.type.Type;
import com.libsl.asg.type.TypeAlias;
import com.libsl.loader.ast.AnnotationNode;
import com.libsl.loader.ast.ArgumentNode;
import com.libsl.loader.ast.AutomatonNode;
import com.libsl.loader.ast.DeclarationNode;
import com.libsl.loader.ast.EnumEntryNode;
import com.libsl.loader.ast.EnumLikeTypeNode;
import com.libsl.loader.ast.EnumTypeNode;
import com.libsl.loader.ast.FunctionNode;
import com.libsl.loader.ast.HeaderNode;
import com.libsl.loader.ast.LibraryNode;
import com.libsl.loader.ast.SimpleTypeNode;
import com.libsl.loader.ast.StateNode;
import com.libsl.loader.ast.StructTypeNode;
import com.libsl.loader.ast.TypeAliasNode;
import com.libsl.loader.ast.TypeDeclarationNode;
import com.libsl.loader.ast.VariableNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * First pass: creates every named entity of the library so that the second pass can resolve references in any
 * order. Types are created as unbound shells; automata get their states, variables and function signatures.
 * Annotations are created empty; their arguments are resolved by {@link ReferenceResolver}.
 */
final class SymbolTableBuilder {
    private static final Logger LOGGER = Logger.getLogger(SymbolTableBuilder.class.getName());

    private final AnalyzerState state;

    SymbolTableBuilder(AnalyzerState state) {
        this.state = state;
    }

    void build(LibraryNode node) {
        HeaderNode header = node.getHeader();
        MetaNode metadata =
                new MetaNode(
                        header.getName(),
                        header.getLibraryVersion(),
                        header.getLanguage(),
                        header.getUrl(),
                        header.getLslVersion());
        state.library = new Library(metadata, node.getImports(), node.getIncludes(), state.context);

        List<AutomatonNode> automata = new ArrayList<>();
        List<VariableNode> globals = new ArrayList<>();
        List<FunctionNode> extensions = new ArrayList<>();
        for (DeclarationNode declaration : node.getDeclarations()) {
            if (declaration instanceof TypeDeclarationNode type) {
                declareType(type);
            } else if (declaration instanceof AutomatonNode automaton) {
                automata.add(automaton);
            } else if (declaration instanceof VariableNode global) {
                globals.add(global);
            } else if (declaration instanceof FunctionNode function) {
                extensions.add(function);
            }
        }
        automata.forEach(this::declareAutomaton);
        globals.forEach(this::declareGlobal);
        state.automata.forEach(this::declareMembers);
        for (FunctionNode extension : extensions) {
            Function function = declareFunction(extension);
            if (function != null) {
                state.library.addExtensionFunction(function);
            }
        }
        LOGGER.fine(
                () ->
                        "Declared "
                                + state.typeDeclarations.size()
                                + " types, "
                                + state.automata.size()
                                + " automata, "
                                + state.functions.size()
                                + " functions in "
                                + header.getName());
    }

    private void declareType(TypeDeclarationNode node) {
        Type type;
        if (node instanceof SimpleTypeNode simple) {
            type = new SimpleType(simple.getName(), simple.getRealType().isPointer(), state.context);
        } else if (node instanceof EnumLikeTypeNode enumLike) {
            type = new EnumLikeSemanticType(enumLike.getName(), entries(enumLike.getEntries()), state.context);
        } else if (node instanceof TypeAliasNode) {
            type = new TypeAlias(node.getName(), state.context);
        } else if (node instanceof StructTypeNode) {
            type = new StructuredType(node.getName(), state.context);
        } else {
            type = new EnumType(node.getName(), entries(((EnumTypeNode) node).getEntries()), state.context);
        }
        if (!state.library.addSemanticType(type)) {
            state.error(node.getLocation(), "duplicate type '" + node.getName() + "'");
            return;
        }
        state.typeDeclarations.put(node, type);
    }

    private static List<EnumEntry> entries(List<EnumEntryNode> nodes) {
        List<EnumEntry> entries = new ArrayList<>(nodes.size());
        for (EnumEntryNode node : nodes) {
            entries.add(new EnumEntry(node.getName(), ExpressionResolver.literal(node.getValue())));
        }
        return entries;
    }

    private void declareAutomaton(AutomatonNode node) {
        Type type;
        try {
            type = state.types.declaredType(node.getType());
        } catch (SemanticException ex) {
            state.error("automaton " + node.getName(), node.getLocation(), ex);
            return;
        }
        Automaton automaton = new Automaton(node.getName(), type);
        if (!state.library.addAutomaton(automaton)) {
            state.error(node.getLocation(), "duplicate automaton '" + node.getName() + "'");
            return;
        }
        state.automata.put(node, automaton);
    }

    private void declareGlobal(VariableNode node) {
        Type type;
        try {
            type = state.types.declaredType(node.getType(), true);
        } catch (SemanticException ex) {
            state.error("global " + node.getName(), node.getLocation(), ex);
            return;
        }
        GlobalVariableDeclaration global = new GlobalVariableDeclaration(node.getName(), type);
        if (!state.library.addGlobalVariable(global)) {
            state.error(node.getLocation(), "duplicate global variable '" + node.getName() + "'");
            return;
        }
        state.globals.put(node, global);
    }

    private void declareMembers(AutomatonNode node, Automaton automaton) {
        for (StateNode stateNode : node.getStates()) {
            if (automaton.findState(stateNode.getName()).isPresent()) {
                state.error(
                        stateNode.getLocation(),
                        "automaton " + automaton.getName() + ": duplicate state '" + stateNode.getName() + "'");
                continue;
            }
            automaton.addState(new State(stateNode.getName(), stateNode.getKind()));
        }
        for (VariableNode variable : node.getConstructorVariables()) {
            declareVariable(automaton, variable, true);
        }
        for (VariableNode variable : node.getVariables()) {
            declareVariable(automaton, variable, false);
        }
        for (FunctionNode functionNode : node.getFunctions()) {
            Function function = declareFunction(functionNode);
            if (function != null) {
                automaton.addLocalFunction(function);
            }
        }
    }

    private void declareVariable(Automaton automaton, VariableNode node, boolean constructor) {
        String context = "variable " + automaton.getName() + "." + node.getName();
        if (automaton.findVariable(node.getName()).isPresent()) {
            state.error(node.getLocation(), context + ": duplicate variable '" + node.getName() + "'");
            return;
        }
        Type type;
        try {
            type = state.types.declaredType(node.getType(), true);
        } catch (SemanticException ex) {
            state.error(context, node.getLocation(), ex);
            return;
        }
        Variable variable;
        if (constructor) {
            ConstructorArgument argument = new ConstructorArgument(node.getName(), type);
            automaton.addConstructorVariable(argument);
            variable = argument;
        } else {
            AutomatonVariableDeclaration declaration = new AutomatonVariableDeclaration(node.getName(), type);
            automaton.addInternalVariable(declaration);
            variable = declaration;
        }
        state.automatonVariables.put(node, variable);
    }

    /** Signature of a function; {@code null} when it cannot be resolved (the error is recorded). */
    private Function declareFunction(FunctionNode node) {
        try {
            Function function = signature(node);
            state.functions.put(node, function);
            return function;
        } catch (SemanticException ex) {
            state.error("function " + node.getAutomatonName() + "." + node.getName(), node.getLocation(), ex);
            return null;
        }
    }

    private Function signature(FunctionNode node) {
        Type returnType = node.getReturnType() == null ? null : state.types.declaredType(node.getReturnType(), true);
        Function function =
                new Function(node.getName(), node.getAutomatonName(), returnType, node.hasBody(), state.context);
        if (node.getReturnAnnotation() != null) {
            AnnotationNode annotation = node.getReturnAnnotation();
            function.setTypeAnnotation(new TypeAnnotation(annotation.getName()));
        }

        Set<String> names = new HashSet<>();
        boolean targetSeen = false;
        int index = 0;
        for (ArgumentNode argument : node.getArguments()) {
            if (!names.add(argument.getName())) {
                throw new ResolutionException(
                        "duplicate argument '" + argument.getName() + "'", argument.getLocation());
            }
            AnnotationNode annotationNode = argument.getAnnotation();
            Annotation annotation = null;
            Type type;
            if (annotationNode != null && annotationNode.getName().equals(TargetAnnotation.NAME)) {
                if (targetSeen) {
                    throw new ResolutionException("more than one @target argument", annotationNode.getLocation());
                }
                targetSeen = true;
                Automaton target =
                        state.types.automaton(argument.getType())
                                .orElseThrow(
                                        () ->
                                                new ResolutionException(
                                                        "@target argument '"
                                                                + argument.getName()
                                                                + "' must name an automaton, not '"
                                                                + argument.getType()
                                                                + "'",
                                                        argument.getLocation()));
                annotation = new TargetAnnotation(annotationNode.getName(), target);
                function.bindTarget(target);
                type = target.getType();
            } else {
                if (annotationNode != null) {
                    annotation = new Annotation(annotationNode.getName());
                }
                type = state.types.declaredType(argument.getType(), true);
            }
            function.addArgument(new FunctionArgument(argument.getName(), type, index++, annotation));
        }
        if (returnType != null) {
            function.setResultVariable(new ResultVariable(returnType));
        }
        return function;
    }
}
