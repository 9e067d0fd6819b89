package com.libsl.loader.semantic;

import com.libsl.asg.Action;
import com.libsl.asg.AliasCycleException;
import com.libsl.asg.Annotation;
import com.libsl.asg.Assignment;
import com.libsl.asg.Automaton;
import com.libsl.asg.Contract;
import com.libsl.asg.ContractKind;
import com.libsl.asg.Function;
import com.libsl.asg.FunctionArgument;
import com.libsl.asg.GlobalVariableDeclaration;
import com.libsl.asg.SemanticException;
import com.libsl.asg.Shift;
import com.libsl.asg.State;
import com.libsl.asg.TypeAnnotation;
import com.libsl.asg.Variable;
import com.libsl.asg.type.EnumLikeSemanticType;
import com.libsl.asg.type.SimpleType;
import com.libsl.asg.type.StructuredType;
import com.libsl.asg.type.Type;
import com.libsl.asg.type.TypeAlias;
import com.libsl.loader.ast.ActionNode;
import com.libsl.loader.ast.AnnotationNode;
import com.libsl.loader.ast.ArgumentNode;
import com.libsl.loader.ast.AssignmentNode;
import com.libsl.loader.ast.AutomatonNode;
import com.libsl.loader.ast.ContractNode;
import com.libsl.loader.ast.EnumLikeTypeNode;
import com.libsl.loader.ast.ExpressionNode;
import com.libsl.loader.ast.FieldNode;
import com.libsl.loader.ast.FunctionNode;
import com.libsl.loader.ast.FunctionReferenceNode;
import com.libsl.loader.ast.ShiftNode;
import com.libsl.loader.ast.SimpleTypeNode;
import com.libsl.loader.ast.SourceLocation;
import com.libsl.loader.ast.StatementNode;
import com.libsl.loader.ast.StructTypeNode;
import com.libsl.loader.ast.TypeAliasNode;
import com.libsl.loader.ast.TypeDeclarationNode;
import com.libsl.loader.ast.TypeReferenceNode;
import com.libsl.loader.ast.VariableNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Second pass: binds every reference created by {@link SymbolTableBuilder}. A failure is recorded against the
 * declaration that contains it and resolution continues with the next declaration.
 */
final class ReferenceResolver {
    private static final Logger LOGGER = Logger.getLogger(ReferenceResolver.class.getName());
    static final String ANY_STATE = "any";
    static final String SELF_STATE = "self";

    private final AnalyzerState state;

    ReferenceResolver(AnalyzerState state) {
        this.state = state;
    }

    void resolve() {
        state.typeDeclarations.forEach(this::bindType);
        checkAliasCycles();
        state.functions.forEach(this::bindAutomaton);
        state.functions.forEach(this::resolveAnnotations);
        state.automata.forEach(this::resolveShifts);
        state.automata.forEach(this::resolveVariableInitializers);
        state.functions.forEach(this::resolveBody);
        state.globals.forEach(this::resolveGlobal);
        LOGGER.fine(() -> "Resolved references of " + state.library.getMetadata().getName());
    }

    private void bindType(TypeDeclarationNode node, Type type) {
        try {
            if (node instanceof SimpleTypeNode simple) {
                ((SimpleType) type).bindRealType(state.types.realType(simple.getRealType()));
            } else if (node instanceof EnumLikeTypeNode enumLike) {
                ((EnumLikeSemanticType) type).bindType(state.types.realType(enumLike.getRealType()));
            } else if (node instanceof TypeAliasNode alias) {
                ((TypeAlias) type).bindOriginalType(state.types.anyType(alias.getOriginalType()));
            } else if (node instanceof StructTypeNode struct) {
                bindStructure(struct, (StructuredType) type);
            }
        } catch (SemanticException ex) {
            state.error("type " + node.getName(), node.getLocation(), ex);
        }
    }

    private void bindStructure(StructTypeNode node, StructuredType type) {
        Type realType =
                node.getRealType() != null
                        ? state.types.realType(node.getRealType())
                        : state.types.realType(List.of(node.getName()));
        Type generic = node.getGeneric() == null ? null : state.types.anyType(node.getGeneric());
        List<StructuredType.Field> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (FieldNode field : node.getFields()) {
            if (!names.add(field.getName())) {
                throw new ResolutionException("duplicate field '" + field.getName() + "'", field.getLocation());
            }
            fields.add(new StructuredType.Field(field.getName(), state.types.declaredType(field.getType(), true)));
        }
        type.bind(realType, generic, fields);
    }

    private void checkAliasCycles() {
        state.typeDeclarations.forEach(
                (node, type) -> {
                    if (type instanceof TypeAlias alias && alias.getOriginalType() != null) {
                        try {
                            alias.resolveOriginal();
                        } catch (AliasCycleException ex) {
                            state.error("typealias " + alias.getName(), node.getLocation(), ex);
                        } catch (IllegalStateException ex) {
                            // An alias in the chain failed to bind; that failure is already reported.
                            LOGGER.fine(() -> "Skipping cycle check of " + alias.getName() + ": " + ex.getMessage());
                        }
                    }
                });
    }

    private void bindAutomaton(FunctionNode node, Function function) {
        try {
            Automaton automaton = function.resolveAutomaton();
            if (!function.hasTarget()) {
                function.bindTarget(automaton);
            }
        } catch (SemanticException ex) {
            state.error("function " + node.getAutomatonName() + "." + node.getName(), node.getLocation(), ex);
        }
    }

    // Annotation arguments see globals and types only.
    private void resolveAnnotations(FunctionNode node, Function function) {
        try {
            if (node.getReturnAnnotation() != null) {
                TypeAnnotation annotation = function.getTypeAnnotation();
                for (ExpressionNode value : node.getReturnAnnotation().getValues()) {
                    annotation.addValue(state.expressions.resolve(value, ResolutionScope.global()));
                }
            }
            List<ArgumentNode> arguments = node.getArguments();
            for (int i = 0; i < arguments.size(); i++) {
                AnnotationNode annotationNode = arguments.get(i).getAnnotation();
                if (annotationNode == null) {
                    continue;
                }
                Annotation annotation = function.getArgs().get(i).getAnnotation();
                for (ExpressionNode value : annotationNode.getValues()) {
                    annotation.addValue(state.expressions.resolve(value, ResolutionScope.global()));
                }
            }
        } catch (SemanticException ex) {
            state.error("function " + node.getAutomatonName() + "." + node.getName(), node.getLocation(), ex);
        }
    }

    private void resolveShifts(AutomatonNode node, Automaton automaton) {
        for (ShiftNode shift : node.getShifts()) {
            String context =
                    "automaton " + automaton.getName() + ", shift " + String.join(", ", shift.getSources()) + " -> "
                            + shift.getTarget();
            State to;
            List<Function> functions;
            try {
                to = SELF_STATE.equals(shift.getTarget())
                        ? automaton.getSelfState()
                        : state(automaton, shift.getTarget(), shift.getLocation());
                functions = guards(automaton, shift.getFunctions());
            } catch (SemanticException ex) {
                state.error(context, shift.getLocation(), ex);
                continue;
            }
            // One edge per source state.
            for (String source : shift.getSources()) {
                try {
                    State from = ANY_STATE.equals(source)
                            ? automaton.getAnyState()
                            : state(automaton, source, shift.getLocation());
                    automaton.addShift(new Shift(from, to, functions));
                } catch (SemanticException ex) {
                    state.error(context, shift.getLocation(), ex);
                }
            }
        }
    }

    private static State state(Automaton automaton, String name, SourceLocation location) {
        return automaton.findState(name)
                .orElseThrow(() -> new ResolutionException("unresolved state '" + name + "'", location));
    }

    /** A guard without a signature matches every overload with that name. */
    private List<Function> guards(Automaton automaton, List<FunctionReferenceNode> references) {
        List<Function> guards = new ArrayList<>();
        for (FunctionReferenceNode reference : references) {
            List<String> signature = null;
            if (reference.hasSignature()) {
                signature = new ArrayList<>();
                for (TypeReferenceNode type : reference.getArgumentTypes()) {
                    signature.add(state.types.declaredType(type, true).getFullName());
                }
            }
            boolean matched = false;
            for (Function function : automaton.getFunctions()) {
                if (function.getName().equals(reference.getName())
                        && (signature == null || signature.equals(argumentTypes(function)))) {
                    guards.add(function);
                    matched = true;
                }
            }
            if (!matched) {
                String name = reference.getName() + (signature == null ? "" : "(" + String.join(", ", signature) + ")");
                throw new ResolutionException("unresolved function '" + name + "'", reference.getLocation());
            }
        }
        return guards;
    }

    static List<String> argumentTypes(Function function) {
        List<String> types = new ArrayList<>();
        for (FunctionArgument argument : function.getArgs()) {
            types.add(argument.getType().getFullName());
        }
        return types;
    }

    private void resolveVariableInitializers(AutomatonNode node, Automaton automaton) {
        List<VariableNode> variables = new ArrayList<>(node.getConstructorVariables());
        variables.addAll(node.getVariables());
        ResolutionScope scope = ResolutionScope.automaton(automaton);
        for (VariableNode variableNode : variables) {
            Variable variable = state.automatonVariables.get(variableNode);
            if (variable == null || variableNode.getInitValue() == null) {
                continue;
            }
            try {
                variable.setInitValue(state.expressions.resolve(variableNode.getInitValue(), scope));
            } catch (SemanticException ex) {
                state.error("variable " + variable.getFullName(), variableNode.getLocation(), ex);
            }
        }
    }

    private void resolveBody(FunctionNode node, Function function) {
        if (!function.isAutomatonResolved()) {
            return;
        }
        try {
            ResolutionScope scope = ResolutionScope.function(function);
            for (ContractNode contract : node.getContracts()) {
                ResolutionScope contractScope =
                        contract.getKind() == ContractKind.ENSURES ? ResolutionScope.postCondition(function) : scope;
                function.addContract(
                        new Contract(
                                contract.getName(),
                                state.expressions.resolve(contract.getExpression(), contractScope),
                                contract.getKind()));
            }
            for (StatementNode statement : node.getStatements()) {
                if (statement instanceof AssignmentNode assignment) {
                    function.addStatement(
                            new Assignment(
                                    state.expressions.resolveAccess(assignment.getTarget(), scope),
                                    state.expressions.resolve(assignment.getValue(), scope)));
                } else {
                    ActionNode action = (ActionNode) statement;
                    function.addStatement(
                            new Action(action.getName(), state.expressions.resolveAll(action.getArguments(), scope)));
                }
            }
        } catch (SemanticException ex) {
            state.error("function " + function.getQualifiedName(), node.getLocation(), ex);
        }
    }

    private void resolveGlobal(VariableNode node, GlobalVariableDeclaration global) {
        if (node.getInitValue() == null) {
            return;
        }
        try {
            global.setInitValue(state.expressions.resolve(node.getInitValue(), ResolutionScope.global()));
        } catch (SemanticException ex) {
            state.error("global " + global.getName(), node.getLocation(), ex);
        }
    }
}
