package com.libsl.loader.semantic;

import com.libsl.asg.AccessAlias;
import com.libsl.asg.ArrayAccess;
import com.libsl.asg.Automaton;
import com.libsl.asg.AutomatonGetter;
import com.libsl.asg.Expression;
import com.libsl.asg.FunctionArgument;
import com.libsl.asg.LslContext;
import com.libsl.asg.QualifiedAccess;
import com.libsl.asg.RealTypeAccess;
import com.libsl.asg.SemanticException;
import com.libsl.asg.Variable;
import com.libsl.asg.VariableAccess;
import com.libsl.asg.type.ArrayType;
import com.libsl.asg.type.RealType;
import com.libsl.asg.type.Type;
import com.libsl.asg.type.TypeAlias;
import com.libsl.loader.ast.AccessNode;
import com.libsl.loader.ast.AccessSegmentNode;
import java.util.List;
import java.util.Optional;

/**
 * Builds typed access chains such as {@code a.b[0].c}. The head is resolved against the scope (arguments,
 * {@code result}, automaton variables, globals), then against semantic types ({@link AccessAlias}) and finally
 * against real types named by the whole dotted path ({@link RealTypeAccess}). Every following step is typed from
 * the previous one.
 */
final class QualifiedAccessResolver {
    private final LslContext context;
    private final ExpressionResolver expressions;

    QualifiedAccessResolver(LslContext context, ExpressionResolver expressions) {
        this.context = context;
        this.expressions = expressions;
    }

    QualifiedAccess resolve(AccessNode access, ResolutionScope scope) {
        List<AccessSegmentNode> segments = access.getSegments();
        QualifiedAccess root;
        int next = 0;
        if (access.isAutomatonGetter()) {
            root = automatonGetter(access, scope);
            if (!segments.isEmpty() && !segments.get(0).isIndex()) {
                AccessSegmentNode first = segments.get(0);
                Automaton automaton = ((AutomatonGetter) root).getAutomaton();
                Variable variable =
                        automaton.findVariable(first.getFieldName())
                                .orElseThrow(
                                        () ->
                                                new ResolutionException(
                                                        "unresolved variable '"
                                                                + first.getFieldName()
                                                                + "' in automaton '"
                                                                + automaton.getName()
                                                                + "'",
                                                        first.getLocation()));
                root.setChildAccess(new VariableAccess(variable.getName(), variable.getType(), variable));
                next = 1;
            }
        } else {
            Optional<QualifiedAccess> head = head(access.getHead(), scope);
            if (head.isEmpty()) {
                RealTypeAccess realTypeAccess = realTypeAccess(access);
                if (realTypeAccess != null) {
                    return realTypeAccess;
                }
                throw new ResolutionException(
                        "unresolved variable '" + access.getHead() + "'", access.getLocation());
            }
            root = head.get();
        }

        QualifiedAccess current = root.getLastChild();
        for (AccessSegmentNode segment : segments.subList(next, segments.size())) {
            QualifiedAccess step = step(current.getType(), segment, scope);
            current.setChildAccess(step);
            current = step;
        }
        return root;
    }

    private AutomatonGetter automatonGetter(AccessNode access, ResolutionScope scope) {
        Automaton automaton =
                context.resolveAutomaton(access.getHead())
                        .orElseThrow(
                                () ->
                                        new ResolutionException(
                                                "unresolved automaton '" + access.getHead() + "'",
                                                access.getLocation()));
        FunctionArgument argument =
                scope.argument(access.getGetterArgument())
                        .orElseThrow(
                                () ->
                                        new ResolutionException(
                                                "unresolved argument '" + access.getGetterArgument() + "'",
                                                access.getLocation()));
        return new AutomatonGetter(automaton, argument);
    }

    private Optional<QualifiedAccess> head(String name, ResolutionScope scope) {
        Optional<Variable> variable = scope.variable(name);
        if (variable.isEmpty()) {
            variable = context.resolveGlobalVariable(name).map(Variable.class::cast);
        }
        if (variable.isPresent()) {
            return Optional.of(new VariableAccess(name, variable.get().getType(), variable.get()));
        }
        return context.resolveType(name).map(AccessAlias::new);
    }

    /** {@code null} unless the head and all following field names spell a known real type. */
    private RealTypeAccess realTypeAccess(AccessNode access) {
        StringBuilder name = new StringBuilder(access.getHead());
        for (AccessSegmentNode segment : access.getSegments()) {
            if (segment.isIndex()) {
                return null;
            }
            name.append('.').append(segment.getFieldName());
        }
        Optional<RealType> realType = context.resolveRealType(name.toString());
        return realType.map(RealTypeAccess::new).orElse(null);
    }

    private QualifiedAccess step(Type previous, AccessSegmentNode segment, ResolutionScope scope) {
        Type owner = unwrap(previous, segment);
        if (segment.isIndex()) {
            if (!(owner instanceof ArrayType array)) {
                throw new ResolutionException(
                        "index on non-array type '" + previous.getFullName() + "'", segment.getLocation());
            }
            Expression index = expressions.resolve(segment.getIndex(), scope);
            return new ArrayAccess(index, array.getGeneric());
        }
        Type fieldType =
                owner.resolveFieldType(segment.getFieldName())
                        .orElseThrow(
                                () ->
                                        new ResolutionException(
                                                "unresolved field '"
                                                        + segment.getFieldName()
                                                        + "' in type '"
                                                        + previous.getFullName()
                                                        + "'",
                                                segment.getLocation()));
        return new VariableAccess(segment.getFieldName(), fieldType, null);
    }

    private static Type unwrap(Type type, AccessSegmentNode segment) {
        if (!(type instanceof TypeAlias alias)) {
            return type;
        }
        try {
            return alias.resolveOriginal();
        } catch (SemanticException | IllegalStateException ex) {
            throw new ResolutionException(ex.getMessage(), segment.getLocation(), ex);
        }
    }
}
