package com.libsl.loader.semantic;

import com.libsl.asg.ArgumentWithValue;
import com.libsl.asg.Atomic;
import com.libsl.asg.Automaton;
import com.libsl.asg.BinaryOpExpression;
import com.libsl.asg.BoolLiteral;
import com.libsl.asg.CallAutomatonConstructor;
import com.libsl.asg.ConstructorArgument;
import com.libsl.asg.Expression;
import com.libsl.asg.FloatLiteral;
import com.libsl.asg.IntegerLiteral;
import com.libsl.asg.LslContext;
import com.libsl.asg.OldValue;
import com.libsl.asg.QualifiedAccess;
import com.libsl.asg.State;
import com.libsl.asg.StringLiteral;
import com.libsl.asg.UnaryOpExpression;
import com.libsl.loader.ast.AccessNode;
import com.libsl.loader.ast.BinaryExpressionNode;
import com.libsl.loader.ast.ConstructorCallNode;
import com.libsl.loader.ast.ExpressionNode;
import com.libsl.loader.ast.LiteralNode;
import com.libsl.loader.ast.NamedArgumentNode;
import com.libsl.loader.ast.OldValueNode;
import com.libsl.loader.ast.UnaryExpressionNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Resolves syntax expressions into expressions of the semantic graph. Each call builds fresh nodes. */
final class ExpressionResolver {
    static final String STATE_ARGUMENT = "state";

    private final LslContext context;
    private final QualifiedAccessResolver accesses;

    ExpressionResolver(LslContext context) {
        this.context = context;
        this.accesses = new QualifiedAccessResolver(context, this);
    }

    Expression resolve(ExpressionNode expression, ResolutionScope scope) {
        if (expression instanceof BinaryExpressionNode binary) {
            return new BinaryOpExpression(
                    resolve(binary.getLeft(), scope), resolve(binary.getRight(), scope), binary.getOp());
        }
        if (expression instanceof UnaryExpressionNode unary) {
            return new UnaryOpExpression(resolve(unary.getValue(), scope), unary.getOp());
        }
        if (expression instanceof LiteralNode literal) {
            return literal(literal);
        }
        if (expression instanceof AccessNode access) {
            return accesses.resolve(access, scope);
        }
        if (expression instanceof OldValueNode old) {
            if (!scope.isOldAllowed()) {
                throw new ResolutionException(
                        "old(" + old.getAccess() + ") is only allowed in ensures clauses", old.getLocation());
            }
            return new OldValue(accesses.resolve(old.getAccess(), scope));
        }
        return constructorCall((ConstructorCallNode) expression, scope);
    }

    QualifiedAccess resolveAccess(AccessNode access, ResolutionScope scope) {
        return accesses.resolve(access, scope);
    }

    List<Expression> resolveAll(List<ExpressionNode> expressions, ResolutionScope scope) {
        List<Expression> resolved = new ArrayList<>(expressions.size());
        for (ExpressionNode expression : expressions) {
            resolved.add(resolve(expression, scope));
        }
        return resolved;
    }

    static Atomic literal(LiteralNode literal) {
        Object value = literal.getValue();
        if (value instanceof Integer integer) {
            return new IntegerLiteral(integer);
        }
        if (value instanceof Float floatValue) {
            return new FloatLiteral(floatValue);
        }
        if (value instanceof String string) {
            return new StringLiteral(string);
        }
        return new BoolLiteral((Boolean) value);
    }

    /**
     * {@code new B(state = s, v = expr)}: {@code state} picks the initial state, every other name must be a
     * constructor variable of B.
     */
    private CallAutomatonConstructor constructorCall(ConstructorCallNode call, ResolutionScope scope) {
        Automaton automaton =
                context.resolveAutomaton(call.getAutomatonName())
                        .orElseThrow(
                                () ->
                                        new ResolutionException(
                                                "unresolved automaton '" + call.getAutomatonName() + "'",
                                                call.getLocation()));
        State state = null;
        List<ArgumentWithValue> arguments = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (NamedArgumentNode argument : call.getArguments()) {
            if (!seen.add(argument.getName())) {
                throw new ResolutionException(
                        "duplicate argument '" + argument.getName() + "' in constructor of '" + automaton.getName() + "'",
                        argument.getLocation());
            }
            if (argument.getName().equals(STATE_ARGUMENT)) {
                state = state(automaton, argument);
                continue;
            }
            ConstructorArgument variable =
                    automaton.getConstructorVariables().stream()
                            .filter(candidate -> candidate.getName().equals(argument.getName()))
                            .findFirst()
                            .orElseThrow(
                                    () ->
                                            new ResolutionException(
                                                    "unresolved argument '"
                                                            + argument.getName()
                                                            + "' in constructor of '"
                                                            + automaton.getName()
                                                            + "'",
                                                    argument.getLocation()));
            arguments.add(new ArgumentWithValue(variable, resolve(argument.getValue(), scope)));
        }
        if (state == null) {
            throw new ResolutionException(
                    "constructor of '" + automaton.getName() + "' requires a 'state' argument", call.getLocation());
        }
        return new CallAutomatonConstructor(automaton, arguments, state);
    }

    private static State state(Automaton automaton, NamedArgumentNode argument) {
        if (!(argument.getValue() instanceof AccessNode access) || !access.isSimpleName()) {
            throw new ResolutionException("state argument must name a state", argument.getValue().getLocation());
        }
        return automaton.findState(access.getHead())
                .orElseThrow(
                        () ->
                                new ResolutionException(
                                        "unresolved state '"
                                                + access.getHead()
                                                + "' in automaton '"
                                                + automaton.getName()
                                                + "'",
                                        access.getLocation()));
    }
}
