package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Function of an automaton, either declared in its body or attached from outside as an extension. The owning
 * automaton is referenced by name and linked by {@link #resolveAutomaton()} once every automaton is registered.
 */
public final class Function extends Node {
    private final String name;
    private final String automatonName;
    private final Type returnType;
    private final boolean hasBody;
    private final LslContext context;
    private final List<FunctionArgument> args = new ArrayList<>();
    private final List<Contract> contracts = new ArrayList<>();
    private final List<Statement> statements = new ArrayList<>();
    private TypeAnnotation typeAnnotation;
    private Automaton automaton;
    private Automaton target;
    private ResultVariable resultVariable;

    public Function(String name, String automatonName, Type returnType, boolean hasBody, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.automatonName = Objects.requireNonNull(automatonName, "automatonName");
        this.returnType = returnType;
        this.hasBody = hasBody;
        this.context = Objects.requireNonNull(context, "context");
    }

    public String getName() {
        return name;
    }

    public String getAutomatonName() {
        return automatonName;
    }

    /** Declared return type, or {@code null}. */
    public Type getReturnType() {
        return returnType;
    }

    /** {@code false} for a declaration that only names a required operation. */
    public boolean hasBody() {
        return hasBody;
    }

    public LslContext getContext() {
        return context;
    }

    public void addArgument(FunctionArgument argument) {
        args.add(adopt(argument));
    }

    public List<FunctionArgument> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public void addContract(Contract contract) {
        contracts.add(adopt(contract));
    }

    public List<Contract> getContracts() {
        return Collections.unmodifiableList(contracts);
    }

    public void addStatement(Statement statement) {
        statements.add(adopt(statement));
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public TypeAnnotation getTypeAnnotation() {
        return typeAnnotation;
    }

    public void setTypeAnnotation(TypeAnnotation typeAnnotation) {
        this.typeAnnotation = adopt(typeAnnotation);
    }

    /**
     * Links the owning automaton by looking its name up in the context.
     *
     * @throws UnresolvedReferenceException if no automaton has that name
     */
    public Automaton resolveAutomaton() {
        if (automaton == null) {
            automaton =
                    context.resolveAutomaton(automatonName)
                            .orElseThrow(() -> new UnresolvedReferenceException("automaton", automatonName));
        }
        return automaton;
    }

    public boolean isAutomatonResolved() {
        return automaton != null;
    }

    public Automaton getAutomaton() {
        if (automaton == null) {
            throw new IllegalStateException("automaton of function " + name + " is not resolved yet");
        }
        return automaton;
    }

    public String getQualifiedName() {
        return getAutomaton().getName() + "." + name;
    }

    /** Automaton the function effectively acts on; its own automaton unless redirected by {@code @target}. */
    public Automaton getTarget() {
        if (target == null) {
            throw new IllegalStateException("target of function " + name + " is not resolved yet");
        }
        return target;
    }

    public boolean hasTarget() {
        return target != null;
    }

    public void bindTarget(Automaton target) {
        if (this.target != null && this.target != target) {
            throw new IllegalStateException("target of function " + name + " is already bound");
        }
        this.target = Objects.requireNonNull(target, "target");
    }

    public ResultVariable getResultVariable() {
        return resultVariable;
    }

    public void setResultVariable(ResultVariable resultVariable) {
        this.resultVariable = adopt(resultVariable);
    }

    @Override
    public String toString() {
        return "Function(" + automatonName + "." + name + ")";
    }
}
