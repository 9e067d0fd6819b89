package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * Function declaration. Functions written inside an automaton carry that automaton's name; extension functions
 * carry the name written before the dot.
 */
public final class FunctionNode implements DeclarationNode {
    private final SourceLocation location;
    private final String automatonName;
    private final boolean extension;
    private final String name;
    private final List<ArgumentNode> arguments;
    private final TypeReferenceNode returnType;
    private final AnnotationNode returnAnnotation;
    private final List<ContractNode> contracts;
    private final List<StatementNode> statements;
    private final boolean hasBody;

    public FunctionNode(
            SourceLocation location,
            String automatonName,
            boolean extension,
            String name,
            List<ArgumentNode> arguments,
            TypeReferenceNode returnType,
            AnnotationNode returnAnnotation,
            List<ContractNode> contracts,
            List<StatementNode> statements,
            boolean hasBody) {
        this.location = Objects.requireNonNull(location, "location");
        this.automatonName = Objects.requireNonNull(automatonName, "automatonName");
        this.extension = extension;
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
        this.returnType = returnType;
        this.returnAnnotation = returnAnnotation;
        this.contracts = List.copyOf(contracts);
        this.statements = List.copyOf(statements);
        this.hasBody = hasBody;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getAutomatonName() {
        return automatonName;
    }

    public boolean isExtension() {
        return extension;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<ArgumentNode> getArguments() {
        return arguments;
    }

    public TypeReferenceNode getReturnType() {
        return returnType;
    }

    public AnnotationNode getReturnAnnotation() {
        return returnAnnotation;
    }

    public List<ContractNode> getContracts() {
        return contracts;
    }

    public List<StatementNode> getStatements() {
        return statements;
    }

    public boolean hasBody() {
        return hasBody;
    }
}
