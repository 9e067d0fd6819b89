package com.libsl.loader.ast;

import java.util.Objects;

/** {@code var}/{@code val} declaration; used for globals, automaton fields and constructor parameters. */
public final class VariableNode implements DeclarationNode {
    private final SourceLocation location;
    private final String keyword;
    private final String name;
    private final TypeReferenceNode type;
    private final ExpressionNode initValue;

    public VariableNode(
            SourceLocation location,
            String keyword,
            String name,
            TypeReferenceNode type,
            ExpressionNode initValue) {
        this.location = Objects.requireNonNull(location, "location");
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.initValue = initValue;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getName() {
        return name;
    }

    public TypeReferenceNode getType() {
        return type;
    }

    public ExpressionNode getInitValue() {
        return initValue;
    }
}
