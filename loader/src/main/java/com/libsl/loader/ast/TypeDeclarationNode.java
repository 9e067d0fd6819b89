package com.libsl.loader.ast;

import java.util.Objects;

public sealed abstract class TypeDeclarationNode implements DeclarationNode
        permits SimpleTypeNode, EnumLikeTypeNode, TypeAliasNode, StructTypeNode, EnumTypeNode {

    private final SourceLocation location;
    private final String name;

    protected TypeDeclarationNode(SourceLocation location, String name) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getName() {
        return name;
    }
}
