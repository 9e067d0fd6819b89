package com.libsl.loader.ast;

import java.util.Objects;

public final class TypeAliasNode extends TypeDeclarationNode {
    private final TypeReferenceNode originalType;

    public TypeAliasNode(SourceLocation location, String name, TypeReferenceNode originalType) {
        super(location, name);
        this.originalType = Objects.requireNonNull(originalType, "originalType");
    }

    public TypeReferenceNode getOriginalType() {
        return originalType;
    }
}
