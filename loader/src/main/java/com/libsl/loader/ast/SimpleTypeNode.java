package com.libsl.loader.ast;

import java.util.Objects;

/** {@code Name(RealType);} inside a {@code types} section. */
public final class SimpleTypeNode extends TypeDeclarationNode {
    private final TypeReferenceNode realType;

    public SimpleTypeNode(SourceLocation location, String name, TypeReferenceNode realType) {
        super(location, name);
        this.realType = Objects.requireNonNull(realType, "realType");
    }

    public TypeReferenceNode getRealType() {
        return realType;
    }
}
