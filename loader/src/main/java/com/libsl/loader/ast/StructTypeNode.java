package com.libsl.loader.ast;

import java.util.List;

public final class StructTypeNode extends TypeDeclarationNode {
    private final TypeReferenceNode generic;
    private final TypeReferenceNode realType;
    private final List<FieldNode> fields;

    public StructTypeNode(
            SourceLocation location,
            String name,
            TypeReferenceNode generic,
            TypeReferenceNode realType,
            List<FieldNode> fields) {
        super(location, name);
        this.generic = generic;
        this.realType = realType;
        this.fields = List.copyOf(fields);
    }

    public TypeReferenceNode getGeneric() {
        return generic;
    }

    public TypeReferenceNode getRealType() {
        return realType;
    }

    public List<FieldNode> getFields() {
        return fields;
    }
}
