package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** {@code Name(RealType) { ENTRY: value; }} inside a {@code types} section. */
public final class EnumLikeTypeNode extends TypeDeclarationNode {
    private final TypeReferenceNode realType;
    private final List<EnumEntryNode> entries;

    public EnumLikeTypeNode(
            SourceLocation location,
            String name,
            TypeReferenceNode realType,
            List<EnumEntryNode> entries) {
        super(location, name);
        this.realType = Objects.requireNonNull(realType, "realType");
        this.entries = List.copyOf(entries);
    }

    public TypeReferenceNode getRealType() {
        return realType;
    }

    public List<EnumEntryNode> getEntries() {
        return entries;
    }
}
