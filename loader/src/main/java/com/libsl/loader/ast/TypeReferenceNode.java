package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** Type as written: dotted name, optional pointer marker and optional generic argument. */
public final class TypeReferenceNode {
    private final SourceLocation location;
    private final List<String> nameParts;
    private final boolean pointer;
    private final TypeReferenceNode generic;

    public TypeReferenceNode(
            SourceLocation location,
            List<String> nameParts,
            boolean pointer,
            TypeReferenceNode generic) {
        this.location = Objects.requireNonNull(location, "location");
        this.nameParts = List.copyOf(nameParts);
        this.pointer = pointer;
        this.generic = generic;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<String> getNameParts() {
        return nameParts;
    }

    public boolean isPointer() {
        return pointer;
    }

    public TypeReferenceNode getGeneric() {
        return generic;
    }

    public String getName() {
        return String.join(".", nameParts);
    }

    @Override
    public String toString() {
        return (pointer ? "*" : "") + getName() + (generic == null ? "" : "<" + generic + ">");
    }
}
