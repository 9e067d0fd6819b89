package com.libsl.loader.ast;

import java.util.Objects;

public final class FieldNode {
    private final SourceLocation location;
    private final String name;
    private final TypeReferenceNode type;

    public FieldNode(SourceLocation location, String name, TypeReferenceNode type) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public TypeReferenceNode getType() {
        return type;
    }
}
