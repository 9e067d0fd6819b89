package com.libsl.loader.ast;

import java.util.Objects;

public final class ArgumentNode {
    private final SourceLocation location;
    private final String name;
    private final TypeReferenceNode type;
    private final AnnotationNode annotation;

    public ArgumentNode(SourceLocation location, String name, TypeReferenceNode type, AnnotationNode annotation) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.annotation = annotation;
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

    public AnnotationNode getAnnotation() {
        return annotation;
    }
}
