package com.libsl.asg;

import java.util.Objects;

/** A name that does not denote any declaration of the expected kind. */
public final class UnresolvedReferenceException extends SemanticException {
    private final String kind;
    private final String name;

    public UnresolvedReferenceException(String kind, String name) {
        super("unresolved " + kind + " '" + name + "'");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
