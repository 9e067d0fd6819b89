package com.libsl.loader.ast;

import java.util.Objects;

public final class EnumEntryNode {
    private final SourceLocation location;
    private final String name;
    private final LiteralNode value;

    public EnumEntryNode(SourceLocation location, String name, LiteralNode value) {
        this.location = Objects.requireNonNull(location, "location");
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public LiteralNode getValue() {
        return value;
    }
}
