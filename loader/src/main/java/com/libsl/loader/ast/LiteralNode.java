package com.libsl.loader.ast;

import java.util.Objects;

/** Integer, float, string or boolean literal; the value is boxed as {@link Integer}, {@link Float}, etc. */
public final class LiteralNode implements ExpressionNode {
    private final SourceLocation location;
    private final Object value;

    public LiteralNode(SourceLocation location, Object value) {
        this.location = Objects.requireNonNull(location, "location");
        if (!(value instanceof Integer
                || value instanceof Float
                || value instanceof String
                || value instanceof Boolean)) {
            throw new IllegalArgumentException("unsupported literal value: " + value);
        }
        this.value = value;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public Object getValue() {
        return value;
    }
}
