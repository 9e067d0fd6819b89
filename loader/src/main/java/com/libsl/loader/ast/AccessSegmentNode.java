package com.libsl.loader.ast;

import java.util.Objects;

/** Either {@code .field} or {@code [index]}. */
public final class AccessSegmentNode {
    private final SourceLocation location;
    private final String fieldName;
    private final ExpressionNode index;

    private AccessSegmentNode(SourceLocation location, String fieldName, ExpressionNode index) {
        this.location = Objects.requireNonNull(location, "location");
        this.fieldName = fieldName;
        this.index = index;
    }

    public static AccessSegmentNode field(SourceLocation location, String fieldName) {
        return new AccessSegmentNode(location, Objects.requireNonNull(fieldName, "fieldName"), null);
    }

    public static AccessSegmentNode index(SourceLocation location, ExpressionNode index) {
        return new AccessSegmentNode(location, null, Objects.requireNonNull(index, "index"));
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isIndex() {
        return index != null;
    }

    public String getFieldName() {
        return fieldName;
    }

    public ExpressionNode getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return isIndex() ? "[...]" : "." + fieldName;
    }
}
