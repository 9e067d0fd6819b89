package com.libsl.loader.ast;

import java.util.Objects;

public final class OldValueNode implements ExpressionNode {
    private final SourceLocation location;
    private final AccessNode access;

    public OldValueNode(SourceLocation location, AccessNode access) {
        this.location = Objects.requireNonNull(location, "location");
        this.access = Objects.requireNonNull(access, "access");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public AccessNode getAccess() {
        return access;
    }
}
