package com.libsl.asg;

import com.libsl.asg.type.RealType;
import java.util.Objects;

/** Access naming a real type as a whole, e.g. {@code java.lang.Integer}. Never has a child. */
public final class RealTypeAccess extends QualifiedAccess {
    private final RealType type;

    public RealTypeAccess(RealType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public RealType getType() {
        return type;
    }

    @Override
    public void setChildAccess(QualifiedAccess childAccess) {
        throw new UnsupportedOperationException("a real type access has no child");
    }

    @Override
    public String toString() {
        return type.getName();
    }
}
