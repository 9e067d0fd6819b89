package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.Objects;

/** Access to a named variable, or to a named field when it follows another step. */
public final class VariableAccess extends QualifiedAccess {
    private final String fieldName;
    private final Type type;
    private final Variable variable;

    public VariableAccess(String fieldName, Type type, Variable variable) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.type = Objects.requireNonNull(type, "type");
        this.variable = variable;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public Type getType() {
        return type;
    }

    /** Resolved variable for a root step; {@code null} for a field step. */
    public Variable getVariable() {
        return variable;
    }

    @Override
    public String toString() {
        return fieldName + (getChildAccess() == null ? "" : "." + getChildAccess());
    }
}
