package com.libsl.asg;

import com.libsl.asg.type.Type;

/**
 * One step of a dotted or indexed access such as {@code a.b[0].c}. Steps form a forward chain from the root step to
 * the last one; every step owns the next one and carries the type its value has.
 */
public abstract sealed class QualifiedAccess extends Atomic
        permits VariableAccess, AccessAlias, RealTypeAccess, ArrayAccess, AutomatonGetter {

    private QualifiedAccess childAccess;

    public abstract Type getType();

    public QualifiedAccess getChildAccess() {
        return childAccess;
    }

    public void setChildAccess(QualifiedAccess childAccess) {
        this.childAccess = adopt(childAccess);
    }

    /** Terminal step of the chain; the step itself when it has no child. */
    public QualifiedAccess getLastChild() {
        QualifiedAccess current = this;
        while (current.childAccess != null) {
            current = current.childAccess;
        }
        return current;
    }

    @Override
    public Object getValue() {
        return null;
    }

    @Override
    public String toString() {
        return (childAccess == null ? "" : childAccess.toString()) + ":" + getType().getFullName();
    }
}
