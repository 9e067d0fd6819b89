package com.libsl.asg;

/** Expression that denotes a value directly. */
public abstract sealed class Atomic extends Expression
        permits IntegerLiteral,
                FloatLiteral,
                StringLiteral,
                BoolLiteral,
                QualifiedAccess,
                CallAutomatonConstructor {

    /** Literal value, or {@code null} for non-literal atomics. */
    public abstract Object getValue();
}
