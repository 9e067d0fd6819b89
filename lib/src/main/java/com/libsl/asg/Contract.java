package com.libsl.asg;

import java.util.Locale;
import java.util.Objects;

/** Pre- or post-condition of a function. Post-conditions may refer to entry values through {@link OldValue}. */
public final class Contract extends Node {
    private final String name;
    private final Expression expression;
    private final ContractKind kind;

    public Contract(String name, Expression expression, ContractKind kind) {
        this.name = name;
        this.expression = adopt(Objects.requireNonNull(expression, "expression"));
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /** Optional label, {@code null} when the contract is anonymous. */
    public String getName() {
        return name;
    }

    public Expression getExpression() {
        return expression;
    }

    public ContractKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + (name == null ? "" : " " + name + ":") + " " + expression;
    }
}
