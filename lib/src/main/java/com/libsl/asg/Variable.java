package com.libsl.asg;

import com.libsl.asg.type.Type;
import java.util.Objects;

/** Named, typed storage visible to expressions. */
public abstract sealed class Variable extends Expression
        permits GlobalVariableDeclaration,
                AutomatonVariableDeclaration,
                FunctionArgument,
                ResultVariable,
                ConstructorArgument {

    private final String name;
    private final Type type;
    private Expression initValue;

    protected Variable(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    /** Declared initializer, or {@code null}. */
    public Expression getInitValue() {
        return initValue;
    }

    public void setInitValue(Expression initValue) {
        this.initValue = adopt(initValue);
    }

    /** Name qualified by the declaring scope, used to tell apart same-named variables. */
    public String getFullName() {
        return name;
    }

    @Override
    public String toString() {
        return getFullName() + ": " + type.getFullName();
    }
}
