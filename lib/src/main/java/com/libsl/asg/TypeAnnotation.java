package com.libsl.asg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Annotation written on a function's return type. */
public final class TypeAnnotation extends Node {
    private final String name;
    private final List<Expression> values;

    public TypeAnnotation(String name, List<Expression> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = new ArrayList<>();
        values.forEach(this::addValue);
    }

    /** Annotation whose argument values are added once they are resolved. */
    public TypeAnnotation(String name) {
        this(name, List.of());
    }

    public void addValue(Expression value) {
        values.add(adopt(Objects.requireNonNull(value, "value")));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getValues() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() {
        return "TypeAnnotation(name='" + name + "', values=" + values + ")";
    }
}
