package com.libsl.asg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Annotation extends Node {
    private final String name;
    private final List<Expression> values;

    public Annotation(String name, List<Expression> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = new ArrayList<>();
        values.forEach(this::addValue);
    }

    /** Annotation whose argument values are added once they are resolved. */
    public Annotation(String name) {
        this(name, List.of());
    }

    public final void addValue(Expression value) {
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
        return "Annotation(name='" + name + "', values=" + values + ")";
    }
}
