package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.List;
import java.util.Objects;

/**
 * {@code type Name<Generic> is real.Type { field: Type; }}. Fields are bound after every declared type has a shell,
 * so a structure may refer to itself or to types declared later in the file.
 */
public final class StructuredType implements Type {
    private final String name;
    private final LslContext context;
    private Type type;
    private Type generic;
    private List<Field> entries = List.of();
    private boolean bound;

    public StructuredType(String name, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = Objects.requireNonNull(context, "context");
    }

    public void bind(Type type, Type generic, List<Field> entries) {
        if (bound) {
            throw new IllegalStateException("structure " + name + " is already bound");
        }
        this.type = Objects.requireNonNull(type, "type");
        this.generic = generic;
        this.entries = List.copyOf(entries);
        this.bound = true;
    }

    /** The real type this structure describes. */
    public Type getType() {
        return type;
    }

    public List<Field> getEntries() {
        return entries;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isPointer() {
        return false;
    }

    @Override
    public Type getGeneric() {
        return generic;
    }

    @Override
    public LslContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "StructuredType(" + name + ", " + entries + ")";
    }

    public static final class Field {
        private final String name;
        private final Type type;

        public Field(String name, Type type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        public String getName() {
            return name;
        }

        public Type getType() {
            return type;
        }

        @Override
        public String toString() {
            return name + ": " + type.getFullName();
        }
    }
}
