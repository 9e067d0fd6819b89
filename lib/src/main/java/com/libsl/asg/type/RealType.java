package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.List;
import java.util.Objects;

/** Physical type of the described library, e.g. {@code std.Int32} or {@code java.util.List<Int>}. */
public final class RealType implements Type {
    private final List<String> nameParts;
    private final boolean pointer;
    private final Type generic;
    private final LslContext context;

    public RealType(List<String> nameParts, boolean pointer, Type generic, LslContext context) {
        if (nameParts.isEmpty()) {
            throw new IllegalArgumentException("real type needs at least one name part");
        }
        this.nameParts = List.copyOf(nameParts);
        this.pointer = pointer;
        this.generic = generic;
        this.context = Objects.requireNonNull(context, "context");
    }

    public List<String> getNameParts() {
        return nameParts;
    }

    @Override
    public String getName() {
        return String.join(".", nameParts);
    }

    @Override
    public boolean isPointer() {
        return pointer;
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
        return (pointer ? "*" : "") + getName() + "<" + (generic == null ? null : generic.getFullName()) + ">";
    }
}
