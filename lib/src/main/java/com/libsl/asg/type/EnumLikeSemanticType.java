package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.List;
import java.util.Objects;

/** Semantic type with named values: {@code Flags(int32) { READ: 1; WRITE: 2; }}. */
public final class EnumLikeSemanticType implements Type {
    private final String name;
    private final List<EnumEntry> entries;
    private final LslContext context;
    private Type type;
    private ChildrenType childrenType;

    public EnumLikeSemanticType(String name, List<EnumEntry> entries, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.entries = List.copyOf(entries);
        this.context = Objects.requireNonNull(context, "context");
    }

    /** The real type the values are expressed in. */
    public Type getType() {
        return type;
    }

    public void bindType(Type type) {
        if (this.type != null) {
            throw new IllegalStateException("type of " + name + " is already bound");
        }
        this.type = Objects.requireNonNull(type, "type");
    }

    public List<EnumEntry> getEntries() {
        return entries;
    }

    public boolean hasEntry(String entryName) {
        return entries.stream().anyMatch(entry -> entry.getName().equals(entryName));
    }

    public ChildrenType getChildrenType() {
        if (childrenType == null) {
            childrenType = new ChildrenType(name, context);
        }
        return childrenType;
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
        return null;
    }

    @Override
    public LslContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "EnumLikeSemanticType(" + name + ", " + entries + ")";
    }
}
