package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.List;
import java.util.Objects;

/** {@code enum Name { A = 0; B = 1; }}. */
public final class EnumType implements Type {
    private final String name;
    private final List<EnumEntry> entries;
    private final LslContext context;
    private ChildrenType childrenType;

    public EnumType(String name, List<EnumEntry> entries, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.entries = List.copyOf(entries);
        this.context = Objects.requireNonNull(context, "context");
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
        return "EnumType(" + name + ", " + entries + ")";
    }
}
