package com.libsl.asg.type;

import com.libsl.asg.AliasCycleException;
import com.libsl.asg.LslContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** {@code typealias Name = Original;}. Aliases never carry pointer or generic information themselves. */
public final class TypeAlias implements Type {
    private final String name;
    private final LslContext context;
    private Type originalType;

    public TypeAlias(String name, LslContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.context = Objects.requireNonNull(context, "context");
    }

    public Type getOriginalType() {
        return originalType;
    }

    public void bindOriginalType(Type originalType) {
        if (this.originalType != null) {
            throw new IllegalStateException("original type of alias " + name + " is already bound");
        }
        this.originalType = Objects.requireNonNull(originalType, "originalType");
    }

    /**
     * Follows the alias chain to the first non-alias type.
     *
     * @throws AliasCycleException if the chain comes back to an alias already visited
     */
    public Type resolveOriginal() {
        List<String> chain = new ArrayList<>();
        Set<TypeAlias> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Type current = this;
        while (current instanceof TypeAlias alias) {
            chain.add(alias.getName());
            if (!seen.add(alias)) {
                throw new AliasCycleException(chain);
            }
            if (alias.originalType == null) {
                throw new IllegalStateException("original type of alias " + alias.getName() + " is not bound");
            }
            current = alias.originalType;
        }
        return current;
    }

    /**
     * Unwraps aliases without failing: a cyclic or unbound chain answers the last alias reached.
     */
    static Type unwrapQuietly(Type type) {
        Set<TypeAlias> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Type current = type;
        while (current instanceof TypeAlias alias && alias.originalType != null && seen.add(alias)) {
            current = alias.originalType;
        }
        return current;
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
        return "TypeAlias(" + name + " = " + (originalType == null ? "?" : originalType.getFullName()) + ")";
    }
}
