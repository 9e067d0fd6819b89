package com.libsl.loader.semantic;

import com.libsl.asg.Automaton;
import com.libsl.asg.LslContext;
import com.libsl.asg.type.ArrayType;
import com.libsl.asg.type.RealType;
import com.libsl.asg.type.Type;
import com.libsl.loader.ast.TypeReferenceNode;
import java.util.List;
import java.util.Optional;

/**
 * Turns written type references into types of the library.
 *
 * <p>Declarations of semantic types name real types ({@link #realType}); every other position (variables,
 * arguments, fields, return types) must name a declared semantic type, {@code array<T>}, or, for arguments and
 * variables, an automaton ({@link #declaredType}).</p>
 */
final class TypeResolver {
    static final String ARRAY = "array";

    private final LslContext context;

    TypeResolver(LslContext context) {
        this.context = context;
    }

    /** Real type as written; the generic parameter may name a semantic type. */
    RealType realType(TypeReferenceNode reference) {
        Type generic = reference.getGeneric() == null ? null : anyType(reference.getGeneric());
        RealType realType = new RealType(reference.getNameParts(), reference.isPointer(), generic, context);
        context.registerRealType(realType);
        return realType;
    }

    /** Real type without pointer or generic, e.g. the implicit real type of a structure. */
    RealType realType(List<String> nameParts) {
        RealType realType = new RealType(nameParts, false, null, context);
        context.registerRealType(realType);
        return realType;
    }

    /** Semantic type when one has the name, {@code array<T>}, or else a real type. */
    Type anyType(TypeReferenceNode reference) {
        Optional<Type> semantic = semanticType(reference);
        if (semantic.isPresent()) {
            return checkModifiers(reference, semantic.get());
        }
        if (isArray(reference)) {
            return arrayType(reference, false);
        }
        return realType(reference);
    }

    Type declaredType(TypeReferenceNode reference) {
        return declaredType(reference, false);
    }

    /**
     * Type of a declared entity.
     *
     * @param allowAutomaton whether an automaton name stands for the automaton's type
     * @throws ResolutionException if the reference names nothing known
     */
    Type declaredType(TypeReferenceNode reference, boolean allowAutomaton) {
        if (isArray(reference)) {
            return arrayType(reference, allowAutomaton);
        }
        Optional<Type> semantic = semanticType(reference);
        if (semantic.isPresent()) {
            return checkModifiers(reference, semantic.get());
        }
        if (allowAutomaton) {
            Optional<Automaton> automaton = automaton(reference);
            if (automaton.isPresent()) {
                return automaton.get().getType();
            }
        }
        throw new ResolutionException("unresolved type '" + reference + "'", reference.getLocation());
    }

    Optional<Automaton> automaton(TypeReferenceNode reference) {
        if (reference.getNameParts().size() != 1 || reference.getGeneric() != null) {
            return Optional.empty();
        }
        return context.resolveAutomaton(reference.getNameParts().get(0));
    }

    private Optional<Type> semanticType(TypeReferenceNode reference) {
        List<String> parts = reference.getNameParts();
        if (parts.size() != 1) {
            return Optional.empty();
        }
        return context.resolveType(parts.get(0));
    }

    private static boolean isArray(TypeReferenceNode reference) {
        return reference.getNameParts().size() == 1
                && reference.getNameParts().get(0).equals(ARRAY)
                && reference.getGeneric() != null;
    }

    private ArrayType arrayType(TypeReferenceNode reference, boolean allowAutomaton) {
        Type element = declaredType(reference.getGeneric(), allowAutomaton);
        return new ArrayType(ARRAY, reference.isPointer(), element, context);
    }

    private static Type checkModifiers(TypeReferenceNode reference, Type type) {
        if (reference.isPointer() || reference.getGeneric() != null) {
            throw new ResolutionException(
                    "semantic type '" + type.getName() + "' cannot take pointer or generic modifiers",
                    reference.getLocation());
        }
        return type;
    }
}
