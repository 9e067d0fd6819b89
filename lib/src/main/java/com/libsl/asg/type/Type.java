package com.libsl.asg.type;

import com.libsl.asg.LslContext;
import java.util.Optional;

/**
 * A type of the specification language. The set of shapes is closed; shared behaviour is computed from the shape of
 * the node so two traversals of the same type always agree.
 */
public sealed interface Type
        permits RealType,
                SimpleType,
                TypeAlias,
                EnumLikeSemanticType,
                ChildrenType,
                StructuredType,
                EnumType,
                ArrayType {

    String getName();

    boolean isPointer();

    /** Single-level generic parameter, or {@code null}. */
    Type getGeneric();

    LslContext getContext();

    default String getFullName() {
        return (isPointer() ? "*" : "") + getName();
    }

    default boolean isArray() {
        return TypeAlias.unwrapQuietly(this) instanceof ArrayType;
    }

    /**
     * Resolves the type of a named field. Structured types look the field up in their entries; enum types answer
     * their children type for any declared variant; every other shape has no fields.
     */
    default Optional<Type> resolveFieldType(String fieldName) {
        if (this instanceof StructuredType structured) {
            return structured.getEntries().stream()
                    .filter(field -> field.getName().equals(fieldName))
                    .findFirst()
                    .map(StructuredType.Field::getType);
        }
        if (this instanceof EnumType enumType) {
            return enumType.hasEntry(fieldName) ? Optional.of(enumType.getChildrenType()) : Optional.empty();
        }
        if (this instanceof EnumLikeSemanticType enumLike) {
            return enumLike.hasEntry(fieldName) ? Optional.of(enumLike.getChildrenType()) : Optional.empty();
        }
        return Optional.empty();
    }
}
