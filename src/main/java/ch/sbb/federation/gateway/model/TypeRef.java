package ch.sbb.federation.gateway.model;

import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.Type;
import graphql.language.TypeName;

/**
 * Output type reference of a field, e.g. {@code [Execution!]!}.
 *
 * <p>A reference either names a type ({@code elementType == null}) or wraps a list of
 * {@code elementType}. Non-null is a flag on each level.</p>
 */
public record TypeRef(String name, TypeRef elementType, boolean nonNull) {

    public static TypeRef named(String name, boolean nonNull) {
        return new TypeRef(name, null, nonNull);
    }

    public static TypeRef listOf(TypeRef elementType, boolean nonNull) {
        return new TypeRef(null, elementType, nonNull);
    }

    /**
     * Convert a graphql-java AST type.
     */
    public static TypeRef from(Type<?> type) {
        if (type instanceof NonNullType nonNullType) {
            TypeRef inner = from(nonNullType.getType());
            return new TypeRef(inner.name(), inner.elementType(), true);
        }
        if (type instanceof ListType listType) {
            return listOf(from(listType.getType()), false);
        }
        return named(((TypeName) type).getName(), false);
    }

    public boolean isList() {
        return elementType != null;
    }

    /**
     * The innermost named type.
     */
    public String namedType() {
        return isList() ? elementType.namedType() : name;
    }

    /**
     * Number of list wrappers around the named type.
     */
    public int listDepth() {
        return isList() ? 1 + elementType.listDepth() : 0;
    }

    @Override
    public String toString() {
        String base = isList() ? "[" + elementType + "]" : name;
        return nonNull ? base + "!" : base;
    }
}
