package ch.sbb.federation.gateway.model;

/**
 * Kind of a named GraphQL type.
 */
public enum TypeKind {
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    SCALAR,
    INPUT_OBJECT;

    public boolean isComposite() {
        return this == OBJECT || this == INTERFACE || this == UNION;
    }

    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }
}
