package ch.sbb.federation.gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named type as declared by one subgraph, with its extensions in the same SDL merged in.
 *
 * @param name the type name (root types normalized to {@code Query}/{@code Mutation})
 * @param kind the type kind
 * @param extension whether the subgraph only extends the type ({@code extend type} or {@code @extends})
 * @param fields object/interface fields, or input fields for input objects
 * @param directives federation directives on the type
 * @param interfaces implemented interfaces
 * @param members union members
 * @param enumValues enum values
 */
public record SubgraphType(
    String name,
    TypeKind kind,
    boolean extension,
    Map<String, SubgraphField> fields,
    List<FederationDirective> directives,
    List<String> interfaces,
    List<String> members,
    List<String> enumValues
) {

    public SubgraphType {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        directives = directives != null ? List.copyOf(directives) : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        members = members != null ? List.copyOf(members) : List.of();
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    /**
     * Key field sets declared with {@code @key}, in declaration order.
     */
    public List<List<String>> keys() {
        return directives.stream()
            .filter(FederationDirective.Key.class::isInstance)
            .map(d -> ((FederationDirective.Key) d).fields())
            .toList();
    }

    public boolean isEntity() {
        return !keys().isEmpty();
    }

    public boolean isShareable() {
        return directives.stream().anyMatch(d -> d.kind() == FederationDirective.Kind.SHAREABLE);
    }

    /**
     * Whether {@code fieldName} appears in one of this declaration's keys.
     */
    public boolean isKeyField(String fieldName) {
        return keys().stream().anyMatch(key -> key.contains(fieldName));
    }
}
