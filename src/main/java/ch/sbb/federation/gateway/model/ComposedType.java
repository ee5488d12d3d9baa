package ch.sbb.federation.gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A type of the composed schema.
 *
 * @param name type name
 * @param kind type kind
 * @param fields merged fields
 * @param keys entity key field sets, primary key first; empty for value types
 * @param interfaces implemented interfaces
 * @param possibleTypes concrete object types for interfaces and unions
 * @param enumValues merged enum values
 * @param subgraphs subgraphs declaring the type, in registration order
 */
public record ComposedType(
    String name,
    TypeKind kind,
    Map<String, ComposedField> fields,
    List<List<String>> keys,
    List<String> interfaces,
    Set<String> possibleTypes,
    List<String> enumValues,
    Set<String> subgraphs
) {

    public ComposedType {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        keys = keys != null ? keys.stream().map(List::copyOf).toList() : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        possibleTypes = possibleTypes != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(possibleTypes)) : Set.of();
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
        subgraphs = subgraphs != null ? Collections.unmodifiableSet(new LinkedHashSet<>(subgraphs)) : Set.of();
    }

    public boolean isEntity() {
        return !keys.isEmpty();
    }

    public List<String> primaryKey() {
        return keys.isEmpty() ? List.of() : keys.get(0);
    }

    public ComposedField field(String fieldName) {
        return fields.get(fieldName);
    }
}
