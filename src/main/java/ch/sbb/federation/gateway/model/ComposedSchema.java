package ch.sbb.federation.gateway.model;

import graphql.language.AstPrinter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the federated schema.
 *
 * <p>A new snapshot with a higher generation replaces the previous one on every successful
 * composition. Readers keep the snapshot they acquired for the whole request.</p>
 */
public record ComposedSchema(
    long generation,
    Map<String, ComposedType> types,
    Map<String, SubgraphSchema> subgraphs,
    Instant composedAt
) {

    public static final String QUERY = "Query";
    public static final String MUTATION = "Mutation";

    public ComposedSchema {
        types = types != null ? Collections.unmodifiableMap(new LinkedHashMap<>(types)) : Map.of();
        subgraphs = subgraphs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(subgraphs)) : Map.of();
    }

    /**
     * Schema served before anything has been composed.
     */
    public static ComposedSchema empty() {
        return new ComposedSchema(0, Map.of(), Map.of(), Instant.EPOCH);
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    public ComposedType type(String name) {
        return types.get(name);
    }

    public ComposedField field(String typeName, String fieldName) {
        ComposedType type = types.get(typeName);
        return type != null ? type.field(fieldName) : null;
    }

    public SubgraphSchema subgraph(String name) {
        return subgraphs.get(name);
    }

    public boolean isEntity(String typeName) {
        ComposedType type = types.get(typeName);
        return type != null && type.isEntity();
    }

    /**
     * Concrete object types a value of {@code typeName} may have at runtime.
     */
    public Set<String> possibleTypes(String typeName) {
        ComposedType type = types.get(typeName);
        if (type == null) {
            return Set.of();
        }
        return type.kind().isAbstract() ? type.possibleTypes() : Set.of(typeName);
    }

    /**
     * Field ownership map: {@code Type.field -> owning subgraph}.
     */
    public Map<String, String> ownership() {
        Map<String, String> ownership = new LinkedHashMap<>();
        for (ComposedType type : types.values()) {
            if (type.kind() != TypeKind.OBJECT && type.kind() != TypeKind.INTERFACE) {
                continue;
            }
            for (ComposedField field : type.fields().values()) {
                ownership.put(type.name() + "." + field.name(), field.owner());
            }
        }
        return ownership;
    }

    /**
     * Print the composed schema as SDL, annotated with field ownership.
     */
    public String printSdl() {
        StringBuilder sdl = new StringBuilder();
        sdl.append("# Federated schema, generation ").append(generation)
            .append(", composed from: ").append(String.join(", ", subgraphs.keySet())).append("\n\n");

        for (ComposedType type : types.values()) {
            switch (type.kind()) {
                case SCALAR -> sdl.append("scalar ").append(type.name()).append("\n\n");
                case ENUM -> sdl.append("enum ").append(type.name()).append(" {\n")
                    .append(type.enumValues().stream().map(v -> "  " + v).collect(Collectors.joining("\n")))
                    .append("\n}\n\n");
                case UNION -> sdl.append("union ").append(type.name()).append(" = ")
                    .append(String.join(" | ", type.possibleTypes())).append("\n\n");
                case OBJECT, INTERFACE, INPUT_OBJECT -> printFields(sdl, type);
            }
        }
        return sdl.toString().trim() + "\n";
    }

    private void printFields(StringBuilder sdl, ComposedType type) {
        String keyword = switch (type.kind()) {
            case INTERFACE -> "interface ";
            case INPUT_OBJECT -> "input ";
            default -> "type ";
        };
        sdl.append(keyword).append(type.name());
        if (!type.interfaces().isEmpty()) {
            sdl.append(" implements ").append(String.join(" & ", type.interfaces()));
        }
        for (var key : type.keys()) {
            sdl.append(" @key(fields: \"").append(String.join(" ", key)).append("\")");
        }
        sdl.append(" {\n");
        for (ComposedField field : type.fields().values()) {
            sdl.append("  ").append(field.name());
            if (!field.arguments().isEmpty()) {
                sdl.append("(")
                    .append(field.arguments().stream().map(AstPrinter::printAst).collect(Collectors.joining(", ")))
                    .append(")");
            }
            sdl.append(": ").append(field.type());
            if (field.owner() != null) {
                sdl.append(" # ").append(field.shareable() ? String.join(", ", field.resolvers()) : field.owner());
            }
            sdl.append("\n");
        }
        sdl.append("}\n\n");
    }
}
