package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.error.CompositionException.Conflict;
import ch.sbb.federation.gateway.model.ComposedField;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.ComposedType;
import ch.sbb.federation.gateway.model.SubgraphField;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.model.SubgraphType;
import ch.sbb.federation.gateway.model.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges subgraph schemas into a {@link ComposedSchema}.
 *
 * <p>Stateless. Collects every conflict before failing so operators see the whole
 * picture in one {@link CompositionException}.</p>
 */
@Component
public class SchemaComposer {

    private static final Logger log = LoggerFactory.getLogger(SchemaComposer.class);

    /**
     * Compose the given subgraphs.
     *
     * @param subgraphs the subgraphs, in registration order
     * @param generation generation stamp of the resulting snapshot
     * @return the composed schema
     * @throws CompositionException listing every conflict found
     */
    public ComposedSchema compose(List<SubgraphSchema> subgraphs, long generation) {
        if (subgraphs.isEmpty()) {
            throw new CompositionException(List.of(new Conflict("*", List.of(), "no subgraphs registered")));
        }

        Map<String, List<Declaration>> declarations = new LinkedHashMap<>();
        for (SubgraphSchema subgraph : subgraphs) {
            for (SubgraphType type : subgraph.types().values()) {
                declarations.computeIfAbsent(type.name(), n -> new ArrayList<>())
                    .add(new Declaration(subgraph.name(), type));
            }
        }

        List<Conflict> conflicts = new ArrayList<>();
        Map<String, ComposedType> types = new LinkedHashMap<>();

        for (Map.Entry<String, List<Declaration>> entry : declarations.entrySet()) {
            String typeName = entry.getKey();
            List<Declaration> decls = entry.getValue();

            Set<TypeKind> kinds = decls.stream().map(d -> d.type().kind()).collect(Collectors.toSet());
            if (kinds.size() > 1) {
                conflicts.add(new Conflict(typeName, subgraphNames(decls),
                    "type is declared with different kinds " + kinds));
                continue;
            }

            ComposedType composed = switch (decls.get(0).type().kind()) {
                case OBJECT, INTERFACE -> composeComposite(typeName, decls, conflicts);
                case INPUT_OBJECT -> composeInput(typeName, decls, conflicts);
                case ENUM -> composeEnum(typeName, decls);
                case UNION -> composeUnion(typeName, decls);
                case SCALAR -> new ComposedType(typeName, TypeKind.SCALAR, null, null, null, null, null,
                    subgraphSet(decls));
            };
            types.put(typeName, composed);
        }

        if (!conflicts.isEmpty()) {
            throw new CompositionException(conflicts);
        }

        resolvePossibleTypes(types);

        Map<String, SubgraphSchema> byName = new LinkedHashMap<>();
        subgraphs.forEach(s -> byName.put(s.name(), s));

        log.debug("Composed {} types from {} subgraphs (generation {})", types.size(), subgraphs.size(), generation);
        return new ComposedSchema(generation, types, byName, Instant.now());
    }

    private ComposedType composeComposite(String typeName, List<Declaration> decls, List<Conflict> conflicts) {
        List<List<String>> keys = composeKeys(typeName, decls, conflicts);

        Set<String> fieldNames = new LinkedHashSet<>();
        Set<String> interfaces = new LinkedHashSet<>();
        for (Declaration decl : decls) {
            fieldNames.addAll(decl.type().fields().keySet());
            interfaces.addAll(decl.type().interfaces());
        }

        Map<String, ComposedField> fields = new LinkedHashMap<>();
        for (String fieldName : fieldNames) {
            ComposedField field = composeField(typeName, fieldName, decls, conflicts);
            if (field != null) {
                fields.put(fieldName, field);
            }
        }

        return new ComposedType(typeName, decls.get(0).type().kind(), fields, keys,
            new ArrayList<>(interfaces), null, null, subgraphSet(decls));
    }

    /**
     * The origin's keys become the entity's keys; every other declaration's keys must match one of them.
     */
    private List<List<String>> composeKeys(String typeName, List<Declaration> decls, List<Conflict> conflicts) {
        Declaration origin = decls.stream()
            .filter(d -> d.type().isEntity() && !d.type().extension())
            .findFirst()
            .or(() -> decls.stream().filter(d -> d.type().isEntity()).findFirst())
            .orElse(null);
        if (origin == null) {
            return List.of();
        }

        List<Set<String>> originKeys = origin.type().keys().stream()
            .map(k -> (Set<String>) new HashSet<>(k))
            .toList();
        for (Declaration decl : decls) {
            if (decl == origin) {
                continue;
            }
            for (List<String> key : decl.type().keys()) {
                if (!originKeys.contains(new HashSet<>(key))) {
                    conflicts.add(new Conflict(typeName, List.of(origin.subgraph(), decl.subgraph()),
                        "@key(fields: \"" + String.join(" ", key) + "\") in " + decl.subgraph()
                            + " matches no key declared by " + origin.subgraph()));
                }
            }
        }
        return origin.type().keys();
    }

    private ComposedField composeField(String typeName, String fieldName, List<Declaration> decls,
                                       List<Conflict> conflicts) {
        String coordinate = typeName + "." + fieldName;
        List<Declaration> declaring = decls.stream()
            .filter(d -> d.type().fields().containsKey(fieldName))
            .toList();

        List<Declaration> overriding = declaring.stream()
            .filter(d -> !d.field(fieldName).isExternal() && d.field(fieldName).overrideFrom().isPresent())
            .toList();
        if (overriding.size() > 1) {
            conflicts.add(new Conflict(coordinate, subgraphNames(overriding),
                "field is overridden by more than one subgraph"));
            return null;
        }
        String overridden = overriding.isEmpty() ? null : overriding.get(0).field(fieldName).overrideFrom().get();

        List<Declaration> resolving = declaring.stream()
            .filter(d -> !d.field(fieldName).isExternal())
            .filter(d -> !d.subgraph().equals(overridden))
            .sorted(Comparator.comparing((Declaration d) -> !overriding.contains(d))
                .thenComparing(d -> d.type().extension()))
            .toList();

        if (resolving.isEmpty()) {
            conflicts.add(new Conflict(coordinate, subgraphNames(declaring),
                "field is @external in every subgraph that declares it"));
            return null;
        }

        if (resolving.size() > 1) {
            boolean shareable = resolving.stream().allMatch(d -> d.field(fieldName).isShareable()
                || d.type().isShareable()
                || d.type().isKeyField(fieldName));
            if (!shareable) {
                conflicts.add(new Conflict(coordinate, subgraphNames(resolving),
                    "field '" + fieldName + "' is defined in multiple subgraphs without @shareable or @override"));
                return null;
            }
        }

        Set<String> returnTypes = declaring.stream()
            .map(d -> d.field(fieldName).type().namedType())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (returnTypes.size() > 1) {
            conflicts.add(new Conflict(coordinate, subgraphNames(declaring),
                "field has different return types " + returnTypes));
            return null;
        }

        Set<String> resolvers = new LinkedHashSet<>(subgraphNames(resolving));
        declaring.stream()
            .filter(d -> d.field(fieldName).isExternal() && d.type().isKeyField(fieldName))
            .forEach(d -> resolvers.add(d.subgraph()));

        Map<String, List<String>> requires = new LinkedHashMap<>();
        Map<String, List<String>> provides = new LinkedHashMap<>();
        for (Declaration decl : declaring) {
            SubgraphField field = decl.field(fieldName);
            if (!field.requires().isEmpty()) {
                requires.put(decl.subgraph(), field.requires());
            }
            if (!field.provides().isEmpty()) {
                provides.put(decl.subgraph(), field.provides());
            }
        }

        Declaration owner = resolving.get(0);
        SubgraphField ownerField = owner.field(fieldName);
        return new ComposedField(fieldName, ownerField.type(), ownerField.arguments(), owner.subgraph(),
            resolvers, resolving.size() > 1, requires, provides);
    }

    private ComposedType composeInput(String typeName, List<Declaration> decls, List<Conflict> conflicts) {
        Map<String, ComposedField> fields = new LinkedHashMap<>();
        for (Declaration decl : decls) {
            for (SubgraphField field : decl.type().fields().values()) {
                ComposedField existing = fields.get(field.name());
                if (existing == null) {
                    fields.put(field.name(), new ComposedField(field.name(), field.type(), null, null,
                        null, true, null, null));
                } else if (!existing.type().toString().equals(field.type().toString())) {
                    conflicts.add(new Conflict(typeName + "." + field.name(), subgraphNames(decls),
                        "input field has different types " + existing.type() + " and " + field.type()));
                }
            }
        }
        return new ComposedType(typeName, TypeKind.INPUT_OBJECT, fields, null, null, null, null,
            subgraphSet(decls));
    }

    private ComposedType composeEnum(String typeName, List<Declaration> decls) {
        Set<String> values = new LinkedHashSet<>();
        decls.forEach(d -> values.addAll(d.type().enumValues()));
        return new ComposedType(typeName, TypeKind.ENUM, null, null, null, null, new ArrayList<>(values),
            subgraphSet(decls));
    }

    private ComposedType composeUnion(String typeName, List<Declaration> decls) {
        Set<String> members = new LinkedHashSet<>();
        decls.forEach(d -> members.addAll(d.type().members()));
        return new ComposedType(typeName, TypeKind.UNION, null, null, null, members, null, subgraphSet(decls));
    }

    private void resolvePossibleTypes(Map<String, ComposedType> types) {
        for (ComposedType type : List.copyOf(types.values())) {
            if (type.kind() != TypeKind.INTERFACE) {
                continue;
            }
            Set<String> implementations = types.values().stream()
                .filter(t -> t.kind() == TypeKind.OBJECT && t.interfaces().contains(type.name()))
                .map(ComposedType::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
            types.put(type.name(), new ComposedType(type.name(), type.kind(), type.fields(), type.keys(),
                type.interfaces(), implementations, type.enumValues(), type.subgraphs()));
        }
    }

    private static List<String> subgraphNames(List<Declaration> decls) {
        return decls.stream().map(Declaration::subgraph).distinct().toList();
    }

    private static Set<String> subgraphSet(List<Declaration> decls) {
        return new LinkedHashSet<>(subgraphNames(decls));
    }

    private record Declaration(String subgraph, SubgraphType type) {
        SubgraphField field(String name) {
            return type.fields().get(name);
        }
    }
}
