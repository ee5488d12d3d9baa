package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.error.SchemaException;
import ch.sbb.federation.gateway.model.FederationDirective;
import ch.sbb.federation.gateway.model.SubgraphField;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.model.SubgraphType;
import ch.sbb.federation.gateway.model.TypeKind;
import ch.sbb.federation.gateway.model.TypeRef;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.Document;
import graphql.language.EnumTypeDefinition;
import graphql.language.EnumTypeExtensionDefinition;
import graphql.language.EnumValueDefinition;
import graphql.language.FieldDefinition;
import graphql.language.InputObjectTypeDefinition;
import graphql.language.InputObjectTypeExtensionDefinition;
import graphql.language.InputValueDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.InterfaceTypeExtensionDefinition;
import graphql.language.ObjectTypeDefinition;
import graphql.language.ObjectTypeExtensionDefinition;
import graphql.language.OperationTypeDefinition;
import graphql.language.ScalarTypeDefinition;
import graphql.language.SchemaDefinition;
import graphql.language.TypeName;
import graphql.language.UnionTypeDefinition;
import graphql.language.UnionTypeExtensionDefinition;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses subgraph SDL into a {@link SubgraphSchema}.
 *
 * <p>Extracts federation directives, merges type extensions declared in the same SDL,
 * normalizes custom root type names and drops the federation plumbing types and fields
 * every subgraph exposes.</p>
 */
@Component
public class SdlParser {

    private static final Logger log = LoggerFactory.getLogger(SdlParser.class);

    private static final Set<String> FEDERATION_TYPES =
        Set.of("_Service", "_Any", "_Entity", "_FieldSet", "FieldSet", "link__Import", "link__Purpose");
    private static final Set<String> FEDERATION_ROOT_FIELDS = Set.of("_service", "_entities");

    /**
     * Parse and validate a subgraph's SDL.
     *
     * @param name the subgraph name
     * @param url the subgraph GraphQL endpoint
     * @param healthUrl optional health endpoint
     * @param sdl the SDL text
     * @return the parsed subgraph
     * @throws SchemaException if the SDL is malformed or violates a federation rule
     */
    public SubgraphSchema parse(String name, String url, String healthUrl, String sdl) {
        if (sdl == null || sdl.isBlank()) {
            throw new SchemaException(name, "Subgraph '" + name + "' provided an empty SDL");
        }

        Document document;
        try {
            document = Parser.parse(sdl);
        } catch (InvalidSyntaxException e) {
            throw new SchemaException(name, "Malformed SDL in subgraph '" + name + "': " + e.getMessage(), e);
        }

        Map<String, String> rootNames = rootTypeNames(document);
        Map<String, TypeBuilder> builders = new LinkedHashMap<>();

        for (Definition<?> definition : document.getDefinitions()) {
            try {
                collect(definition, rootNames, builders);
            } catch (IllegalArgumentException e) {
                throw new SchemaException(name, "Invalid SDL in subgraph '" + name + "': " + e.getMessage(), e);
            }
        }

        Map<String, SubgraphType> types = new LinkedHashMap<>();
        for (TypeBuilder builder : builders.values()) {
            if (FEDERATION_TYPES.contains(builder.name)) {
                continue;
            }
            SubgraphType type = builder.build();
            validate(name, type);
            types.put(type.name(), type);
        }

        log.debug("Parsed subgraph {} with {} types", name, types.size());
        return new SubgraphSchema(name, url, healthUrl, sdl, types, Instant.now());
    }

    private Map<String, String> rootTypeNames(Document document) {
        Map<String, String> rootNames = new HashMap<>();
        for (SchemaDefinition schema : document.getDefinitionsOfType(SchemaDefinition.class)) {
            for (OperationTypeDefinition operation : schema.getOperationTypeDefinitions()) {
                String canonical = switch (operation.getName()) {
                    case "query" -> "Query";
                    case "mutation" -> "Mutation";
                    default -> "Subscription";
                };
                rootNames.put(operation.getTypeName().getName(), canonical);
            }
        }
        return rootNames;
    }

    private void collect(Definition<?> definition, Map<String, String> rootNames, Map<String, TypeBuilder> builders) {
        if (definition instanceof ObjectTypeDefinition object) {
            String typeName = rootNames.getOrDefault(object.getName(), object.getName());
            TypeBuilder builder = builder(builders, typeName, TypeKind.OBJECT);
            builder.declare(!(object instanceof ObjectTypeExtensionDefinition));
            builder.directives(object.getDirectives());
            object.getImplements().forEach(t -> builder.interfaces.add(((TypeName) t).getName()));
            for (FieldDefinition field : object.getFieldDefinitions()) {
                if (isRoot(typeName) && FEDERATION_ROOT_FIELDS.contains(field.getName())) {
                    continue;
                }
                builder.field(field.getName(), TypeRef.from(field.getType()), field.getInputValueDefinitions(),
                    directives(field.getDirectives()));
            }
        } else if (definition instanceof InterfaceTypeDefinition iface) {
            TypeBuilder builder = builder(builders, iface.getName(), TypeKind.INTERFACE);
            builder.declare(!(iface instanceof InterfaceTypeExtensionDefinition));
            builder.directives(iface.getDirectives());
            for (FieldDefinition field : iface.getFieldDefinitions()) {
                builder.field(field.getName(), TypeRef.from(field.getType()), field.getInputValueDefinitions(),
                    directives(field.getDirectives()));
            }
        } else if (definition instanceof UnionTypeDefinition union) {
            TypeBuilder builder = builder(builders, union.getName(), TypeKind.UNION);
            builder.declare(!(union instanceof UnionTypeExtensionDefinition));
            union.getMemberTypes().forEach(t -> builder.members.add(((TypeName) t).getName()));
        } else if (definition instanceof EnumTypeDefinition enumType) {
            TypeBuilder builder = builder(builders, enumType.getName(), TypeKind.ENUM);
            builder.declare(!(enumType instanceof EnumTypeExtensionDefinition));
            enumType.getEnumValueDefinitions().stream()
                .map(EnumValueDefinition::getName)
                .forEach(builder.enumValues::add);
        } else if (definition instanceof InputObjectTypeDefinition input) {
            TypeBuilder builder = builder(builders, input.getName(), TypeKind.INPUT_OBJECT);
            builder.declare(!(input instanceof InputObjectTypeExtensionDefinition));
            for (InputValueDefinition value : input.getInputValueDefinitions()) {
                builder.field(value.getName(), TypeRef.from(value.getType()), List.of(), List.of());
            }
        } else if (definition instanceof ScalarTypeDefinition scalar) {
            builder(builders, scalar.getName(), TypeKind.SCALAR).declare(true);
        }
    }

    private TypeBuilder builder(Map<String, TypeBuilder> builders, String name, TypeKind kind) {
        TypeBuilder builder = builders.computeIfAbsent(name, n -> new TypeBuilder(n, kind));
        if (builder.kind != kind) {
            throw new IllegalArgumentException(
                "type '" + name + "' is declared both as " + builder.kind + " and " + kind);
        }
        return builder;
    }

    private static boolean isRoot(String typeName) {
        return "Query".equals(typeName) || "Mutation".equals(typeName) || "Subscription".equals(typeName);
    }

    private static List<FederationDirective> directives(List<Directive> directives) {
        List<FederationDirective> result = new ArrayList<>();
        for (Directive directive : directives) {
            FederationDirective.from(directive).ifPresent(result::add);
        }
        return result;
    }

    private void validate(String subgraph, SubgraphType type) {
        for (List<String> key : type.keys()) {
            for (String keyField : key) {
                if (!type.fields().containsKey(keyField)) {
                    throw new SchemaException(subgraph, "Entity type '" + type.name() + "' in subgraph '"
                        + subgraph + "' declares key field '" + keyField + "' but does not define it");
                }
            }
        }
        for (SubgraphField field : type.fields().values()) {
            for (String required : field.requires()) {
                if (!type.fields().containsKey(required)) {
                    throw new SchemaException(subgraph, "Field '" + type.name() + "." + field.name()
                        + "' requires '" + required + "' which is not defined on the type");
                }
            }
        }
    }

    /**
     * Accumulates a type and its extensions while walking the document.
     */
    private static final class TypeBuilder {
        private final String name;
        private final TypeKind kind;
        private boolean baseDeclared;
        private final Map<String, SubgraphField> fields = new LinkedHashMap<>();
        private final List<FederationDirective> directives = new ArrayList<>();
        private final List<String> interfaces = new ArrayList<>();
        private final List<String> members = new ArrayList<>();
        private final List<String> enumValues = new ArrayList<>();

        private TypeBuilder(String name, TypeKind kind) {
            this.name = name;
            this.kind = kind;
        }

        void declare(boolean base) {
            baseDeclared |= base;
        }

        void directives(List<Directive> typeDirectives) {
            directives.addAll(SdlParser.directives(typeDirectives));
        }

        void field(String fieldName, TypeRef type, List<InputValueDefinition> arguments,
                   List<FederationDirective> fieldDirectives) {
            if (fields.containsKey(fieldName)) {
                throw new IllegalArgumentException("field '" + name + "." + fieldName + "' is declared twice");
            }
            fields.put(fieldName, new SubgraphField(fieldName, type, arguments, fieldDirectives));
        }

        SubgraphType build() {
            boolean extension = !baseDeclared
                || directives.stream().anyMatch(d -> d.kind() == FederationDirective.Kind.EXTENDS);
            return new SubgraphType(name, kind, extension, fields, directives, interfaces, members, enumValues);
        }
    }
}
