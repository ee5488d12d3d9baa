package ch.sbb.federation.gateway.model;

import graphql.language.Argument;
import graphql.language.Directive;
import graphql.language.StringValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Federation directive attached to a subgraph type or field.
 *
 * <p>The set of directives is closed; composition and planning switch over {@link #kind()}
 * so every kind is handled explicitly.</p>
 */
public sealed interface FederationDirective {

    /**
     * Directive kinds understood by the gateway.
     */
    enum Kind {
        KEY,
        EXTENDS,
        EXTERNAL,
        PROVIDES,
        REQUIRES,
        SHAREABLE,
        OVERRIDE
    }

    Kind kind();

    /**
     * {@code @key(fields: "...")} on an entity type.
     */
    record Key(List<String> fields) implements FederationDirective {
        public Key {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.KEY;
        }
    }

    record Extends() implements FederationDirective {
        @Override
        public Kind kind() {
            return Kind.EXTENDS;
        }
    }

    record External() implements FederationDirective {
        @Override
        public Kind kind() {
            return Kind.EXTERNAL;
        }
    }

    /**
     * {@code @provides(fields: "...")}: the field's subgraph can resolve these fields of the
     * returned entity without an entity fetch.
     */
    record Provides(List<String> fields) implements FederationDirective {
        public Provides {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.PROVIDES;
        }
    }

    /**
     * {@code @requires(fields: "...")}: external fields that must be sent along with the
     * representation before this field can be resolved.
     */
    record Requires(List<String> fields) implements FederationDirective {
        public Requires {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.REQUIRES;
        }
    }

    record Shareable() implements FederationDirective {
        @Override
        public Kind kind() {
            return Kind.SHAREABLE;
        }
    }

    /**
     * {@code @override(from: "subgraph")}: takes ownership of a field from another subgraph.
     */
    record OverrideFrom(String from) implements FederationDirective {
        @Override
        public Kind kind() {
            return Kind.OVERRIDE;
        }
    }

    /**
     * Translate a graphql-java directive. Directives that are not federation directives
     * yield an empty result.
     *
     * @throws IllegalArgumentException if a federation directive lacks its required argument
     *         or uses a nested field set
     */
    static Optional<FederationDirective> from(Directive directive) {
        return switch (directive.getName()) {
            case "key" -> Optional.of(new Key(parseFieldSet(stringArgument(directive, "fields"))));
            case "extends" -> Optional.of(new Extends());
            case "external" -> Optional.of(new External());
            case "provides" -> Optional.of(new Provides(parseFieldSet(stringArgument(directive, "fields"))));
            case "requires" -> Optional.of(new Requires(parseFieldSet(stringArgument(directive, "fields"))));
            case "shareable" -> Optional.of(new Shareable());
            case "override" -> Optional.of(new OverrideFrom(stringArgument(directive, "from")));
            default -> Optional.empty();
        };
    }

    /**
     * Split a field set such as {@code "id version"} into field names.
     */
    static List<String> parseFieldSet(String fieldSet) {
        if (fieldSet.contains("{") || fieldSet.contains("}")) {
            throw new IllegalArgumentException("Nested field sets are not supported: \"" + fieldSet + "\"");
        }
        List<String> fields = Arrays.stream(fieldSet.trim().split("[\\s,]+"))
            .filter(s -> !s.isEmpty())
            .toList();
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Empty field set");
        }
        return fields;
    }

    private static String stringArgument(Directive directive, String name) {
        Argument argument = directive.getArgument(name);
        if (argument == null || !(argument.getValue() instanceof StringValue value)) {
            throw new IllegalArgumentException(
                "@" + directive.getName() + " requires a string argument '" + name + "'");
        }
        return value.getValue();
    }
}
