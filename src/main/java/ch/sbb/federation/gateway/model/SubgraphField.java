package ch.sbb.federation.gateway.model;

import graphql.language.InputValueDefinition;

import java.util.List;
import java.util.Optional;

/**
 * A field as declared by one subgraph.
 */
public record SubgraphField(
    String name,
    TypeRef type,
    List<InputValueDefinition> arguments,
    List<FederationDirective> directives
) {

    public SubgraphField {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
        directives = directives != null ? List.copyOf(directives) : List.of();
    }

    public boolean isExternal() {
        return has(FederationDirective.Kind.EXTERNAL);
    }

    public boolean isShareable() {
        return has(FederationDirective.Kind.SHAREABLE);
    }

    public List<String> requires() {
        return directives.stream()
            .filter(FederationDirective.Requires.class::isInstance)
            .map(d -> ((FederationDirective.Requires) d).fields())
            .findFirst()
            .orElse(List.of());
    }

    public List<String> provides() {
        return directives.stream()
            .filter(FederationDirective.Provides.class::isInstance)
            .map(d -> ((FederationDirective.Provides) d).fields())
            .findFirst()
            .orElse(List.of());
    }

    public Optional<String> overrideFrom() {
        return directives.stream()
            .filter(FederationDirective.OverrideFrom.class::isInstance)
            .map(d -> ((FederationDirective.OverrideFrom) d).from())
            .findFirst();
    }

    private boolean has(FederationDirective.Kind kind) {
        return directives.stream().anyMatch(d -> d.kind() == kind);
    }
}
