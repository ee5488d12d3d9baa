package ch.sbb.federation.gateway.model;

import graphql.language.InputValueDefinition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A field of the composed schema.
 *
 * @param name field name
 * @param type output type
 * @param arguments argument definitions taken from the owning subgraph
 * @param owner the subgraph owning the field, {@code null} for input fields
 * @param resolvers every subgraph able to resolve the field, owner first
 * @param shareable whether several subgraphs legitimately resolve the field
 * @param requires {@code @requires} field sets per declaring subgraph
 * @param provides {@code @provides} field sets per declaring subgraph
 */
public record ComposedField(
    String name,
    TypeRef type,
    List<InputValueDefinition> arguments,
    String owner,
    Set<String> resolvers,
    boolean shareable,
    Map<String, List<String>> requires,
    Map<String, List<String>> provides
) {

    public ComposedField {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
        resolvers = resolvers != null ? Collections.unmodifiableSet(new LinkedHashSet<>(resolvers)) : Set.of();
        requires = requires != null ? Map.copyOf(requires) : Map.of();
        provides = provides != null ? Map.copyOf(provides) : Map.of();
    }

    public boolean resolvableBy(String subgraph) {
        return resolvers.contains(subgraph);
    }

    public List<String> requiresIn(String subgraph) {
        return requires.getOrDefault(subgraph, List.of());
    }

    public List<String> providesIn(String subgraph) {
        return provides.getOrDefault(subgraph, List.of());
    }
}
