package ch.sbb.federation.gateway.planning;

import java.util.List;

/**
 * One subgraph request of a {@link QueryPlan}.
 *
 * @param id position in the plan; every dependency has a lower id
 * @param subgraph target subgraph
 * @param kind root fetch or {@code _entities} fetch
 * @param document GraphQL document sent to the subgraph
 * @param variableNames client variables the document references
 * @param typename entity type for {@code ENTITY} nodes, {@code null} otherwise
 * @param targets where results are merged
 * @param dependsOn ids of the nodes that must complete first
 * @param mutation whether the document is a mutation (never retried)
 * @param unavailableAtPlanning whether the subgraph was {@code DOWN} when the plan was built
 */
public record FetchNode(
    int id,
    String subgraph,
    Kind kind,
    String document,
    List<String> variableNames,
    String typename,
    List<EntityTarget> targets,
    List<Integer> dependsOn,
    boolean mutation,
    boolean unavailableAtPlanning
) {

    public enum Kind {
        ROOT,
        ENTITY
    }

    public FetchNode {
        variableNames = List.copyOf(variableNames);
        targets = List.copyOf(targets);
        dependsOn = List.copyOf(dependsOn);
    }

    public boolean isEntity() {
        return kind == Kind.ENTITY;
    }
}
