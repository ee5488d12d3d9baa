package ch.sbb.federation.gateway.execution;

import ch.sbb.federation.gateway.client.SubgraphClient;
import ch.sbb.federation.gateway.client.SubgraphResponse;
import ch.sbb.federation.gateway.config.GatewayProperties;
import ch.sbb.federation.gateway.error.EntityResolutionException;
import ch.sbb.federation.gateway.error.FederationException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.GatewayError;
import ch.sbb.federation.gateway.model.GraphQLResponse;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.planning.EntityTarget;
import ch.sbb.federation.gateway.planning.FetchNode;
import ch.sbb.federation.gateway.planning.QueryPlan;
import ch.sbb.federation.gateway.registry.SubgraphHealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link QueryPlan} against the subgraphs.
 *
 * <p>Every fetch node is one asynchronous task that starts once all of its dependencies have
 * completed. Entity fetches collect the objects at their target paths, send one batched
 * {@code _entities} request with deduplicated representations and merge the results back by
 * position. Failures stay local to the fetch: the fields it contributes become {@code null}
 * with an error tagged with the subgraph and the response path.</p>
 *
 * <p>Each request has a deadline. When it expires outstanding tasks are cancelled, late results
 * are dropped and whatever was merged so far is returned with timeout errors for the
 * incomplete branches.</p>
 */
@Service
public class FederatedExecutor {

    private static final Logger log = LoggerFactory.getLogger(FederatedExecutor.class);

    static final String SUBGRAPH_UNAVAILABLE = "SUBGRAPH_UNAVAILABLE";
    static final String SUBGRAPH_FETCH_FAILED = "SUBGRAPH_FETCH_FAILED";
    static final String TIMEOUT = "TIMEOUT";
    static final String DOWNSTREAM_SERVICE_ERROR = "DOWNSTREAM_SERVICE_ERROR";

    private static final String ENTITIES = "_entities";
    private static final String REPRESENTATIONS = "representations";
    private static final String TYPENAME = "__typename";

    private final SubgraphClient subgraphClient;
    private final SubgraphHealthMonitor healthMonitor;
    private final Executor fetchExecutor;
    private final ResponseShaper responseShaper;
    private final GatewayProperties properties;

    public FederatedExecutor(SubgraphClient subgraphClient,
                             SubgraphHealthMonitor healthMonitor,
                             @Qualifier("fetchExecutor") Executor fetchExecutor,
                             ResponseShaper responseShaper,
                             GatewayProperties properties) {
        this.subgraphClient = subgraphClient;
        this.healthMonitor = healthMonitor;
        this.fetchExecutor = fetchExecutor;
        this.responseShaper = responseShaper;
        this.properties = properties;
    }

    /**
     * Execute a plan.
     *
     * @param plan the plan
     * @param schema the schema snapshot the plan was built against
     * @param variables request variables
     * @return the shaped response, possibly partial
     */
    public GraphQLResponse execute(QueryPlan plan, ComposedSchema schema, Map<String, Object> variables) {
        Execution execution = new Execution(plan, schema, variables != null ? variables : Map.of());

        Map<Integer, CompletableFuture<Void>> futures = new HashMap<>();
        for (FetchNode node : plan.getNodes()) {
            CompletableFuture<?>[] dependencies = node.dependsOn().stream()
                .map(futures::get)
                .toArray(CompletableFuture[]::new);
            CompletableFuture<Void> task = CompletableFuture.allOf(dependencies)
                .thenComposeAsync(ignored -> execution.run(node), fetchExecutor)
                .exceptionally(error -> {
                    execution.failUnexpectedly(node, error);
                    return null;
                });
            futures.put(node.id(), task);
        }

        Duration requestTimeout = properties.getExecution().getRequestTimeout();
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
        try {
            all.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Request deadline of {} expired with {} of {} fetches outstanding",
                requestTimeout, plan.getNodes().size() - execution.finishedCount(), plan.getNodes().size());
            execution.expire("Request deadline of " + requestTimeout.toMillis() + "ms exceeded");
            futures.values().forEach(f -> f.cancel(true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.expire("Request was interrupted");
            futures.values().forEach(f -> f.cancel(true));
        } catch (ExecutionException e) {
            log.error("Unexpected failure while executing plan: {}", e.getMessage(), e);
            execution.expire("Execution failed: " + e.getMessage());
        }

        return responseShaper.shape(plan, schema, execution.data, execution.errorsSnapshot(), execution.variables);
    }

    /**
     * State of one request: the shared response tree and the collected errors, guarded by one lock.
     */
    private final class Execution {

        private final QueryPlan plan;
        private final ComposedSchema schema;
        private final Map<String, Object> variables;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final List<GatewayError> errors = new ArrayList<>();
        private final Set<Integer> finished = new HashSet<>();
        private final Object lock = new Object();
        private boolean closed;

        Execution(QueryPlan plan, ComposedSchema schema, Map<String, Object> variables) {
            this.plan = plan;
            this.schema = schema;
            this.variables = variables;
        }

        CompletableFuture<Void> run(FetchNode node) {
            Batch batch;
            synchronized (lock) {
                if (closed) {
                    return CompletableFuture.completedFuture(null);
                }
                batch = prepare(node);
                if (batch.occurrences.isEmpty()) {
                    finished.add(node.id());
                    return CompletableFuture.completedFuture(null);
                }
            }

            if (healthMonitor.isDown(node.subgraph())) {
                log.debug("Skipping fetch #{} to subgraph {}: subgraph is DOWN", node.id(), node.subgraph());
                fail(node, batch, "Subgraph '" + node.subgraph() + "' is unavailable", SUBGRAPH_UNAVAILABLE);
                return CompletableFuture.completedFuture(null);
            }
            if (node.unavailableAtPlanning()) {
                log.debug("Subgraph {} recovered since fetch #{} was planned", node.subgraph(), node.id());
            }

            SubgraphSchema subgraph = schema.subgraph(node.subgraph());
            if (subgraph == null) {
                fail(node, batch, "Subgraph '" + node.subgraph() + "' is not registered", SUBGRAPH_UNAVAILABLE);
                return CompletableFuture.completedFuture(null);
            }

            Map<String, Object> fetchVariables = new LinkedHashMap<>();
            for (String name : node.variableNames()) {
                if (variables.containsKey(name)) {
                    fetchVariables.put(name, variables.get(name));
                }
            }
            if (node.isEntity()) {
                fetchVariables.put(REPRESENTATIONS,
                    batch.representations.stream().map(EntityRepresentation::toMap).toList());
            }

            Duration fetchTimeout = properties.getExecution().getFetchTimeout();
            return CompletableFuture
                .supplyAsync(() -> subgraphClient.execute(node.subgraph(), subgraph.url(), node.document(),
                    fetchVariables, !node.mutation()), fetchExecutor)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                        if (cause instanceof TimeoutException) {
                            fail(node, batch, "Fetch from subgraph '" + node.subgraph() + "' timed out after "
                                + fetchTimeout.toMillis() + "ms", TIMEOUT);
                        } else {
                            fail(node, batch, cause.getMessage(), SUBGRAPH_FETCH_FAILED);
                        }
                    } else if (node.isEntity()) {
                        mergeEntities(node, batch, response);
                    } else {
                        mergeRoot(node, batch, response);
                    }
                    return null;
                });
        }

        /**
         * Collect the objects a node writes to and, for entity fetches, their representations.
         * Objects whose representation is invalid are nulled right away.
         */
        private Batch prepare(FetchNode node) {
            Batch batch = new Batch();
            for (EntityTarget target : node.targets()) {
                for (Located located : locate(target.path(), node.isEntity() ? node.typename() : null)) {
                    if (!node.isEntity()) {
                        batch.occurrences.add(new Occurrence(target, located.object(), located.path(), -1));
                        continue;
                    }
                    try {
                        EntityRepresentation representation = EntityRepresentation.of(node.typename(),
                            located.object(), target, node.subgraph(), located.path());
                        representation.validate(schema, node.subgraph(), located.path());
                        Integer index = batch.indexes.get(representation);
                        if (index == null) {
                            index = batch.representations.size();
                            batch.representations.add(representation);
                            batch.indexes.put(representation, index);
                        }
                        batch.occurrences.add(new Occurrence(target, located.object(), located.path(), index));
                    } catch (EntityResolutionException e) {
                        log.debug("Invalid representation at {}: {}", located.path(), e.getMessage());
                        nullContributed(target, located.object(), located.path(), e.getMessage(), e.getCode(),
                            node.subgraph());
                    }
                }
            }
            return batch;
        }

        private void mergeRoot(FetchNode node, Batch batch, SubgraphResponse response) {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                for (Map<String, Object> error : response.errors()) {
                    errors.add(subgraphError(error, pathOf(error), node.subgraph()));
                }
                Occurrence root = batch.occurrences.get(0);
                for (String key : root.target().responseKeys()) {
                    Object value = response.data() != null ? response.data().get(key) : null;
                    if (value == null && !hasErrorAt(List.of(key))) {
                        errors.add(GatewayError.of(firstMessage(response, "Subgraph '" + node.subgraph()
                            + "' returned no data"), List.of(key), SUBGRAPH_FETCH_FAILED, node.subgraph()));
                    }
                    mergeValue(data, key, value);
                }
                finished.add(node.id());
            }
        }

        @SuppressWarnings("unchecked")
        private void mergeEntities(FetchNode node, Batch batch, SubgraphResponse response) {
            Object entities = response.data() != null ? response.data().get(ENTITIES) : null;
            if (!(entities instanceof List<?> results) || results.size() != batch.representations.size()) {
                String message = entities instanceof List<?> list
                    ? "Subgraph '" + node.subgraph() + "' returned " + list.size() + " entities for "
                        + batch.representations.size() + " representations"
                    : firstMessage(response, "Subgraph '" + node.subgraph() + "' returned no entities");
                fail(node, batch, message, entities instanceof List ? "ENTITY_RESOLUTION_FAILED"
                    : SUBGRAPH_FETCH_FAILED);
                return;
            }

            Map<Integer, List<Map<String, Object>>> errorsByIndex = new HashMap<>();
            List<Map<String, Object>> unindexed = new ArrayList<>();
            for (Map<String, Object> error : response.errors()) {
                List<Object> path = pathOf(error);
                if (path.size() >= 2 && ENTITIES.equals(path.get(0)) && path.get(1) instanceof Number index) {
                    errorsByIndex.computeIfAbsent(index.intValue(), i -> new ArrayList<>()).add(error);
                } else {
                    unindexed.add(error);
                }
            }

            synchronized (lock) {
                if (closed) {
                    return;
                }
                for (Map<String, Object> error : unindexed) {
                    errors.add(subgraphError(error, List.of(), node.subgraph()));
                }
                for (Occurrence occurrence : batch.occurrences) {
                    List<Map<String, Object>> entityErrors = errorsByIndex.getOrDefault(occurrence.index(), List.of());
                    for (Map<String, Object> error : entityErrors) {
                        List<Object> path = new ArrayList<>(occurrence.path());
                        List<Object> relative = pathOf(error);
                        path.addAll(relative.subList(2, relative.size()));
                        errors.add(subgraphError(error, path, node.subgraph()));
                    }

                    Object entity = results.get(occurrence.index());
                    if (entity instanceof Map<?, ?> resolved) {
                        for (Map.Entry<String, Object> entry : ((Map<String, Object>) resolved).entrySet()) {
                            if (!TYPENAME.equals(entry.getKey())) {
                                mergeValue(occurrence.object(), entry.getKey(), entry.getValue());
                            }
                        }
                    } else if (entityErrors.isEmpty()) {
                        nullContributed(occurrence.target(), occurrence.object(), occurrence.path(),
                            "Subgraph '" + node.subgraph() + "' could not resolve " + node.typename()
                                + " at index " + occurrence.index(), "ENTITY_RESOLUTION_FAILED", node.subgraph());
                    } else {
                        occurrence.target().responseKeys().forEach(key -> occurrence.object().put(key, null));
                    }
                }
                finished.add(node.id());
            }
        }

        /**
         * Whole-fetch failure: null every contributed field of every target object.
         */
        private void fail(FetchNode node, Batch batch, String message, String code) {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                log.warn("Fetch #{} to subgraph {} failed ({}): {}", node.id(), node.subgraph(), code, message);
                for (Occurrence occurrence : batch.occurrences) {
                    nullContributed(occurrence.target(), occurrence.object(), occurrence.path(), message, code,
                        node.subgraph());
                }
                finished.add(node.id());
            }
        }

        void failUnexpectedly(FetchNode node, Throwable error) {
            log.error("Fetch #{} to subgraph {} failed unexpectedly: {}", node.id(), node.subgraph(),
                error.getMessage(), error);
            synchronized (lock) {
                if (closed) {
                    return;
                }
                String code = error instanceof FederationException federation
                    ? federation.getCode() : SUBGRAPH_FETCH_FAILED;
                for (EntityTarget target : node.targets()) {
                    for (Located located : locate(target.path(), node.isEntity() ? node.typename() : null)) {
                        nullMissing(target, located, String.valueOf(error.getMessage()), code, node.subgraph());
                    }
                }
                finished.add(node.id());
            }
        }

        /**
         * Deadline expiry: stop accepting results and mark incomplete branches.
         */
        void expire(String message) {
            synchronized (lock) {
                closed = true;
                for (FetchNode node : plan.getNodes()) {
                    if (finished.contains(node.id())) {
                        continue;
                    }
                    for (EntityTarget target : node.targets()) {
                        for (Located located : locate(target.path(), node.isEntity() ? node.typename() : null)) {
                            nullMissing(target, located, message, TIMEOUT, node.subgraph());
                        }
                    }
                }
            }
        }

        int finishedCount() {
            synchronized (lock) {
                return finished.size();
            }
        }

        List<GatewayError> errorsSnapshot() {
            synchronized (lock) {
                return new ArrayList<>(errors);
            }
        }

        private void nullMissing(EntityTarget target, Located located, String message, String code, String subgraph) {
            for (String key : target.responseKeys()) {
                if (located.object().get(key) == null) {
                    located.object().put(key, null);
                    List<Object> path = append(located.path(), key);
                    if (!hasErrorAt(path)) {
                        errors.add(GatewayError.of(message, path, code, subgraph));
                    }
                }
            }
        }

        private void nullContributed(EntityTarget target, Map<String, Object> object, List<Object> path,
                                     String message, String code, String subgraph) {
            for (String key : target.responseKeys()) {
                object.put(key, null);
                errors.add(GatewayError.of(message, append(path, key), code, subgraph));
            }
        }

        private boolean hasErrorAt(List<Object> path) {
            return errors.stream().anyMatch(e -> e.path().equals(path));
        }

        /**
         * Objects reachable from the response root through {@code path}; lists are walked.
         */
        private List<Located> locate(List<String> path, String typename) {
            List<Located> current = List.of(new Located(data, List.of()));
            for (String key : path) {
                List<Located> next = new ArrayList<>();
                for (Located located : current) {
                    flatten(located.object().get(key), append(located.path(), key), next);
                }
                current = next;
            }
            if (typename == null) {
                return current;
            }
            return current.stream().filter(l -> typename.equals(l.object().get(TYPENAME))).toList();
        }

        @SuppressWarnings("unchecked")
        private void flatten(Object value, List<Object> path, List<Located> into) {
            if (value instanceof Map<?, ?> map) {
                into.add(new Located((Map<String, Object>) map, path));
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    flatten(list.get(i), append(path, i), into);
                }
            }
        }
    }

    /**
     * Per-fetch representations and the objects that receive results.
     */
    private static final class Batch {
        final List<Occurrence> occurrences = new ArrayList<>();
        final List<EntityRepresentation> representations = new ArrayList<>();
        final Map<EntityRepresentation, Integer> indexes = new HashMap<>();
    }

    private record Occurrence(EntityTarget target, Map<String, Object> object, List<Object> path, int index) {
    }

    private record Located(Map<String, Object> object, List<Object> path) {
    }

    @SuppressWarnings("unchecked")
    private static void mergeValue(Map<String, Object> target, String key, Object value) {
        Object existing = target.get(key);
        if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) valueMap).entrySet()) {
                mergeValue((Map<String, Object>) existingMap, entry.getKey(), entry.getValue());
            }
        } else if (existing instanceof List<?> existingList && value instanceof List<?> valueList
            && existingList.size() == valueList.size()) {
            List<Object> merged = (List<Object>) existingList;
            for (int i = 0; i < valueList.size(); i++) {
                Object item = valueList.get(i);
                if (merged.get(i) instanceof Map<?, ?> existingItem && item instanceof Map<?, ?> itemMap) {
                    for (Map.Entry<String, Object> entry : ((Map<String, Object>) itemMap).entrySet()) {
                        mergeValue((Map<String, Object>) existingItem, entry.getKey(), entry.getValue());
                    }
                } else {
                    merged.set(i, item);
                }
            }
        } else {
            target.put(key, value);
        }
    }

    private static GatewayError subgraphError(Map<String, Object> error, List<Object> path, String subgraph) {
        Object extensions = error.get("extensions");
        Object code = extensions instanceof Map<?, ?> map ? map.get("code") : null;
        return GatewayError.of(String.valueOf(error.get("message")), path,
            code != null ? code.toString() : DOWNSTREAM_SERVICE_ERROR, subgraph);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> pathOf(Map<String, Object> error) {
        Object path = error.get("path");
        return path instanceof List<?> list ? (List<Object>) list : List.of();
    }

    private static String firstMessage(SubgraphResponse response, String fallback) {
        return response.hasErrors() ? String.valueOf(response.errors().get(0).get("message")) : fallback;
    }

    private static List<Object> append(List<Object> path, Object segment) {
        List<Object> result = new ArrayList<>(path.size() + 1);
        result.addAll(path);
        result.add(segment);
        return result;
    }
}
