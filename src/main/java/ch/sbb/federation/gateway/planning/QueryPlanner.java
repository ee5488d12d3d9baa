package ch.sbb.federation.gateway.planning;

import ch.sbb.federation.gateway.error.PlanningException;
import ch.sbb.federation.gateway.model.ComposedField;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.ComposedType;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.model.SubgraphType;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.AstPrinter;
import graphql.language.Directive;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.InlineFragment;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a client operation into a {@link QueryPlan}.
 *
 * <p>Root fields are grouped by the subgraph resolving them. Inside a fetch, every field the
 * fetch's subgraph can resolve stays local; any other field of an entity becomes an
 * {@code _entities} fetch against a resolving subgraph, depending on the fetch that returns
 * the entity. The parent fetch is extended with {@code __typename}, the key fields and the
 * {@code @requires} fields needed to build representations. Entity fetches on the same DAG
 * level targeting the same subgraph and type are merged into one.</p>
 *
 * <p>Health never makes planning fail: subgraphs that are {@code DOWN} are avoided when another
 * resolver exists and otherwise planned as usual with the node flagged.</p>
 */
@Component
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    static final String REPRESENTATIONS = "representations";
    static final String ENTITIES = "_entities";
    static final String TYPENAME = "__typename";
    static final String ALIAS_PREFIX = "_fed_";

    /**
     * Plan an operation.
     *
     * @param schema the composed schema snapshot
     * @param document the parsed client document
     * @param operationName the operation to run, may be {@code null} for single-operation documents
     * @param downSubgraphs subgraphs currently {@code DOWN}
     * @return the plan
     * @throws PlanningException if the operation is invalid against the schema
     */
    public QueryPlan plan(ComposedSchema schema, Document document, String operationName, Set<String> downSubgraphs) {
        OperationDefinition operation = selectOperation(document, operationName);
        Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
        for (FragmentDefinition fragment : document.getDefinitionsOfType(FragmentDefinition.class)) {
            fragments.put(fragment.getName(), fragment);
        }

        String rootType = switch (operation.getOperation()) {
            case QUERY -> ComposedSchema.QUERY;
            case MUTATION -> ComposedSchema.MUTATION;
            case SUBSCRIPTION -> throw new PlanningException("Subscriptions are not supported by the gateway");
        };
        if (schema.type(rootType) == null) {
            throw new PlanningException("The federated schema does not define a " + rootType + " type");
        }

        Planning planning = new Planning(schema, operation, fragments, downSubgraphs);
        planning.planRoot(rootType);
        List<FetchNode> nodes = planning.finish();

        QueryPlan plan = new QueryPlan(operation.getOperation(), rootType, nodes, operation, fragments,
            schema.generation());
        log.debug("Planned {}", plan);
        return plan;
    }

    private OperationDefinition selectOperation(Document document, String operationName) {
        List<OperationDefinition> operations = document.getDefinitionsOfType(OperationDefinition.class);
        if (operations.isEmpty()) {
            throw new PlanningException("The document does not contain an operation");
        }
        if (operationName == null || operationName.isBlank()) {
            if (operations.size() > 1) {
                throw new PlanningException("An operation name is required when the document contains "
                    + operations.size() + " operations");
            }
            return operations.get(0);
        }
        return operations.stream()
            .filter(op -> operationName.equals(op.getName()))
            .findFirst()
            .orElseThrow(() -> new PlanningException("Unknown operation named '" + operationName + "'"));
    }

    /**
     * Mutable state of one planning run.
     */
    private static final class Planning {

        private final ComposedSchema schema;
        private final OperationDefinition operation;
        private final FieldCollector collector;
        private final Set<String> down;
        private final Map<String, VariableDefinition> variableDefinitions = new LinkedHashMap<>();

        private final List<NodeBuilder> nodes = new ArrayList<>();
        private final Map<String, NodeBuilder> entityNodes = new HashMap<>();
        private final Deque<NodeBuilder> pending = new ArrayDeque<>();

        Planning(ComposedSchema schema, OperationDefinition operation, Map<String, FragmentDefinition> fragments,
                 Set<String> down) {
            this.schema = schema;
            this.operation = operation;
            this.collector = new FieldCollector(schema, fragments, null);
            this.down = down != null ? down : Set.of();
            operation.getVariableDefinitions().forEach(v -> variableDefinitions.put(v.getName(), v));
        }

        void planRoot(String rootType) {
            Map<String, List<Field>> rootFields = collector.collect(operation.getSelectionSet(), rootType);
            boolean mutation = operation.getOperation() == OperationDefinition.Operation.MUTATION;

            List<RootGroup> groups = new ArrayList<>();
            for (Map.Entry<String, List<Field>> entry : rootFields.entrySet()) {
                String key = entry.getKey();
                String name = entry.getValue().get(0).getName();
                if (TYPENAME.equals(name)) {
                    continue;
                }
                if (name.startsWith("__")) {
                    throw new PlanningException("Introspection field '" + name + "' is not supported by the gateway",
                        List.of(key));
                }
                ComposedField field = schema.field(rootType, name);
                if (field == null) {
                    throw unknownField(rootType, name, List.of(key));
                }
                String subgraph = chooseResolver(field);

                RootGroup group = null;
                if (mutation) {
                    RootGroup last = groups.isEmpty() ? null : groups.get(groups.size() - 1);
                    if (last != null && last.subgraph.equals(subgraph)) {
                        group = last;
                    }
                } else {
                    group = groups.stream().filter(g -> g.subgraph.equals(subgraph)).findFirst().orElse(null);
                }
                if (group == null) {
                    group = new RootGroup(subgraph);
                    groups.add(group);
                }
                group.fields.put(key, entry.getValue());
            }

            NodeBuilder previous = null;
            for (RootGroup group : groups) {
                NodeBuilder node = newNode(group.subgraph, FetchNode.Kind.ROOT, null);
                node.mutation = mutation;
                if (mutation && previous != null) {
                    node.dependsOn.add(previous.id);
                }
                node.targets.add(new TargetBuilder(List.of()));
                node.targets.get(0).responseKeys.addAll(group.fields.keySet());
                node.selections = buildSelections(node, rootType, group.fields, List.of(), false, Set.of());
                previous = node;
            }

            while (!pending.isEmpty()) {
                NodeBuilder entity = pending.poll();
                TargetBuilder target = entity.targets.get(0);
                entity.selections = buildSelections(entity, entity.typename, entity.fields, target.path, true,
                    Set.of());
            }
        }

        private List<Selection<?>> buildSelections(NodeBuilder node, String parentType,
                                                   Map<String, List<Field>> fields, List<String> path,
                                                   boolean entityTopLevel, Set<String> provided) {
            List<Selection<?>> selections = new ArrayList<>();
            Map<NodeBuilder, Set<String>> jumps = new LinkedHashMap<>();

            for (Map.Entry<String, List<Field>> entry : fields.entrySet()) {
                String key = entry.getKey();
                List<Field> group = entry.getValue();
                Field first = group.get(0);
                List<String> fieldPath = append(path, key);

                if (TYPENAME.equals(first.getName())) {
                    selections.add(Field.newField(TYPENAME).alias(first.getAlias())
                        .directives(first.getDirectives()).build());
                    continue;
                }

                ComposedField field = schema.field(parentType, first.getName());
                if (field == null) {
                    throw unknownField(parentType, first.getName(), new ArrayList<>(fieldPath));
                }

                if (canResolve(node, field, entityTopLevel, provided)) {
                    selections.add(planField(node, field, group, fieldPath));
                    continue;
                }

                NodeBuilder child = entityJump(node, parentType, field, path, fieldPath);
                child.fields.put(key, group);
                child.targets.get(0).responseKeys.add(key);
                jumps.computeIfAbsent(child, c -> new LinkedHashSet<>())
                    .addAll(field.requiresIn(child.subgraph));
            }

            for (Map.Entry<NodeBuilder, Set<String>> jump : jumps.entrySet()) {
                NodeBuilder child = jump.getKey();
                TargetBuilder target = child.targets.get(0);
                ensureField(node, selections, parentType, TYPENAME, path, provided);
                for (String keyField : keyFor(node, child, parentType, path)) {
                    target.keyFields.putIfAbsent(keyField,
                        ensureField(node, selections, parentType, keyField, path, provided));
                }
                for (String required : jump.getValue()) {
                    target.requiredFields.putIfAbsent(required,
                        ensureField(node, selections, parentType, required, path, provided));
                }
            }
            return selections;
        }

        private Field planField(NodeBuilder node, ComposedField field, List<Field> group, List<String> fieldPath) {
            Field first = group.get(0);
            collectVariables(first.getArguments(), node.variables);
            for (Directive directive : first.getDirectives()) {
                collectVariables(directive.getArguments(), node.variables);
            }

            Field.Builder builder = Field.newField(first.getName())
                .alias(first.getAlias())
                .arguments(first.getArguments())
                .directives(first.getDirectives());

            String returnTypeName = field.type().namedType();
            ComposedType returnType = schema.type(returnTypeName);
            if (returnType == null || !returnType.kind().isComposite()) {
                return builder.build();
            }

            Set<String> provided = new HashSet<>(field.providesIn(node.subgraph));
            List<Selection<?>> subSelections;
            if (returnType.kind().isAbstract()) {
                subSelections = new ArrayList<>();
                subSelections.add(new Field(TYPENAME));
                for (String possibleType : schema.possibleTypes(returnTypeName)) {
                    ComposedType concrete = schema.type(possibleType);
                    if (concrete == null || !concrete.subgraphs().contains(node.subgraph)) {
                        continue;
                    }
                    Map<String, List<Field>> collected = collector.collectSubfields(group, possibleType);
                    if (collected.isEmpty()) {
                        continue;
                    }
                    List<Selection<?>> inner = buildSelections(node, possibleType, collected, fieldPath, false,
                        provided);
                    subSelections.add(InlineFragment.newInlineFragment()
                        .typeCondition(new TypeName(possibleType))
                        .selectionSet(selectionSet(inner))
                        .build());
                }
            } else {
                Map<String, List<Field>> collected = collector.collectSubfields(group, returnTypeName);
                if (collected.isEmpty()) {
                    throw new PlanningException("Field '" + field.name() + "' of type '" + field.type()
                        + "' must have a selection of subfields", new ArrayList<>(fieldPath));
                }
                subSelections = buildSelections(node, returnTypeName, collected, fieldPath, false, provided);
            }
            return builder.selectionSet(selectionSet(subSelections)).build();
        }

        private boolean canResolve(NodeBuilder node, ComposedField field, boolean entityTopLevel,
                                   Set<String> provided) {
            if (provided.contains(field.name())) {
                return true;
            }
            if (!field.resolvableBy(node.subgraph)) {
                return false;
            }
            return field.requiresIn(node.subgraph).isEmpty() || entityTopLevel;
        }

        private NodeBuilder entityJump(NodeBuilder node, String parentType, ComposedField field,
                                       List<String> path, List<String> fieldPath) {
            if (path.isEmpty() || !schema.isEntity(parentType)) {
                throw new PlanningException("Field '" + parentType + "." + field.name()
                    + "' cannot be resolved from subgraph '" + node.subgraph + "' and type '" + parentType
                    + "' is not an entity", new ArrayList<>(fieldPath));
            }
            String target = chooseResolver(field);
            String nodeKey = node.id + "|" + String.join(".", path) + "|" + parentType + "|" + target;
            return entityNodes.computeIfAbsent(nodeKey, k -> {
                NodeBuilder child = newNode(target, FetchNode.Kind.ENTITY, parentType);
                child.dependsOn.add(node.id);
                child.targets.add(new TargetBuilder(path));
                pending.add(child);
                return child;
            });
        }

        /**
         * A key the target subgraph declares and the parent fetch can select.
         */
        private List<String> keyFor(NodeBuilder parent, NodeBuilder child, String typeName, List<String> path) {
            ComposedType type = schema.type(typeName);
            List<List<String>> candidates = new ArrayList<>();
            SubgraphSchema targetSubgraph = schema.subgraph(child.subgraph);
            SubgraphType declared = targetSubgraph != null ? targetSubgraph.type(typeName) : null;
            if (declared != null) {
                candidates.addAll(declared.keys());
            }
            candidates.addAll(type.keys());

            for (List<String> key : candidates) {
                boolean selectable = key.stream().allMatch(k -> {
                    ComposedField keyField = type.field(k);
                    return keyField != null && keyField.resolvableBy(parent.subgraph);
                });
                if (selectable) {
                    return key;
                }
            }
            throw new PlanningException("No key of entity '" + typeName + "' can be selected from subgraph '"
                + parent.subgraph + "' to resolve it in '" + child.subgraph + "'", new ArrayList<>(path));
        }

        /**
         * Make sure the selection contains a plain {@code fieldName}; returns its response key.
         */
        private String ensureField(NodeBuilder node, List<Selection<?>> selections, String parentType,
                                   String fieldName, List<String> path, Set<String> provided) {
            if (!TYPENAME.equals(fieldName)) {
                ComposedField field = schema.field(parentType, fieldName);
                if (field == null
                    || !(provided.contains(fieldName)
                        || field.resolvableBy(node.subgraph) && field.requiresIn(node.subgraph).isEmpty())) {
                    throw new PlanningException("Field '" + parentType + "." + fieldName
                        + "' is needed to resolve an entity but subgraph '" + node.subgraph
                        + "' cannot resolve it", new ArrayList<>(path));
                }
            }
            boolean taken = false;
            for (Selection<?> selection : selections) {
                if (selection instanceof Field existing) {
                    String responseKey = FieldCollector.responseKey(existing);
                    if (existing.getName().equals(fieldName) && existing.getArguments().isEmpty()
                        && existing.getDirectives().isEmpty() && existing.getSelectionSet() == null) {
                        return responseKey;
                    }
                    taken |= responseKey.equals(fieldName);
                }
            }
            Field added = taken
                ? Field.newField(fieldName).alias(ALIAS_PREFIX + fieldName.replace("__", "")).build()
                : new Field(fieldName);
            selections.add(added);
            return FieldCollector.responseKey(added);
        }

        private String chooseResolver(ComposedField field) {
            if (!down.contains(field.owner())) {
                return field.owner();
            }
            return field.resolvers().stream()
                .filter(s -> !down.contains(s))
                .findFirst()
                .orElse(field.owner());
        }

        private NodeBuilder newNode(String subgraph, FetchNode.Kind kind, String typename) {
            NodeBuilder node = new NodeBuilder(nodes.size(), subgraph, kind, typename);
            nodes.add(node);
            return node;
        }

        /**
         * Merge entity fetches per DAG level, renumber and render the nodes.
         */
        List<FetchNode> finish() {
            for (NodeBuilder node : nodes) {
                node.depth = node.dependsOn.stream().mapToInt(d -> nodes.get(d).depth + 1).max().orElse(0);
            }

            Map<Integer, NodeBuilder> redirect = new HashMap<>();
            Map<String, List<NodeBuilder>> levels = new LinkedHashMap<>();
            for (NodeBuilder node : nodes) {
                if (node.kind == FetchNode.Kind.ENTITY) {
                    levels.computeIfAbsent(node.depth + "|" + node.subgraph + "|" + node.typename,
                        k -> new ArrayList<>()).add(node);
                }
            }
            for (List<NodeBuilder> level : levels.values()) {
                List<NodeBuilder> merged = new ArrayList<>();
                for (NodeBuilder node : level) {
                    NodeBuilder into = merged.stream().filter(m -> m.canMerge(node)).findFirst().orElse(null);
                    if (into == null) {
                        merged.add(node);
                    } else {
                        into.merge(node);
                        redirect.put(node.id, into);
                    }
                }
            }

            List<NodeBuilder> surviving = nodes.stream()
                .filter(n -> !redirect.containsKey(n.id))
                .sorted(Comparator.comparingInt((NodeBuilder n) -> n.depth).thenComparingInt(n -> n.id))
                .toList();
            Map<Integer, Integer> renumbered = new HashMap<>();
            for (int i = 0; i < surviving.size(); i++) {
                renumbered.put(surviving.get(i).id, i);
            }

            List<FetchNode> result = new ArrayList<>();
            for (NodeBuilder node : surviving) {
                Set<Integer> dependencies = new LinkedHashSet<>();
                for (int dependency : node.dependsOn) {
                    NodeBuilder resolved = redirect.getOrDefault(dependency, nodes.get(dependency));
                    if (resolved != node) {
                        dependencies.add(renumbered.get(resolved.id));
                    }
                }
                result.add(node.build(renumbered.get(node.id), dependencies.stream().sorted().toList()));
            }
            return result;
        }

        private String render(NodeBuilder node) {
            List<VariableDefinition> definitions = new ArrayList<>();
            SelectionSet selectionSet;
            OperationDefinition.Operation operationType = node.mutation
                ? OperationDefinition.Operation.MUTATION : OperationDefinition.Operation.QUERY;

            if (node.kind == FetchNode.Kind.ENTITY) {
                if (variableDefinitions.containsKey(REPRESENTATIONS)) {
                    throw new PlanningException("Variable '$" + REPRESENTATIONS + "' is reserved by the gateway");
                }
                definitions.add(VariableDefinition.newVariableDefinition(REPRESENTATIONS,
                    new NonNullType(new ListType(new NonNullType(new TypeName("_Any"))))).build());
                Field entities = Field.newField(ENTITIES)
                    .arguments(List.of(new Argument(REPRESENTATIONS, new VariableReference(REPRESENTATIONS))))
                    .selectionSet(selectionSet(List.of(InlineFragment.newInlineFragment()
                        .typeCondition(new TypeName(node.typename))
                        .selectionSet(selectionSet(node.selections))
                        .build())))
                    .build();
                selectionSet = selectionSet(List.of(entities));
            } else {
                selectionSet = selectionSet(node.selections);
            }

            for (String variable : node.variables) {
                VariableDefinition definition = variableDefinitions.get(variable);
                if (definition == null) {
                    throw new PlanningException("Variable '$" + variable + "' is not defined by the operation");
                }
                definitions.add(definition);
            }

            OperationDefinition subOperation = OperationDefinition.newOperationDefinition()
                .operation(operationType)
                .variableDefinitions(definitions)
                .selectionSet(selectionSet)
                .build();
            return AstPrinter.printAst(Document.newDocument().definition(subOperation).build());
        }

        /**
         * A fetch node under construction.
         */
        private final class NodeBuilder {
            final int id;
            final String subgraph;
            final FetchNode.Kind kind;
            final String typename;
            final Map<String, List<Field>> fields = new LinkedHashMap<>();
            final Set<Integer> dependsOn = new LinkedHashSet<>();
            final Set<String> variables = new LinkedHashSet<>();
            final List<TargetBuilder> targets = new ArrayList<>();
            List<Selection<?>> selections = new ArrayList<>();
            boolean mutation;
            int depth;

            NodeBuilder(int id, String subgraph, FetchNode.Kind kind, String typename) {
                this.id = id;
                this.subgraph = subgraph;
                this.kind = kind;
                this.typename = typename;
            }

            /**
             * Two selections merge unless they use one response key for different fields.
             */
            boolean canMerge(NodeBuilder other) {
                Map<String, String> printed = printedByResponseKey(selections);
                for (Map.Entry<String, String> entry : printedByResponseKey(other.selections).entrySet()) {
                    String existing = printed.get(entry.getKey());
                    if (existing != null && !existing.equals(entry.getValue())) {
                        return false;
                    }
                }
                return true;
            }

            void merge(NodeBuilder other) {
                Set<String> present = new HashSet<>(printedByResponseKey(selections).values());
                List<Selection<?>> combined = new ArrayList<>(selections);
                for (Selection<?> selection : other.selections) {
                    if (!(selection instanceof Field field) || !present.contains(AstPrinter.printAst(field))) {
                        combined.add(selection);
                    }
                }
                selections = combined;
                targets.addAll(other.targets);
                dependsOn.addAll(other.dependsOn);
                variables.addAll(other.variables);
            }

            FetchNode build(int newId, List<Integer> dependencies) {
                List<EntityTarget> built = targets.stream().map(TargetBuilder::build).toList();
                return new FetchNode(newId, subgraph, kind, render(this), new ArrayList<>(variables), typename,
                    built, dependencies, mutation, down.contains(subgraph));
            }
        }
    }

    /**
     * Entity target under construction.
     */
    private static final class TargetBuilder {
        final List<String> path;
        final Map<String, String> keyFields = new LinkedHashMap<>();
        final Map<String, String> requiredFields = new LinkedHashMap<>();
        final List<String> responseKeys = new ArrayList<>();

        TargetBuilder(List<String> path) {
            this.path = path;
        }

        EntityTarget build() {
            return new EntityTarget(path, keyFields, requiredFields, responseKeys);
        }
    }

    private static final class RootGroup {
        final String subgraph;
        final Map<String, List<Field>> fields = new LinkedHashMap<>();

        RootGroup(String subgraph) {
            this.subgraph = subgraph;
        }
    }

    private static Map<String, String> printedByResponseKey(List<Selection<?>> selections) {
        Map<String, String> printed = new LinkedHashMap<>();
        for (Selection<?> selection : selections) {
            if (selection instanceof Field field) {
                printed.put(FieldCollector.responseKey(field), AstPrinter.printAst(field));
            }
        }
        return printed;
    }

    private static PlanningException unknownField(String typeName, String fieldName, List<Object> path) {
        return new PlanningException("Cannot query field '" + fieldName + "' on type '" + typeName + "'", path);
    }

    private static SelectionSet selectionSet(List<Selection<?>> selections) {
        return SelectionSet.newSelectionSet().selections(selections).build();
    }

    private static List<String> append(List<String> path, String key) {
        List<String> result = new ArrayList<>(path);
        result.add(key);
        return List.copyOf(result);
    }

    private static void collectVariables(List<Argument> arguments, Set<String> variables) {
        for (Argument argument : arguments) {
            collectVariables(argument.getValue(), variables);
        }
    }

    private static void collectVariables(Value<?> value, Set<String> variables) {
        if (value instanceof VariableReference reference) {
            variables.add(reference.getName());
        } else if (value instanceof ArrayValue array) {
            array.getValues().forEach(v -> collectVariables(v, variables));
        } else if (value instanceof ObjectValue object) {
            for (ObjectField objectField : object.getObjectFields()) {
                collectVariables(objectField.getValue(), variables);
            }
        }
    }
}
