package ch.sbb.federation.gateway.planning;

import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.EnumValue;
import graphql.language.FloatValue;
import graphql.language.FragmentDefinition;
import graphql.language.IntValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.StringValue;
import graphql.language.Value;
import graphql.language.VariableDefinition;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable fetch DAG for one client operation.
 *
 * <p>Nodes are ordered so that every node comes after all of its dependencies. The client
 * operation and its fragments are kept for response shaping.</p>
 */
public final class QueryPlan {

    private final OperationDefinition.Operation operationType;
    private final String rootType;
    private final List<FetchNode> nodes;
    private final OperationDefinition operation;
    private final Map<String, FragmentDefinition> fragments;
    private final long generation;

    public QueryPlan(OperationDefinition.Operation operationType, String rootType, List<FetchNode> nodes,
                     OperationDefinition operation, Map<String, FragmentDefinition> fragments, long generation) {
        for (int i = 0; i < nodes.size(); i++) {
            FetchNode node = nodes.get(i);
            if (node.id() != i) {
                throw new IllegalArgumentException("Fetch node at position " + i + " has id " + node.id());
            }
            for (int dependency : node.dependsOn()) {
                if (dependency >= node.id()) {
                    throw new IllegalArgumentException(
                        "Fetch node " + node.id() + " depends on node " + dependency + " which does not precede it");
                }
            }
        }
        this.operationType = operationType;
        this.rootType = rootType;
        this.nodes = List.copyOf(nodes);
        this.operation = operation;
        this.fragments = Map.copyOf(fragments);
        this.generation = generation;
    }

    public OperationDefinition.Operation getOperationType() {
        return operationType;
    }

    public String getRootType() {
        return rootType;
    }

    public List<FetchNode> getNodes() {
        return nodes;
    }

    public FetchNode getNode(int id) {
        return nodes.get(id);
    }

    public OperationDefinition getOperation() {
        return operation;
    }

    public Map<String, FragmentDefinition> getFragments() {
        return fragments;
    }

    /**
     * Generation of the composed schema the plan was built against.
     */
    public long getGeneration() {
        return generation;
    }

    /**
     * The request variables completed with the default values the operation declares for
     * omitted variables. An explicit {@code null} is kept.
     */
    public Map<String, Object> withDefaultValues(Map<String, Object> variables) {
        Map<String, Object> result = new LinkedHashMap<>(variables != null ? variables : Map.of());
        for (VariableDefinition definition : operation.getVariableDefinitions()) {
            if (definition.getDefaultValue() != null && !result.containsKey(definition.getName())) {
                result.put(definition.getName(), literal(definition.getDefaultValue()));
            }
        }
        return result;
    }

    private static Object literal(Value<?> value) {
        if (value instanceof BooleanValue bool) {
            return bool.isValue();
        }
        if (value instanceof IntValue integer) {
            BigInteger number = integer.getValue();
            if (number.bitLength() < 32) {
                return number.intValue();
            }
            return number.longValue();
        }
        if (value instanceof FloatValue decimal) {
            return decimal.getValue().doubleValue();
        }
        if (value instanceof StringValue string) {
            return string.getValue();
        }
        if (value instanceof EnumValue enumValue) {
            return enumValue.getName();
        }
        if (value instanceof ArrayValue array) {
            List<Object> items = new ArrayList<>();
            array.getValues().forEach(item -> items.add(literal(item)));
            return items;
        }
        if (value instanceof ObjectValue object) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (ObjectField field : object.getObjectFields()) {
                fields.put(field.getName(), literal(field.getValue()));
            }
            return fields;
        }
        return null;
    }

    public boolean isMutation() {
        return operationType == OperationDefinition.Operation.MUTATION;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("QueryPlan[").append(operationType).append("]");
        for (FetchNode node : nodes) {
            sb.append("\n  #").append(node.id()).append(' ').append(node.kind()).append(" -> ").append(node.subgraph());
            if (node.typename() != null) {
                sb.append(" (").append(node.typename()).append(')');
            }
            if (!node.dependsOn().isEmpty()) {
                sb.append(" after ").append(node.dependsOn());
            }
        }
        return sb.toString();
    }
}
