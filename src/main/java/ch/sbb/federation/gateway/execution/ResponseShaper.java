package ch.sbb.federation.gateway.execution;

import ch.sbb.federation.gateway.model.ComposedField;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.ComposedType;
import ch.sbb.federation.gateway.model.GatewayError;
import ch.sbb.federation.gateway.model.GraphQLResponse;
import ch.sbb.federation.gateway.model.TypeRef;
import ch.sbb.federation.gateway.planning.FieldCollector;
import ch.sbb.federation.gateway.planning.QueryPlan;
import graphql.language.Field;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes the merged subgraph data into the response the client asked for.
 *
 * <p>Walks the client operation, drops everything the planner added (key fields,
 * {@code __typename}, aliased helper fields), answers {@code __typename} and applies
 * GraphQL null propagation: a {@code null} in a non-null position nulls the nearest nullable
 * ancestor, up to {@code data} itself. A non-null violation is reported unless an error
 * already covers the path.</p>
 */
@Component
public class ResponseShaper {

    static final String NON_NULL_VIOLATION = "NON_NULL_VIOLATION";

    private static final Object PROPAGATE = new Object();

    /**
     * Shape the merged data.
     *
     * @param plan the executed plan
     * @param schema the schema the plan was built against
     * @param data merged subgraph data
     * @param errors errors collected during execution
     * @param variables request variables, used for {@code @skip} and {@code @include}
     * @return the client response
     */
    public GraphQLResponse shape(QueryPlan plan, ComposedSchema schema, Map<String, Object> data,
                                 List<GatewayError> errors, Map<String, Object> variables) {
        Shaping shaping = new Shaping(schema,
            new FieldCollector(schema, plan.getFragments(), plan.withDefaultValues(variables)), errors);
        Map<String, List<Field>> rootFields = shaping.collector.collect(plan.getOperation().getSelectionSet(),
            plan.getRootType());
        Object shaped = shaping.completeObject(plan.getRootType(), rootFields, data, List.of());

        @SuppressWarnings("unchecked")
        Map<String, Object> result = shaped == PROPAGATE ? null : (Map<String, Object>) shaped;
        return GraphQLResponse.of(result, shaping.errors);
    }

    private static final class Shaping {

        private final ComposedSchema schema;
        private final FieldCollector collector;
        private final List<GatewayError> errors;

        Shaping(ComposedSchema schema, FieldCollector collector, List<GatewayError> errors) {
            this.schema = schema;
            this.collector = collector;
            this.errors = new ArrayList<>(errors);
        }

        Object completeObject(String typeName, Map<String, List<Field>> fields, Map<String, Object> source,
                              List<Object> path) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, List<Field>> entry : fields.entrySet()) {
                String key = entry.getKey();
                Field first = entry.getValue().get(0);
                List<Object> fieldPath = append(path, key);

                if ("__typename".equals(first.getName())) {
                    result.put(key, typeName);
                    continue;
                }
                ComposedField field = schema.field(typeName, first.getName());
                if (field == null) {
                    result.put(key, null);
                    continue;
                }
                Object value = completeValue(typeName + "." + field.name(), field.type(), entry.getValue(),
                    source != null ? source.get(key) : null, fieldPath);
                if (value == PROPAGATE) {
                    return PROPAGATE;
                }
                result.put(key, value);
            }
            return result;
        }

        @SuppressWarnings("unchecked")
        private Object completeValue(String coordinate, TypeRef type, List<Field> fields, Object value,
                                     List<Object> path) {
            if (value == null) {
                return nullValue(coordinate, type, path);
            }

            if (type.isList()) {
                if (!(value instanceof List<?> list)) {
                    return nullValue(coordinate, type, path);
                }
                List<Object> items = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    Object item = completeValue(coordinate, type.elementType(), fields, list.get(i), append(path, i));
                    if (item == PROPAGATE) {
                        return type.nonNull() ? PROPAGATE : null;
                    }
                    items.add(item);
                }
                return items;
            }

            ComposedType named = schema.type(type.name());
            if (named == null || !named.kind().isComposite()) {
                return value;
            }
            if (!(value instanceof Map<?, ?>)) {
                return nullValue(coordinate, type, path);
            }
            Map<String, Object> object = (Map<String, Object>) value;
            String runtimeType = named.kind().isAbstract() ? (String) object.get("__typename") : named.name();
            if (runtimeType == null) {
                return nullValue(coordinate, type, path);
            }
            Object shaped = completeObject(runtimeType, collector.collectSubfields(fields, runtimeType), object, path);
            if (shaped == PROPAGATE) {
                return type.nonNull() ? PROPAGATE : null;
            }
            return shaped;
        }

        private Object nullValue(String coordinate, TypeRef type, List<Object> path) {
            if (!type.nonNull()) {
                return null;
            }
            if (!covered(path)) {
                errors.add(GatewayError.of("Cannot return null for non-nullable field " + coordinate, path,
                    NON_NULL_VIOLATION, null));
            }
            return PROPAGATE;
        }

        private boolean covered(List<Object> path) {
            for (GatewayError error : errors) {
                List<Object> errorPath = error.path();
                if (errorPath.isEmpty()) {
                    continue;
                }
                int common = Math.min(errorPath.size(), path.size());
                if (errorPath.subList(0, common).equals(path.subList(0, common))) {
                    return true;
                }
            }
            return false;
        }

        private static List<Object> append(List<Object> path, Object segment) {
            List<Object> result = new ArrayList<>(path.size() + 1);
            result.addAll(path);
            result.add(segment);
            return result;
        }
    }
}
