package ch.sbb.federation.gateway.execution;

import ch.sbb.federation.gateway.error.EntityResolutionException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.ComposedType;
import ch.sbb.federation.gateway.planning.EntityTarget;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The typename and key payload sent to a subgraph's {@code _entities} field.
 *
 * <p>Equal representations are sent once per fetch.</p>
 *
 * @param typename entity type
 * @param keys key field values, in key order
 * @param required {@code @requires} field values
 */
public record EntityRepresentation(String typename, Map<String, Object> keys, Map<String, Object> required) {

    public EntityRepresentation {
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        required = required != null ? Collections.unmodifiableMap(new LinkedHashMap<>(required)) : Map.of();
    }

    /**
     * Build the representation of a response object for an entity target.
     *
     * @throws EntityResolutionException if a key field is missing or {@code null}
     */
    public static EntityRepresentation of(String typename, Map<String, Object> object, EntityTarget target,
                                          String subgraph, List<Object> path) {
        Map<String, Object> keys = new LinkedHashMap<>();
        for (Map.Entry<String, String> keyField : target.keyFields().entrySet()) {
            Object value = object.get(keyField.getValue());
            if (value == null) {
                throw new EntityResolutionException(subgraph, "Cannot resolve " + typename + " from subgraph '"
                    + subgraph + "': key field '" + keyField.getKey() + "' is missing", path);
            }
            keys.put(keyField.getKey(), value);
        }
        Map<String, Object> required = new LinkedHashMap<>();
        for (Map.Entry<String, String> requiredField : target.requiredFields().entrySet()) {
            required.put(requiredField.getKey(), object.get(requiredField.getValue()));
        }
        return new EntityRepresentation(typename, keys, required);
    }

    /**
     * Check the representation against the composed schema's key sets.
     *
     * @throws EntityResolutionException if the type is not an entity or no declared key matches
     */
    public void validate(ComposedSchema schema, String subgraph, List<Object> path) {
        ComposedType type = schema.type(typename);
        if (type == null || !type.isEntity()) {
            throw new EntityResolutionException(subgraph, "Type '" + typename + "' is not an entity", path);
        }
        boolean matches = type.keys().stream().anyMatch(key -> new HashSet<>(key).equals(keys.keySet()));
        if (!matches) {
            throw new EntityResolutionException(subgraph, "Representation of '" + typename + "' with fields "
                + keys.keySet() + " matches no declared key " + type.keys(), path);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("__typename", typename);
        map.putAll(keys);
        map.putAll(required);
        return map;
    }
}
