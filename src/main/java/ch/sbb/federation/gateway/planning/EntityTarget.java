package ch.sbb.federation.gateway.planning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a fetch node's results go in the response tree.
 *
 * <p>For an entity fetch, {@code path} leads from the response root to the parent
 * objects (lists are walked transparently); {@code keyFields} and {@code requiredFields}
 * map each field name of the representation to the response key it was selected under.
 * For a root fetch the path is empty and only {@code responseKeys} is set.</p>
 *
 * @param path response keys leading to the target objects
 * @param keyFields key field name to response key
 * @param requiredFields {@code @requires} field name to response key
 * @param responseKeys response keys this fetch contributes to each target object
 */
public record EntityTarget(
    List<String> path,
    Map<String, String> keyFields,
    Map<String, String> requiredFields,
    List<String> responseKeys
) {

    public EntityTarget {
        path = List.copyOf(path);
        keyFields = Collections.unmodifiableMap(new LinkedHashMap<>(keyFields));
        requiredFields = Collections.unmodifiableMap(new LinkedHashMap<>(requiredFields));
        responseKeys = List.copyOf(responseKeys);
    }

    public static EntityTarget root(List<String> responseKeys) {
        return new EntityTarget(List.of(), Map.of(), Map.of(), responseKeys);
    }
}
