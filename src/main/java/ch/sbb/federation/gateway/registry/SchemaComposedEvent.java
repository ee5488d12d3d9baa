package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.model.ComposedSchema;

/**
 * Published after a new composed schema has been swapped in.
 */
public record SchemaComposedEvent(ComposedSchema schema) {

    public long generation() {
        return schema.generation();
    }
}
