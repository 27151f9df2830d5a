package io.medpack.integrator.exception;

import io.medpack.integrator.model.EntityKind;

/**
 * Thrown by an exporter when an entity cannot be written in the target schema.
 * Reaching this means validation let something through.
 */
public class UnsupportedEntityShapeException extends IntegrationException {

    private final EntityKind kind;
    private final String entityId;

    public UnsupportedEntityShapeException(final EntityKind kind, final String entityId, final String reason) {
        super("Cannot export " + kind.name().toLowerCase() + " '" + entityId + "': " + reason);
        this.kind = kind;
        this.entityId = entityId;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getEntityId() {
        return entityId;
    }
}
