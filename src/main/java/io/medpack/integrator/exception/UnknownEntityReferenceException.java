package io.medpack.integrator.exception;

import io.medpack.integrator.model.EntityKind;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a merge or reassignment directive names an entity that does not exist.
 */
public class UnknownEntityReferenceException extends IntegrationException {

    private final EntityKind kind;
    private final String entityId;

    public UnknownEntityReferenceException(@Nullable final EntityKind kind, final String entityId) {
        super(kind == null
            ? "Unknown entity '" + entityId + "'"
            : "Unknown " + kind.name().toLowerCase() + " '" + entityId + "'");
        this.kind = kind;
        this.entityId = entityId;
    }

    @Nullable
    public EntityKind getKind() {
        return kind;
    }

    public String getEntityId() {
        return entityId;
    }
}
