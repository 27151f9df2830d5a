package io.medpack.integrator.validate;

import io.medpack.integrator.model.EntityKind;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A single problem found in the content graph.
 *
 * @param type       what is wrong
 * @param kind       kind of the offending entity
 * @param entityId   id of the offending entity
 * @param message    curator-facing description
 * @param relatedIds other entities involved, sorted
 */
public record Violation(
    @NotNull ViolationType type,
    @NotNull EntityKind kind,
    @NotNull String entityId,
    @NotNull String message,
    @NotNull List<String> relatedIds
) {

    public Violation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        relatedIds = relatedIds == null ? List.of() : List.copyOf(relatedIds);
    }

    public static Violation of(ViolationType type, EntityKind kind, String entityId, String message) {
        return new Violation(type, kind, entityId, message, List.of());
    }

    public boolean isHard() {
        return type.isHard();
    }

    /**
     * Formats the violation for log output.
     */
    public String toLogString() {
        return String.format("%s %s '%s': %s", type, kind.name().toLowerCase(), entityId, message);
    }
}
