package io.medpack.integrator.reassign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.medpack.integrator.model.EntityKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Moves one disease or symptom to another department.
 *
 * @param kind       DISEASE or SYMPTOM; when null the id is looked up among diseases first
 * @param entityId   canonical id of the entity
 * @param department target department
 */
public record MoveToDepartment(
    @JsonProperty("kind") @Nullable EntityKind kind,
    @JsonProperty("entity") @NotNull String entityId,
    @JsonProperty("department") @NotNull String department
) implements ReassignmentDirective {

    @JsonCreator
    public MoveToDepartment {
        Objects.requireNonNull(entityId, "entity must not be null");
        Objects.requireNonNull(department, "department must not be null");
        if (kind != null && kind != EntityKind.DISEASE && kind != EntityKind.SYMPTOM) {
            throw new IllegalArgumentException("Only diseases and symptoms belong to departments, got " + kind);
        }
    }

    public MoveToDepartment(String entityId, String department) {
        this(null, entityId, department);
    }

    @Override
    public String describe() {
        return "moveToDepartment " + entityId + " -> " + department;
    }
}
