package io.medpack.integrator.resolve;

import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.MedicalEntity;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * One package's definition of an entity, before merging.
 *
 * @param packageTag     authoring package
 * @param priority       authoring package's merge priority
 * @param entity         the definition as loaded
 * @param normalizedName name after {@link NameNormalizer}
 */
record Candidate(
    @NotNull String packageTag,
    int priority,
    @NotNull MedicalEntity entity,
    @NotNull String normalizedName
) {

    /**
     * Canonical-first order: highest priority, then smallest package tag, then smallest id.
     */
    static final Comparator<Candidate> CANONICAL_ORDER = Comparator
        .comparingInt(Candidate::priority).reversed()
        .thenComparing(Candidate::packageTag)
        .thenComparing(Candidate::id);

    static String qualify(String packageTag, String id) {
        return packageTag + ":" + id;
    }

    String id() {
        return entity.getId();
    }

    EntityKind kind() {
        return entity.getKind();
    }

    String qualifiedId() {
        return qualify(packageTag, entity.getId());
    }
}
