package io.medpack.integrator.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A named, versioned bundle of content loaded together.
 *
 * <p>The merge priority decides which package supplies the canonical attributes when the same
 * concept is defined by several packages; higher wins.</p>
 *
 * @param tag          unique package tag
 * @param version      authored version string (may be null)
 * @param priority     curator-assigned merge priority
 * @param diseases     diseases defined by the package
 * @param symptoms     symptoms defined by the package
 * @param examinations examinations defined by the package
 * @param treatments   treatments defined by the package
 */
public record ContentPackage(
    @NotNull String tag,
    @Nullable String version,
    int priority,
    @NotNull List<Disease> diseases,
    @NotNull List<Symptom> symptoms,
    @NotNull List<Examination> examinations,
    @NotNull List<Treatment> treatments
) {

    public ContentPackage {
        Objects.requireNonNull(tag, "tag must not be null");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        diseases = List.copyOf(Objects.requireNonNull(diseases, "diseases must not be null"));
        symptoms = List.copyOf(Objects.requireNonNull(symptoms, "symptoms must not be null"));
        examinations = List.copyOf(Objects.requireNonNull(examinations, "examinations must not be null"));
        treatments = List.copyOf(Objects.requireNonNull(treatments, "treatments must not be null"));
    }

    /**
     * Total number of entity definitions across all four collections.
     */
    public int entityCount() {
        return diseases.size() + symptoms.size() + examinations.size() + treatments.size();
    }

    /**
     * Entities of one kind, in document order.
     */
    @NotNull
    public List<? extends MedicalEntity> entitiesOf(@NotNull EntityKind kind) {
        switch (kind) {
            case DISEASE:
                return diseases;
            case SYMPTOM:
                return symptoms;
            case EXAMINATION:
                return examinations;
            case TREATMENT:
                return treatments;
            default:
                throw new IllegalArgumentException("Unsupported kind: " + kind);
        }
    }
}
