package io.medpack.integrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.jetbrains.annotations.Nullable;

/**
 * The four kinds of medical content a package can define.
 */
public enum EntityKind {
    DISEASE("diseases"),
    SYMPTOM("symptoms"),
    EXAMINATION("examinations"),
    TREATMENT("treatments");

    private final String collectionName;

    EntityKind(String collectionName) {
        this.collectionName = collectionName;
    }

    /**
     * Name of the JSON collection (and per-kind file stem) holding entities of this kind.
     */
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Parses a kind from string, case-insensitive.
     *
     * @param value the string value
     * @return matching kind
     * @throws IllegalArgumentException if value doesn't match any kind
     */
    @JsonCreator
    public static EntityKind fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind must not be blank");
        }
        try {
            return valueOf(value.toUpperCase().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid entity kind: '" + value + "'. Valid values: disease, symptom, examination, treatment"
            );
        }
    }
}
