package io.medpack.integrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

/**
 * Whether a treatment is a surgery.
 */
public enum TreatmentKind {
    SURGICAL("Surgical"),
    NON_SURGICAL("NonSurgical");

    private final String wireName;

    TreatmentKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Parses the authored kind; accepts the wire name, the enum name, and the legacy
     * {@code SURGERY} spelling, case-insensitive.
     *
     * @return the kind, or null when value is blank
     */
    @JsonCreator
    @Nullable
    public static TreatmentKind fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace("-", "_").replace(" ", "_").toUpperCase();
        switch (normalized) {
            case "SURGICAL":
            case "SURGERY":
                return SURGICAL;
            case "NONSURGICAL":
            case "NON_SURGICAL":
            case "MEDICATION":
                return NON_SURGICAL;
            default:
                throw new IllegalArgumentException(
                    "Invalid treatment kind: '" + value + "'. Valid values: Surgical, NonSurgical");
        }
    }
}
