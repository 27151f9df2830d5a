package io.medpack.integrator.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Room types the downstream engine knows how to build examinations in.
 *
 * <p>This is the engine's closed set; the validator checks against the configured facility set,
 * which is normally the same list. The exporter refuses anything not listed here.</p>
 */
public enum FacilityKind {
    DOCTOR_OFFICE("DoctorOffice"),
    LAB("Lab"),
    RADIOLOGY("Radiology"),
    OBSERVATION("Observation"),
    WARD("Ward"),
    INTENSIVE_CARE("IntensiveCare"),
    SPECIALIST_UNIT("SpecialistUnit");

    private final String displayName;

    FacilityKind(String displayName) {
        this.displayName = displayName;
    }

    @NotNull
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a facility by display name or enum name, case-insensitive.
     */
    @NotNull
    public static Optional<FacilityKind> fromName(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (FacilityKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Display names of every facility, in declaration order.
     */
    @NotNull
    public static List<String> displayNames() {
        return Arrays.stream(values())
            .map(FacilityKind::getDisplayName)
            .collect(Collectors.toList());
    }
}
