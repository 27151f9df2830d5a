package io.medpack.integrator.priority;

import io.medpack.integrator.model.Examination;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Set;

/**
 * Where and how an examination is carried out, from cheapest to most involved.
 * Declaration order is the rank used for prioritizing.
 */
public enum ExamCategory {
    OFFICE_NO_EQUIPMENT("office_no_equipment"),
    OFFICE_SIMPLE_EQUIPMENT("office_simple_equipment"),
    OBSERVATION("observation"),
    LAB("lab"),
    IMAGING("imaging");

    /**
     * Equipment tags that do not count as equipment.
     */
    private static final Set<String> IGNORED_EQUIPMENT = Set.of("sit_exam", "clean_hands");
    private static final Set<String> OBSERVATION_KEYS = Set.of("observation", "trauma", "ward", "hdu", "icu", "intensive");
    private static final Set<String> IMAGING_KEYS = Set.of(
        "xray", "radiology", "ct", "mri", "usg", "ultrasound", "echo", "angiography", "endoscopy",
        "cardio", "neuro", "orthoped", "urology", "dermatology");

    private final String label;

    ExamCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public int rank() {
        return ordinal();
    }

    /**
     * Classifies an examination by its lab peers, facility and equipment.
     *
     * <p>An examination with lab peers is always a lab examination. Otherwise the facility name
     * decides; a facility that says nothing falls back to the office categories, split by whether
     * any real equipment is required.</p>
     */
    @NotNull
    public static ExamCategory classify(@NotNull Examination examination) {
        if (!examination.getLabPeerIds().isEmpty()) {
            return LAB;
        }

        boolean equipped = examination.getRequiredEquipment().stream()
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .anyMatch(tag -> !IGNORED_EQUIPMENT.contains(tag));
        ExamCategory office = equipped ? OFFICE_SIMPLE_EQUIPMENT : OFFICE_NO_EQUIPMENT;

        String facility = examination.getFacility().toLowerCase(Locale.ROOT);
        if (facility.endsWith("lab")) {
            return LAB;
        }
        if (facility.contains("office")) {
            return office;
        }
        if (OBSERVATION_KEYS.stream().anyMatch(facility::contains)) {
            return OBSERVATION;
        }
        if (facility.startsWith("room") || facility.startsWith("workspace") || facility.startsWith("unit")
                || facility.endsWith("room") || facility.endsWith("workspace") || facility.endsWith("unit")
                || IMAGING_KEYS.stream().anyMatch(facility::contains)) {
            return IMAGING;
        }
        return office;
    }
}
