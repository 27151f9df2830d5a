package io.medpack.integrator.validate;

/**
 * Kinds of problems found in a content graph.
 *
 * <p>Hard violations stop the pipeline before export; the others are reported as warnings.</p>
 */
public enum ViolationType {
    DUPLICATE_MAIN_SYMPTOM(true),
    MISSING_TREATMENT(true),
    UNCOVERED_SYMPTOM(true),
    UNKNOWN_FACILITY(true),
    DANGLING_REFERENCE(true),
    MAIN_SYMPTOM_NOT_FLAGGED(true),
    MAIN_FLAG_ON_SECONDARY(true),
    ZERO_WEIGHT(false),
    DUPLICATE_DEFINITION(false),
    NEAR_DUPLICATE(false);

    private final boolean hard;

    ViolationType(boolean hard) {
        this.hard = hard;
    }

    public boolean isHard() {
        return hard;
    }
}
