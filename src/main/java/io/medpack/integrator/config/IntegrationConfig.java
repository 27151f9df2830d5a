package io.medpack.integrator.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Map;

/**
 * Static configuration for content integration.
 *
 * All properties are read from application.properties with the prefix
 * "medpack.integration".
 */
@ConfigMapping(prefix = "medpack.integration")
public interface IntegrationConfig {

    /**
     * Facility (room type) names an examination may use.
     */
    @WithDefault("DoctorOffice,Lab,Radiology,Observation,Ward,IntensiveCare,SpecialistUnit")
    List<String> facilities();

    /**
     * Departments known to the engine in addition to those the loaded packages name.
     */
    @WithDefault("GeneralPractice")
    List<String> departments();

    /**
     * Weight configuration group.
     */
    Weight weight();

    /**
     * Similarity configuration group.
     */
    Similarity similarity();

    /**
     * Loader configuration group.
     */
    Loader loader();

    /**
     * Examination priority configuration group.
     */
    Priority priority();

    /**
     * Export configuration group.
     */
    Export export();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        double weightSum = similarity().weight().jaccard()
            + similarity().weight().containment()
            + similarity().weight().edit();
        if (Math.abs(weightSum - 1.0) > 0.01) {
            throw new IllegalArgumentException(
                String.format("Similarity weights must sum to 1.0, got %.3f (jaccard=%.2f, containment=%.2f, edit=%.2f)",
                    weightSum, similarity().weight().jaccard(), similarity().weight().containment(),
                    similarity().weight().edit())
            );
        }
        if (weight().total() <= 0) {
            throw new IllegalArgumentException(
                String.format("Total weight must be positive, got %.3f", weight().total())
            );
        }
    }

    /**
     * Disease frequency weights.
     */
    interface Weight {
        /**
         * Raw weight of a disease that declares none.
         * Default: 1.0
         */
        @WithDefault("1.0")
        double baseline();

        /**
         * Sum of all normalized disease weights.
         * Default: 1000
         */
        @WithDefault("1000")
        double total();

        /**
         * Share of the total weight per department, overridden by the directive file.
         */
        Map<String, Double> shares();
    }

    /**
     * Near-duplicate detection.
     */
    interface Similarity {
        /**
         * Name similarity at or above which two entities are flagged [0.0, 1.0].
         * Default: 0.75
         */
        @WithDefault("0.75")
        @Min(0)
        @Max(1)
        double threshold();

        Metric weight();

        interface Metric {
            @WithDefault("0.40")
            @Min(0)
            @Max(1)
            double jaccard();

            @WithDefault("0.25")
            @Min(0)
            @Max(1)
            double containment();

            @WithDefault("0.35")
            @Min(0)
            @Max(1)
            double edit();
        }
    }

    interface Loader {
        /**
         * Number of packages read concurrently.
         * Default: 4
         */
        @WithDefault("4")
        @Min(1)
        int threads();
    }

    interface Priority {
        /**
         * Priority given to the last examination group.
         * Default: 25
         */
        @WithDefault("25")
        @Min(0)
        int floor();
    }

    interface Export {
        /**
         * Output format when none is requested: xml or json.
         */
        @WithName("format")
        @WithDefault("xml")
        String defaultFormat();
    }
}
