package io.medpack.integrator.config;

import io.medpack.integrator.export.ExportFormat;
import io.medpack.integrator.model.FacilityKind;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable configuration for a single integration run.
 *
 * <p>Built once from {@link IntegrationConfig} and passed to every stage; tests build it with
 * {@link #builder()}.</p>
 *
 * @param facilities           facility names an examination may reference
 * @param departments          departments known in addition to those named by content
 * @param baselineWeight       raw weight of a disease without one
 * @param totalWeight          sum of all normalized disease weights
 * @param departmentShares     configured share per department (not yet renormalized)
 * @param similarityThreshold  near-duplicate threshold in [0, 1]
 * @param jaccardWeight        weight of token Jaccard similarity
 * @param containmentWeight    weight of token containment
 * @param editWeight           weight of edit-distance similarity
 * @param loaderThreads        packages read concurrently
 * @param priorityFloor        priority of the last examination group
 * @param exportFormat         default export format
 */
public record IntegrationSettings(
    @NotNull Set<String> facilities,
    @NotNull Set<String> departments,
    double baselineWeight,
    double totalWeight,
    @NotNull Map<String, Double> departmentShares,
    double similarityThreshold,
    double jaccardWeight,
    double containmentWeight,
    double editWeight,
    int loaderThreads,
    int priorityFloor,
    @NotNull ExportFormat exportFormat
) {

    public IntegrationSettings {
        facilities = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(facilities, "facilities")));
        departments = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(departments, "departments")));
        departmentShares = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(departmentShares, "departmentShares")));
        Objects.requireNonNull(exportFormat, "exportFormat");
        if (baselineWeight <= 0 || !Double.isFinite(baselineWeight)) {
            throw new IllegalArgumentException("baselineWeight must be positive, got " + baselineWeight);
        }
        if (totalWeight <= 0 || !Double.isFinite(totalWeight)) {
            throw new IllegalArgumentException("totalWeight must be positive, got " + totalWeight);
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [0.0, 1.0], got " + similarityThreshold);
        }
        if (loaderThreads < 1) {
            throw new IllegalArgumentException("loaderThreads must be at least 1, got " + loaderThreads);
        }
        for (Map.Entry<String, Double> share : departmentShares.entrySet()) {
            if (share.getValue() == null || share.getValue() < 0 || !Double.isFinite(share.getValue())) {
                throw new IllegalArgumentException(
                    "Share of department '" + share.getKey() + "' must be a non-negative number, got " + share.getValue());
            }
        }
    }

    /**
     * Reads the static configuration.
     */
    public static IntegrationSettings from(@NotNull IntegrationConfig config) {
        config.validate();
        return builder()
            .facilities(config.facilities())
            .departments(config.departments())
            .baselineWeight(config.weight().baseline())
            .totalWeight(config.weight().total())
            .departmentShares(config.weight().shares())
            .similarityThreshold(config.similarity().threshold())
            .jaccardWeight(config.similarity().weight().jaccard())
            .containmentWeight(config.similarity().weight().containment())
            .editWeight(config.similarity().weight().edit())
            .loaderThreads(config.loader().threads())
            .priorityFloor(config.priority().floor())
            .exportFormat(ExportFormat.fromString(config.export().defaultFormat()))
            .build();
    }

    /**
     * Settings with every default applied.
     */
    public static IntegrationSettings defaults() {
        return builder().build();
    }

    public boolean isKnownFacility(String facility) {
        return facility != null && facilities.contains(facility);
    }

    /**
     * Creates a copy whose department shares are the configured ones overridden by the given ones.
     */
    public IntegrationSettings withDepartmentShares(@NotNull Map<String, Double> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(departmentShares);
        merged.putAll(overrides);
        return toBuilder().departmentShares(merged).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .facilities(facilities)
            .departments(departments)
            .baselineWeight(baselineWeight)
            .totalWeight(totalWeight)
            .departmentShares(departmentShares)
            .similarityThreshold(similarityThreshold)
            .jaccardWeight(jaccardWeight)
            .containmentWeight(containmentWeight)
            .editWeight(editWeight)
            .loaderThreads(loaderThreads)
            .priorityFloor(priorityFloor)
            .exportFormat(exportFormat);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for IntegrationSettings. Defaults mirror {@link IntegrationConfig}.
     */
    public static class Builder {
        private Collection<String> facilities = FacilityKind.displayNames();
        private Collection<String> departments = List.of("GeneralPractice");
        private double baselineWeight = 1.0;
        private double totalWeight = 1000.0;
        private Map<String, Double> departmentShares = Map.of();
        private double similarityThreshold = 0.75;
        private double jaccardWeight = 0.40;
        private double containmentWeight = 0.25;
        private double editWeight = 0.35;
        private int loaderThreads = 4;
        private int priorityFloor = 25;
        private ExportFormat exportFormat = ExportFormat.XML;

        public Builder facilities(Collection<String> facilities) {
            this.facilities = facilities;
            return this;
        }

        public Builder departments(Collection<String> departments) {
            this.departments = departments;
            return this;
        }

        public Builder baselineWeight(double baselineWeight) {
            this.baselineWeight = baselineWeight;
            return this;
        }

        public Builder totalWeight(double totalWeight) {
            this.totalWeight = totalWeight;
            return this;
        }

        public Builder departmentShares(Map<String, Double> departmentShares) {
            this.departmentShares = departmentShares;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder jaccardWeight(double jaccardWeight) {
            this.jaccardWeight = jaccardWeight;
            return this;
        }

        public Builder containmentWeight(double containmentWeight) {
            this.containmentWeight = containmentWeight;
            return this;
        }

        public Builder editWeight(double editWeight) {
            this.editWeight = editWeight;
            return this;
        }

        public Builder loaderThreads(int loaderThreads) {
            this.loaderThreads = loaderThreads;
            return this;
        }

        public Builder priorityFloor(int priorityFloor) {
            this.priorityFloor = priorityFloor;
            return this;
        }

        public Builder exportFormat(ExportFormat exportFormat) {
            this.exportFormat = exportFormat;
            return this;
        }

        public IntegrationSettings build() {
            return new IntegrationSettings(
                new LinkedHashSet<>(facilities),
                new LinkedHashSet<>(departments),
                baselineWeight,
                totalWeight,
                departmentShares,
                similarityThreshold,
                jaccardWeight,
                containmentWeight,
                editWeight,
                loaderThreads,
                priorityFloor,
                exportFormat
            );
        }
    }
}
