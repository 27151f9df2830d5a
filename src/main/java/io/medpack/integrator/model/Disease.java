package io.medpack.integrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A disease (medical condition) a patient can be generated with.
 *
 * <p>Every disease has exactly one main symptom; the disease is cured exactly when that symptom
 * is cured. Secondary symptoms only add to the clinical picture.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Disease implements MedicalEntity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("department")
    @Nullable
    private final String department;

    @JsonProperty("main_symptom")
    @NotNull
    private final String mainSymptomId;

    @JsonProperty("secondary_symptoms")
    @NotNull
    private final Set<String> secondarySymptomIds;

    @JsonProperty("frequency_weight")
    @Nullable
    private final Double frequencyWeight;

    @JsonProperty("treatment_cost")
    @Nullable
    private final Integer treatmentCost;

    @JsonProperty("tags")
    @NotNull
    private final Set<String> tags;

    @JsonProperty("package")
    @Nullable
    private final String packageTag;

    @JsonCreator
    public Disease(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("name") @NotNull String name,
            @JsonProperty("department") @Nullable String department,
            @JsonProperty("main_symptom") @NotNull String mainSymptomId,
            @JsonProperty("secondary_symptoms") @Nullable Collection<String> secondarySymptomIds,
            @JsonProperty("frequency_weight") @Nullable Double frequencyWeight,
            @JsonProperty("treatment_cost") @Nullable Integer treatmentCost,
            @JsonProperty("tags") @Nullable Collection<String> tags,
            @JsonProperty("package") @Nullable String packageTag) {
        this.id = requireText(id, "id");
        this.name = requireText(name, "name");
        this.department = department;
        this.mainSymptomId = requireText(mainSymptomId, "main_symptom of disease " + id);
        this.secondarySymptomIds = copyOf(secondarySymptomIds);
        this.frequencyWeight = frequencyWeight;
        this.treatmentCost = treatmentCost;
        this.tags = copyOf(tags);
        this.packageTag = packageTag;
    }

    @Override
    @NotNull
    public String getId() {
        return id;
    }

    @Override
    @NotNull
    public String getName() {
        return name;
    }

    @Nullable
    public String getDepartment() {
        return department;
    }

    @NotNull
    public String getMainSymptomId() {
        return mainSymptomId;
    }

    @NotNull
    public Set<String> getSecondarySymptomIds() {
        return secondarySymptomIds;
    }

    @Nullable
    public Double getFrequencyWeight() {
        return frequencyWeight;
    }

    @Nullable
    public Integer getTreatmentCost() {
        return treatmentCost;
    }

    @NotNull
    public Set<String> getTags() {
        return tags;
    }

    @Override
    @Nullable
    public String getPackageTag() {
        return packageTag;
    }

    @Override
    @JsonIgnore
    @NotNull
    public EntityKind getKind() {
        return EntityKind.DISEASE;
    }

    /**
     * All symptoms the disease references, main symptom first.
     */
    @JsonIgnore
    @NotNull
    public Set<String> getAllSymptomIds() {
        Set<String> all = new LinkedHashSet<>();
        all.add(mainSymptomId);
        all.addAll(secondarySymptomIds);
        return all;
    }

    /**
     * Returns true when the given set of cured symptoms cures this disease.
     */
    public boolean isCuredBy(@NotNull Set<String> curedSymptomIds) {
        return curedSymptomIds.contains(mainSymptomId);
    }

    public boolean hasAnyTag(@NotNull Collection<String> candidates) {
        for (String candidate : candidates) {
            for (String tag : tags) {
                if (tag.equalsIgnoreCase(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    public Disease withId(@NotNull String newId) {
        return toBuilder().id(newId).build();
    }

    public Disease withDepartment(@Nullable String newDepartment) {
        return toBuilder().department(newDepartment).build();
    }

    public Disease withFrequencyWeight(@Nullable Double newWeight) {
        return toBuilder().frequencyWeight(newWeight).build();
    }

    public Disease withPackageTag(@Nullable String newPackageTag) {
        return toBuilder().packageTag(newPackageTag).build();
    }

    /**
     * Creates a copy with main and secondary symptom references rewritten.
     */
    public Disease withSymptoms(@NotNull String newMainSymptomId, @NotNull Collection<String> newSecondaryIds) {
        return toBuilder().mainSymptomId(newMainSymptomId).secondarySymptomIds(newSecondaryIds).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .department(department)
            .mainSymptomId(mainSymptomId)
            .secondarySymptomIds(secondarySymptomIds)
            .frequencyWeight(frequencyWeight)
            .treatmentCost(treatmentCost)
            .tags(tags)
            .packageTag(packageTag);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Disease disease = (Disease) o;
        return id.equals(disease.id)
            && name.equals(disease.name)
            && Objects.equals(department, disease.department)
            && mainSymptomId.equals(disease.mainSymptomId)
            && secondarySymptomIds.equals(disease.secondarySymptomIds)
            && Objects.equals(frequencyWeight, disease.frequencyWeight)
            && Objects.equals(treatmentCost, disease.treatmentCost)
            && tags.equals(disease.tags)
            && Objects.equals(packageTag, disease.packageTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, department, mainSymptomId, secondarySymptomIds,
            frequencyWeight, treatmentCost, tags, packageTag);
    }

    @Override
    public String toString() {
        return "Disease{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", department='" + department + '\'' +
            ", mainSymptom='" + mainSymptomId + '\'' +
            ", package='" + packageTag + '\'' +
            '}';
    }

    static String requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    static Set<String> copyOf(@Nullable Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * Builder for Disease.
     */
    public static class Builder {
        private String id;
        private String name;
        private String department;
        private String mainSymptomId;
        private Collection<String> secondarySymptomIds;
        private Double frequencyWeight;
        private Integer treatmentCost;
        private Collection<String> tags;
        private String packageTag;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder mainSymptomId(String mainSymptomId) {
            this.mainSymptomId = mainSymptomId;
            return this;
        }

        public Builder secondarySymptomIds(Collection<String> secondarySymptomIds) {
            this.secondarySymptomIds = secondarySymptomIds;
            return this;
        }

        public Builder frequencyWeight(Double frequencyWeight) {
            this.frequencyWeight = frequencyWeight;
            return this;
        }

        public Builder treatmentCost(Integer treatmentCost) {
            this.treatmentCost = treatmentCost;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder packageTag(String packageTag) {
            this.packageTag = packageTag;
            return this;
        }

        public Disease build() {
            return new Disease(id, name, department, mainSymptomId, secondarySymptomIds,
                frequencyWeight, treatmentCost, tags, packageTag);
        }
    }
}
