package io.medpack.integrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * A symptom a patient can present.
 *
 * <p>A symptom is detected by one or more examinations and cured by exactly one treatment. The
 * treatment reference is nullable here only so that incomplete content can be loaded and
 * reported by the validator.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Symptom implements MedicalEntity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("department")
    @Nullable
    private final String department;

    @JsonProperty("examinations")
    @NotNull
    private final Set<String> examinationIds;

    @JsonProperty("treatment")
    @Nullable
    private final String treatmentId;

    @JsonProperty("is_main")
    private final boolean main;

    @JsonProperty("severity")
    @Nullable
    private final Integer severity;

    @JsonProperty("discomfort")
    @Nullable
    private final Integer discomfort;

    @JsonProperty("complication_risk")
    @Nullable
    private final Double complicationRisk;

    @JsonProperty("collapse_symptoms")
    @NotNull
    private final Set<String> collapseSymptomIds;

    @JsonProperty("package")
    @Nullable
    private final String packageTag;

    @JsonCreator
    public Symptom(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("name") @NotNull String name,
            @JsonProperty("department") @Nullable String department,
            @JsonProperty("examinations") @Nullable Collection<String> examinationIds,
            @JsonProperty("treatment") @Nullable String treatmentId,
            @JsonProperty("is_main") boolean main,
            @JsonProperty("severity") @Nullable Integer severity,
            @JsonProperty("discomfort") @Nullable Integer discomfort,
            @JsonProperty("complication_risk") @Nullable Double complicationRisk,
            @JsonProperty("collapse_symptoms") @Nullable Collection<String> collapseSymptomIds,
            @JsonProperty("package") @Nullable String packageTag) {
        this.id = Disease.requireText(id, "id");
        this.name = Disease.requireText(name, "name");
        this.department = department;
        this.examinationIds = Disease.copyOf(examinationIds);
        this.treatmentId = treatmentId == null || treatmentId.isBlank() ? null : treatmentId.trim();
        this.main = main;
        this.severity = severity;
        this.discomfort = discomfort;
        this.complicationRisk = complicationRisk;
        this.collapseSymptomIds = Disease.copyOf(collapseSymptomIds);
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
    public Set<String> getExaminationIds() {
        return examinationIds;
    }

    @Nullable
    public String getTreatmentId() {
        return treatmentId;
    }

    public boolean isMain() {
        return main;
    }

    @Nullable
    public Integer getSeverity() {
        return severity;
    }

    @Nullable
    public Integer getDiscomfort() {
        return discomfort;
    }

    @Nullable
    public Double getComplicationRisk() {
        return complicationRisk;
    }

    @NotNull
    public Set<String> getCollapseSymptomIds() {
        return collapseSymptomIds;
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
        return EntityKind.SYMPTOM;
    }

    public Symptom withId(@NotNull String newId) {
        return toBuilder().id(newId).build();
    }

    public Symptom withDepartment(@Nullable String newDepartment) {
        return toBuilder().department(newDepartment).build();
    }

    public Symptom withPackageTag(@Nullable String newPackageTag) {
        return toBuilder().packageTag(newPackageTag).build();
    }

    /**
     * Creates a copy with examination, treatment and collapse references rewritten.
     */
    public Symptom withReferences(
            @NotNull Collection<String> newExaminationIds,
            @Nullable String newTreatmentId,
            @NotNull Collection<String> newCollapseIds) {
        return toBuilder()
            .examinationIds(newExaminationIds)
            .treatmentId(newTreatmentId)
            .collapseSymptomIds(newCollapseIds)
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .department(department)
            .examinationIds(examinationIds)
            .treatmentId(treatmentId)
            .main(main)
            .severity(severity)
            .discomfort(discomfort)
            .complicationRisk(complicationRisk)
            .collapseSymptomIds(collapseSymptomIds)
            .packageTag(packageTag);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symptom symptom = (Symptom) o;
        return main == symptom.main
            && id.equals(symptom.id)
            && name.equals(symptom.name)
            && Objects.equals(department, symptom.department)
            && examinationIds.equals(symptom.examinationIds)
            && Objects.equals(treatmentId, symptom.treatmentId)
            && Objects.equals(severity, symptom.severity)
            && Objects.equals(discomfort, symptom.discomfort)
            && Objects.equals(complicationRisk, symptom.complicationRisk)
            && collapseSymptomIds.equals(symptom.collapseSymptomIds)
            && Objects.equals(packageTag, symptom.packageTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, department, examinationIds, treatmentId, main,
            severity, discomfort, complicationRisk, collapseSymptomIds, packageTag);
    }

    @Override
    public String toString() {
        return "Symptom{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", main=" + main +
            ", treatment='" + treatmentId + '\'' +
            ", package='" + packageTag + '\'' +
            '}';
    }

    /**
     * Builder for Symptom.
     */
    public static class Builder {
        private String id;
        private String name;
        private String department;
        private Collection<String> examinationIds;
        private String treatmentId;
        private boolean main;
        private Integer severity;
        private Integer discomfort;
        private Double complicationRisk;
        private Collection<String> collapseSymptomIds;
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

        public Builder examinationIds(Collection<String> examinationIds) {
            this.examinationIds = examinationIds;
            return this;
        }

        public Builder treatmentId(String treatmentId) {
            this.treatmentId = treatmentId;
            return this;
        }

        public Builder main(boolean main) {
            this.main = main;
            return this;
        }

        public Builder severity(Integer severity) {
            this.severity = severity;
            return this;
        }

        public Builder discomfort(Integer discomfort) {
            this.discomfort = discomfort;
            return this;
        }

        public Builder complicationRisk(Double complicationRisk) {
            this.complicationRisk = complicationRisk;
            return this;
        }

        public Builder collapseSymptomIds(Collection<String> collapseSymptomIds) {
            this.collapseSymptomIds = collapseSymptomIds;
            return this;
        }

        public Builder packageTag(String packageTag) {
            this.packageTag = packageTag;
            return this;
        }

        public Symptom build() {
            return new Symptom(id, name, department, examinationIds, treatmentId, main,
                severity, discomfort, complicationRisk, collapseSymptomIds, packageTag);
        }
    }
}
