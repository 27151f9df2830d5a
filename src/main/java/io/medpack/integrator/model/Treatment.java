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
 * A treatment that cures a symptom.
 *
 * <p>Surgical treatments may list complication symptoms; a kept surgery keeps those symptoms
 * reachable during pruning.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Treatment implements MedicalEntity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("kind")
    @Nullable
    private final TreatmentKind treatmentKind;

    @JsonProperty("hospitalization")
    private final boolean hospitalizationRequired;

    @JsonProperty("discomfort")
    @Nullable
    private final Integer discomfort;

    @JsonProperty("complications")
    @NotNull
    private final Set<String> complicationSymptomIds;

    @JsonProperty("package")
    @Nullable
    private final String packageTag;

    @JsonCreator
    public Treatment(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("name") @NotNull String name,
            @JsonProperty("kind") @Nullable TreatmentKind treatmentKind,
            @JsonProperty("hospitalization") boolean hospitalizationRequired,
            @JsonProperty("discomfort") @Nullable Integer discomfort,
            @JsonProperty("complications") @Nullable Collection<String> complicationSymptomIds,
            @JsonProperty("package") @Nullable String packageTag) {
        this.id = Disease.requireText(id, "id");
        this.name = Disease.requireText(name, "name");
        this.treatmentKind = treatmentKind;
        this.hospitalizationRequired = hospitalizationRequired;
        this.discomfort = discomfort;
        this.complicationSymptomIds = Disease.copyOf(complicationSymptomIds);
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
    public TreatmentKind getTreatmentKind() {
        return treatmentKind;
    }

    public boolean isHospitalizationRequired() {
        return hospitalizationRequired;
    }

    @Nullable
    public Integer getDiscomfort() {
        return discomfort;
    }

    @NotNull
    public Set<String> getComplicationSymptomIds() {
        return complicationSymptomIds;
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
        return EntityKind.TREATMENT;
    }

    @JsonIgnore
    public boolean isSurgical() {
        return treatmentKind == TreatmentKind.SURGICAL;
    }

    public Treatment withId(@NotNull String newId) {
        return new Treatment(newId, name, treatmentKind, hospitalizationRequired, discomfort,
            complicationSymptomIds, packageTag);
    }

    public Treatment withComplicationSymptomIds(@NotNull Collection<String> newIds) {
        return new Treatment(id, name, treatmentKind, hospitalizationRequired, discomfort,
            newIds, packageTag);
    }

    public Treatment withPackageTag(@Nullable String newPackageTag) {
        return new Treatment(id, name, treatmentKind, hospitalizationRequired, discomfort,
            complicationSymptomIds, newPackageTag);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Treatment treatment = (Treatment) o;
        return hospitalizationRequired == treatment.hospitalizationRequired
            && id.equals(treatment.id)
            && name.equals(treatment.name)
            && treatmentKind == treatment.treatmentKind
            && Objects.equals(discomfort, treatment.discomfort)
            && complicationSymptomIds.equals(treatment.complicationSymptomIds)
            && Objects.equals(packageTag, treatment.packageTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, treatmentKind, hospitalizationRequired, discomfort,
            complicationSymptomIds, packageTag);
    }

    @Override
    public String toString() {
        return "Treatment{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", kind=" + treatmentKind +
            ", package='" + packageTag + '\'' +
            '}';
    }

    /**
     * Builder for Treatment.
     */
    public static class Builder {
        private String id;
        private String name;
        private TreatmentKind treatmentKind = TreatmentKind.NON_SURGICAL;
        private boolean hospitalizationRequired;
        private Integer discomfort;
        private Collection<String> complicationSymptomIds;
        private String packageTag;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder treatmentKind(TreatmentKind treatmentKind) {
            this.treatmentKind = treatmentKind;
            return this;
        }

        public Builder hospitalizationRequired(boolean hospitalizationRequired) {
            this.hospitalizationRequired = hospitalizationRequired;
            return this;
        }

        public Builder discomfort(Integer discomfort) {
            this.discomfort = discomfort;
            return this;
        }

        public Builder complicationSymptomIds(Collection<String> complicationSymptomIds) {
            this.complicationSymptomIds = complicationSymptomIds;
            return this;
        }

        public Builder packageTag(String packageTag) {
            this.packageTag = packageTag;
            return this;
        }

        public Treatment build() {
            return new Treatment(id, name, treatmentKind, hospitalizationRequired, discomfort,
                complicationSymptomIds, packageTag);
        }
    }
}
