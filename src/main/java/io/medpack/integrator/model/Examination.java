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
 * An examination that can detect symptoms, performed in a given facility.
 *
 * <p>The facility is kept as the raw authored string; whether it names a known facility kind is
 * decided by the validator against the configured facility set.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Examination implements MedicalEntity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("facility")
    @NotNull
    private final String facility;

    @JsonProperty("duration_minutes")
    @Nullable
    private final Integer durationMinutes;

    @JsonProperty("discomfort")
    @Nullable
    private final Integer discomfort;

    @JsonProperty("equipment")
    @NotNull
    private final Set<String> requiredEquipment;

    @JsonProperty("lab_peers")
    @NotNull
    private final Set<String> labPeerIds;

    @JsonProperty("priority")
    @Nullable
    private final Integer priority;

    @JsonProperty("package")
    @Nullable
    private final String packageTag;

    @JsonCreator
    public Examination(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("name") @NotNull String name,
            @JsonProperty("facility") @Nullable String facility,
            @JsonProperty("duration_minutes") @Nullable Integer durationMinutes,
            @JsonProperty("discomfort") @Nullable Integer discomfort,
            @JsonProperty("equipment") @Nullable Collection<String> requiredEquipment,
            @JsonProperty("lab_peers") @Nullable Collection<String> labPeerIds,
            @JsonProperty("priority") @Nullable Integer priority,
            @JsonProperty("package") @Nullable String packageTag) {
        this.id = Disease.requireText(id, "id");
        this.name = Disease.requireText(name, "name");
        this.facility = facility == null ? "" : facility.trim();
        this.durationMinutes = durationMinutes;
        this.discomfort = discomfort;
        this.requiredEquipment = Disease.copyOf(requiredEquipment);
        this.labPeerIds = Disease.copyOf(labPeerIds);
        this.priority = priority;
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

    @NotNull
    public String getFacility() {
        return facility;
    }

    @Nullable
    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    @Nullable
    public Integer getDiscomfort() {
        return discomfort;
    }

    @NotNull
    public Set<String> getRequiredEquipment() {
        return requiredEquipment;
    }

    @NotNull
    public Set<String> getLabPeerIds() {
        return labPeerIds;
    }

    @Nullable
    public Integer getPriority() {
        return priority;
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
        return EntityKind.EXAMINATION;
    }

    public Examination withId(@NotNull String newId) {
        return toBuilder().id(newId).build();
    }

    public Examination withLabPeerIds(@NotNull Collection<String> newLabPeerIds) {
        return toBuilder().labPeerIds(newLabPeerIds).build();
    }

    public Examination withPriority(@Nullable Integer newPriority) {
        return toBuilder().priority(newPriority).build();
    }

    public Examination withPackageTag(@Nullable String newPackageTag) {
        return toBuilder().packageTag(newPackageTag).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .facility(facility)
            .durationMinutes(durationMinutes)
            .discomfort(discomfort)
            .requiredEquipment(requiredEquipment)
            .labPeerIds(labPeerIds)
            .priority(priority)
            .packageTag(packageTag);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Examination that = (Examination) o;
        return id.equals(that.id)
            && name.equals(that.name)
            && facility.equals(that.facility)
            && Objects.equals(durationMinutes, that.durationMinutes)
            && Objects.equals(discomfort, that.discomfort)
            && requiredEquipment.equals(that.requiredEquipment)
            && labPeerIds.equals(that.labPeerIds)
            && Objects.equals(priority, that.priority)
            && Objects.equals(packageTag, that.packageTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, facility, durationMinutes, discomfort,
            requiredEquipment, labPeerIds, priority, packageTag);
    }

    @Override
    public String toString() {
        return "Examination{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", facility='" + facility + '\'' +
            ", package='" + packageTag + '\'' +
            '}';
    }

    /**
     * Builder for Examination.
     */
    public static class Builder {
        private String id;
        private String name;
        private String facility;
        private Integer durationMinutes;
        private Integer discomfort;
        private Collection<String> requiredEquipment;
        private Collection<String> labPeerIds;
        private Integer priority;
        private String packageTag;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder facility(String facility) {
            this.facility = facility;
            return this;
        }

        public Builder durationMinutes(Integer durationMinutes) {
            this.durationMinutes = durationMinutes;
            return this;
        }

        public Builder discomfort(Integer discomfort) {
            this.discomfort = discomfort;
            return this;
        }

        public Builder requiredEquipment(Collection<String> requiredEquipment) {
            this.requiredEquipment = requiredEquipment;
            return this;
        }

        public Builder labPeerIds(Collection<String> labPeerIds) {
            this.labPeerIds = labPeerIds;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder packageTag(String packageTag) {
            this.packageTag = packageTag;
            return this;
        }

        public Examination build() {
            return new Examination(id, name, facility, durationMinutes, discomfort,
                requiredEquipment, labPeerIds, priority, packageTag);
        }
    }
}
