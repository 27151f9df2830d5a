package io.medpack.integrator.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the merged content graph.
 *
 * <p>Entities are keyed by their canonical id; every map iterates in id order so that anything
 * derived from a graph is reproducible. Diseases marked removed by a reassignment directive stay in
 * the snapshot until the pruning pass deletes them together with whatever only they reached.</p>
 *
 * <p>Each pass produces a new snapshot through {@link #toBuilder()}; no snapshot is ever
 * modified after construction.</p>
 */
public final class ContentGraph {

    private static final ContentGraph EMPTY = new Builder().build();

    private final SortedMap<String, Disease> diseases;
    private final SortedMap<String, Symptom> symptoms;
    private final SortedMap<String, Examination> examinations;
    private final SortedMap<String, Treatment> treatments;
    private final Set<String> removedDiseaseIds;

    private ContentGraph(Builder builder) {
        this.diseases = Collections.unmodifiableSortedMap(new TreeMap<>(builder.diseases));
        this.symptoms = Collections.unmodifiableSortedMap(new TreeMap<>(builder.symptoms));
        this.examinations = Collections.unmodifiableSortedMap(new TreeMap<>(builder.examinations));
        this.treatments = Collections.unmodifiableSortedMap(new TreeMap<>(builder.treatments));
        Set<String> removed = new TreeSet<>(builder.removedDiseaseIds);
        removed.retainAll(this.diseases.keySet());
        this.removedDiseaseIds = Collections.unmodifiableSet(removed);
    }

    public static ContentGraph empty() {
        return EMPTY;
    }

    @NotNull
    public Map<String, Disease> getDiseases() {
        return diseases;
    }

    @NotNull
    public Map<String, Symptom> getSymptoms() {
        return symptoms;
    }

    @NotNull
    public Map<String, Examination> getExaminations() {
        return examinations;
    }

    @NotNull
    public Map<String, Treatment> getTreatments() {
        return treatments;
    }

    /**
     * Ids of diseases marked removed and awaiting pruning.
     */
    @NotNull
    public Set<String> getRemovedDiseaseIds() {
        return removedDiseaseIds;
    }

    /**
     * Diseases not marked removed, in id order.
     */
    @NotNull
    public List<Disease> retainedDiseases() {
        return diseases.values().stream()
            .filter(d -> !removedDiseaseIds.contains(d.getId()))
            .collect(Collectors.toList());
    }

    public boolean isRemoved(@NotNull String diseaseId) {
        return removedDiseaseIds.contains(diseaseId);
    }

    @NotNull
    public Optional<Disease> disease(@Nullable String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(diseases.get(id));
    }

    @NotNull
    public Optional<Symptom> symptom(@Nullable String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(symptoms.get(id));
    }

    @NotNull
    public Optional<Examination> examination(@Nullable String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(examinations.get(id));
    }

    @NotNull
    public Optional<Treatment> treatment(@Nullable String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(treatments.get(id));
    }

    /**
     * Entities of one kind keyed by id.
     */
    @NotNull
    public Map<String, ? extends MedicalEntity> entitiesOf(@NotNull EntityKind kind) {
        switch (kind) {
            case DISEASE:
                return diseases;
            case SYMPTOM:
                return symptoms;
            case EXAMINATION:
                return examinations;
            case TREATMENT:
                return treatments;
            default:
                throw new IllegalArgumentException("Unsupported kind: " + kind);
        }
    }

    public boolean contains(@NotNull EntityKind kind, @Nullable String id) {
        return id != null && entitiesOf(kind).containsKey(id);
    }

    /**
     * Finds an entity of any kind by id; diseases are searched first, then symptoms,
     * examinations, and treatments.
     */
    @NotNull
    public Optional<MedicalEntity> find(@Nullable String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (EntityKind kind : EntityKind.values()) {
            MedicalEntity entity = entitiesOf(kind).get(id);
            if (entity != null) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    /**
     * Departments named by any disease or symptom, sorted.
     */
    @NotNull
    public Set<String> departments() {
        Set<String> departments = new TreeSet<>();
        diseases.values().stream()
            .map(Disease::getDepartment)
            .filter(Objects::nonNull)
            .forEach(departments::add);
        symptoms.values().stream()
            .map(Symptom::getDepartment)
            .filter(Objects::nonNull)
            .forEach(departments::add);
        return departments;
    }

    public int size() {
        return diseases.size() + symptoms.size() + examinations.size() + treatments.size();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.diseases.putAll(diseases);
        builder.symptoms.putAll(symptoms);
        builder.examinations.putAll(examinations);
        builder.treatments.putAll(treatments);
        builder.removedDiseaseIds.addAll(removedDiseaseIds);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentGraph that = (ContentGraph) o;
        return diseases.equals(that.diseases)
            && symptoms.equals(that.symptoms)
            && examinations.equals(that.examinations)
            && treatments.equals(that.treatments)
            && removedDiseaseIds.equals(that.removedDiseaseIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(diseases, symptoms, examinations, treatments, removedDiseaseIds);
    }

    @Override
    public String toString() {
        return String.format("ContentGraph{diseases=%d, symptoms=%d, examinations=%d, treatments=%d, removed=%d}",
            diseases.size(), symptoms.size(), examinations.size(), treatments.size(), removedDiseaseIds.size());
    }

    /**
     * Builder for ContentGraph. Putting an entity replaces any entity of the same kind and id.
     */
    public static class Builder {
        private final Map<String, Disease> diseases = new TreeMap<>();
        private final Map<String, Symptom> symptoms = new TreeMap<>();
        private final Map<String, Examination> examinations = new TreeMap<>();
        private final Map<String, Treatment> treatments = new TreeMap<>();
        private final Set<String> removedDiseaseIds = new TreeSet<>();

        public Builder disease(@NotNull Disease disease) {
            diseases.put(disease.getId(), disease);
            return this;
        }

        public Builder diseases(@NotNull Collection<Disease> values) {
            values.forEach(this::disease);
            return this;
        }

        public Builder symptom(@NotNull Symptom symptom) {
            symptoms.put(symptom.getId(), symptom);
            return this;
        }

        public Builder symptoms(@NotNull Collection<Symptom> values) {
            values.forEach(this::symptom);
            return this;
        }

        public Builder examination(@NotNull Examination examination) {
            examinations.put(examination.getId(), examination);
            return this;
        }

        public Builder examinations(@NotNull Collection<Examination> values) {
            values.forEach(this::examination);
            return this;
        }

        public Builder treatment(@NotNull Treatment treatment) {
            treatments.put(treatment.getId(), treatment);
            return this;
        }

        public Builder treatments(@NotNull Collection<Treatment> values) {
            values.forEach(this::treatment);
            return this;
        }

        public Builder markRemoved(@NotNull String diseaseId) {
            removedDiseaseIds.add(diseaseId);
            return this;
        }

        public Builder removeDisease(@NotNull String id) {
            diseases.remove(id);
            removedDiseaseIds.remove(id);
            return this;
        }

        public Builder removeSymptom(@NotNull String id) {
            symptoms.remove(id);
            return this;
        }

        public Builder removeExamination(@NotNull String id) {
            examinations.remove(id);
            return this;
        }

        public Builder removeTreatment(@NotNull String id) {
            treatments.remove(id);
            return this;
        }

        public ContentGraph build() {
            return new ContentGraph(this);
        }
    }
}
