package io.medpack.integrator.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.validate.Violation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Curator-facing record of everything an integration run decided.
 *
 * <p>A report is filled in by the stages of a single run, which are executed on one thread, and is
 * read after the run completes (or fails). Accessors return unmodifiable views.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"runId", "status", "packages", "duplicateDefinitions", "merges", "nearDuplicates",
    "idCollisions", "violations", "warnings", "appliedDirectives", "removedDiseases", "prunedEntities",
    "departmentShares", "weights", "examinationPriorities"})
public final class IntegrationReport {

    /**
     * Outcome of a run.
     */
    public enum Status {
        RUNNING,
        SUCCEEDED,
        REJECTED,
        FAILED
    }

    /**
     * A loaded package.
     */
    public record PackageSummary(String tag, String version, int priority, int entities) {
    }

    /**
     * An id defined more than once inside one package; only the last definition was kept.
     */
    public record DuplicateDefinition(String packageTag, EntityKind kind, String id) {
    }

    /**
     * A package-qualified entity folded into a canonical entity.
     */
    public record Merge(EntityKind kind, String supersededId, String canonicalId, boolean directed) {
    }

    /**
     * Two entities with similar but not identical names, left distinct.
     */
    public record NearDuplicate(EntityKind kind, String firstId, String secondId, double similarity) {
    }

    /**
     * A canonical entity re-identified because another kept the same id.
     */
    public record IdCollision(EntityKind kind, String originalId, String assignedId, String packageTag) {
    }

    /**
     * A reassignment directive that was applied, with the entities it touched.
     */
    public record AppliedDirective(int index, String description, List<String> affectedIds) {
        public AppliedDirective {
            affectedIds = List.copyOf(affectedIds);
        }
    }

    /**
     * An entity deleted by the pruning pass.
     */
    public record PrunedEntity(EntityKind kind, String id) {
    }

    /**
     * A disease weight before and after normalization.
     */
    public record WeightChange(String diseaseId, String department, double rawWeight, double normalizedWeight) {
    }

    /**
     * Priority assigned to an examination.
     */
    public record ExaminationPriority(String examinationId, String category, double score, int priority) {
    }

    private final String runId;
    private Status status = Status.RUNNING;
    private String failure;
    private final List<PackageSummary> packages = new ArrayList<>();
    private final List<DuplicateDefinition> duplicateDefinitions = new ArrayList<>();
    private final List<Merge> merges = new ArrayList<>();
    private final List<NearDuplicate> nearDuplicates = new ArrayList<>();
    private final List<IdCollision> idCollisions = new ArrayList<>();
    private final List<Violation> violations = new ArrayList<>();
    private final List<Violation> warnings = new ArrayList<>();
    private final List<AppliedDirective> appliedDirectives = new ArrayList<>();
    private final List<String> removedDiseases = new ArrayList<>();
    private final List<PrunedEntity> prunedEntities = new ArrayList<>();
    private final Map<String, Double> departmentShares = new TreeMap<>();
    private final List<WeightChange> weights = new ArrayList<>();
    private final List<ExaminationPriority> examinationPriorities = new ArrayList<>();

    public IntegrationReport(@NotNull String runId) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
    }

    @JsonProperty("runId")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonProperty("failure")
    @Nullable
    public String getFailure() {
        return failure;
    }

    public void succeeded() {
        this.status = Status.SUCCEEDED;
    }

    public void rejected(@NotNull String reason) {
        this.status = Status.REJECTED;
        this.failure = reason;
    }

    public void failed(@NotNull String reason) {
        this.status = Status.FAILED;
        this.failure = reason;
    }

    public void addPackage(PackageSummary summary) {
        packages.add(summary);
    }

    public void addDuplicateDefinition(DuplicateDefinition duplicate) {
        duplicateDefinitions.add(duplicate);
    }

    public void addMerge(Merge merge) {
        merges.add(merge);
    }

    public void addNearDuplicate(NearDuplicate nearDuplicate) {
        nearDuplicates.add(nearDuplicate);
    }

    public void addIdCollision(IdCollision collision) {
        idCollisions.add(collision);
    }

    /**
     * Records a violation; hard ones go to the violation list, the rest to warnings.
     */
    public void addViolation(Violation violation) {
        if (violation.isHard()) {
            violations.add(violation);
        } else {
            warnings.add(violation);
        }
    }

    public void addAppliedDirective(AppliedDirective directive) {
        appliedDirectives.add(directive);
    }

    public void addRemovedDisease(String diseaseId) {
        removedDiseases.add(diseaseId);
    }

    public void addPrunedEntity(PrunedEntity pruned) {
        prunedEntities.add(pruned);
    }

    public void putDepartmentShare(String department, double share) {
        departmentShares.put(department, share);
    }

    public void addWeightChange(WeightChange change) {
        weights.add(change);
    }

    public void addExaminationPriority(ExaminationPriority priority) {
        examinationPriorities.add(priority);
    }

    @JsonProperty("packages")
    public List<PackageSummary> getPackages() {
        return Collections.unmodifiableList(packages);
    }

    @JsonProperty("duplicateDefinitions")
    public List<DuplicateDefinition> getDuplicateDefinitions() {
        return Collections.unmodifiableList(duplicateDefinitions);
    }

    @JsonProperty("merges")
    public List<Merge> getMerges() {
        return Collections.unmodifiableList(merges);
    }

    @JsonProperty("nearDuplicates")
    public List<NearDuplicate> getNearDuplicates() {
        return Collections.unmodifiableList(nearDuplicates);
    }

    @JsonProperty("idCollisions")
    public List<IdCollision> getIdCollisions() {
        return Collections.unmodifiableList(idCollisions);
    }

    @JsonProperty("violations")
    public List<Violation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    @JsonProperty("warnings")
    public List<Violation> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @JsonProperty("appliedDirectives")
    public List<AppliedDirective> getAppliedDirectives() {
        return Collections.unmodifiableList(appliedDirectives);
    }

    @JsonProperty("removedDiseases")
    public List<String> getRemovedDiseases() {
        return Collections.unmodifiableList(removedDiseases);
    }

    @JsonProperty("prunedEntities")
    public List<PrunedEntity> getPrunedEntities() {
        return Collections.unmodifiableList(prunedEntities);
    }

    @JsonProperty("departmentShares")
    public Map<String, Double> getDepartmentShares() {
        return Collections.unmodifiableMap(departmentShares);
    }

    @JsonProperty("weights")
    public List<WeightChange> getWeights() {
        return Collections.unmodifiableList(weights);
    }

    @JsonProperty("examinationPriorities")
    public List<ExaminationPriority> getExaminationPriorities() {
        return Collections.unmodifiableList(examinationPriorities);
    }

    @JsonIgnore
    public boolean hasHardViolations() {
        return !violations.isEmpty();
    }

    /**
     * Canonical id a package-qualified id was merged into, if any.
     */
    @Nullable
    public String canonicalIdOf(EntityKind kind, String supersededId) {
        return merges.stream()
            .filter(m -> m.kind() == kind && m.supersededId().equals(supersededId))
            .map(Merge::canonicalId)
            .findFirst()
            .orElse(null);
    }

    /**
     * Formats report counts for logging.
     */
    public String toLogString() {
        return String.format(
            "run=%s status=%s packages=%d merges=%d nearDuplicates=%d collisions=%d violations=%d warnings=%d directives=%d pruned=%d",
            runId, status, packages.size(), merges.size(), nearDuplicates.size(), idCollisions.size(),
            violations.size(), warnings.size(), appliedDirectives.size(), prunedEntities.size()
        );
    }
}
