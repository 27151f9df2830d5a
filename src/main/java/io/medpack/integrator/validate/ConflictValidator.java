package io.medpack.integrator.validate;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.pipeline.IntegrationStage;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks a content graph for problems the engine cannot handle.
 *
 * <p>Every check runs on every entity; a problem never hides another. The graph is only read.
 * Diseases marked removed are ignored since pruning will delete them.</p>
 */
@ApplicationScoped
public class ConflictValidator implements IntegrationStage {

    private static final Logger logger = LoggerFactory.getLogger(ConflictValidator.class);

    @Override
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        List<Violation> violations = validate(graph, context.settings());
        violations.forEach(context.report()::addViolation);
        return graph;
    }

    @Override
    public String getName() {
        return "validate";
    }

    /**
     * Validates the graph.
     *
     * @param graph    graph to check
     * @param settings supplies the configured facility set
     * @return every violation found, in check order then entity id order
     */
    public List<Violation> validate(@NotNull ContentGraph graph, @NotNull IntegrationSettings settings) {
        List<Violation> violations = new ArrayList<>();
        checkMainSymptoms(graph, violations);
        checkDiseaseReferences(graph, violations);
        checkSymptoms(graph, violations);
        checkExaminations(graph, settings, violations);
        checkTreatments(graph, violations);

        if (violations.isEmpty()) {
            logger.info("Validation passed for {}", graph);
        } else {
            logger.warn("Validation found {} violation(s) in {}", violations.size(), graph);
            violations.forEach(v -> logger.debug(v.toLogString()));
        }
        return violations;
    }

    private void checkMainSymptoms(ContentGraph graph, List<Violation> violations) {
        Map<String, List<String>> diseasesByMainSymptom = new TreeMap<>();
        for (Disease disease : graph.retainedDiseases()) {
            diseasesByMainSymptom.computeIfAbsent(disease.getMainSymptomId(), id -> new ArrayList<>())
                .add(disease.getId());
        }
        for (Map.Entry<String, List<String>> entry : diseasesByMainSymptom.entrySet()) {
            if (entry.getValue().size() > 1) {
                violations.add(new Violation(ViolationType.DUPLICATE_MAIN_SYMPTOM, EntityKind.SYMPTOM, entry.getKey(),
                    "main symptom of " + entry.getValue().size() + " diseases: " + String.join(", ", entry.getValue()),
                    entry.getValue()));
            }
        }
    }

    private void checkDiseaseReferences(ContentGraph graph, List<Violation> violations) {
        for (Disease disease : graph.retainedDiseases()) {
            Symptom main = graph.getSymptoms().get(disease.getMainSymptomId());
            if (main == null) {
                violations.add(dangling(EntityKind.DISEASE, disease.getId(), "main symptom", disease.getMainSymptomId()));
            } else if (!main.isMain()) {
                violations.add(new Violation(ViolationType.MAIN_SYMPTOM_NOT_FLAGGED, EntityKind.DISEASE, disease.getId(),
                    "main symptom " + main.getId() + " is not flagged as main", List.of(main.getId())));
            }

            for (String secondaryId : disease.getSecondarySymptomIds()) {
                Symptom secondary = graph.getSymptoms().get(secondaryId);
                if (secondary == null) {
                    violations.add(dangling(EntityKind.DISEASE, disease.getId(), "secondary symptom", secondaryId));
                } else if (secondary.isMain()) {
                    violations.add(new Violation(ViolationType.MAIN_FLAG_ON_SECONDARY, EntityKind.DISEASE, disease.getId(),
                        "secondary symptom " + secondaryId + " is flagged as main", List.of(secondaryId)));
                }
            }
        }
    }

    private void checkSymptoms(ContentGraph graph, List<Violation> violations) {
        for (Symptom symptom : graph.getSymptoms().values()) {
            if (symptom.getTreatmentId() == null) {
                violations.add(Violation.of(ViolationType.MISSING_TREATMENT, EntityKind.SYMPTOM, symptom.getId(),
                    "no treatment"));
            } else if (!graph.contains(EntityKind.TREATMENT, symptom.getTreatmentId())) {
                violations.add(new Violation(ViolationType.MISSING_TREATMENT, EntityKind.SYMPTOM, symptom.getId(),
                    "treatment " + symptom.getTreatmentId() + " does not exist", List.of(symptom.getTreatmentId())));
            }

            int resolvable = 0;
            for (String examinationId : symptom.getExaminationIds()) {
                if (graph.contains(EntityKind.EXAMINATION, examinationId)) {
                    resolvable++;
                } else {
                    violations.add(dangling(EntityKind.SYMPTOM, symptom.getId(), "examination", examinationId));
                }
            }
            if (resolvable == 0) {
                violations.add(Violation.of(ViolationType.UNCOVERED_SYMPTOM, EntityKind.SYMPTOM, symptom.getId(),
                    "no examination can detect it"));
            }

            checkReferences(graph, EntityKind.SYMPTOM, symptom.getId(), "collapse symptom",
                EntityKind.SYMPTOM, symptom.getCollapseSymptomIds(), violations);
        }
    }

    private void checkExaminations(ContentGraph graph, IntegrationSettings settings, List<Violation> violations) {
        for (Examination examination : graph.getExaminations().values()) {
            if (!settings.isKnownFacility(examination.getFacility())) {
                violations.add(Violation.of(ViolationType.UNKNOWN_FACILITY, EntityKind.EXAMINATION, examination.getId(),
                    "facility '" + examination.getFacility() + "' is not one of " + settings.facilities()));
            }
            checkReferences(graph, EntityKind.EXAMINATION, examination.getId(), "lab peer",
                EntityKind.EXAMINATION, examination.getLabPeerIds(), violations);
        }
    }

    private void checkTreatments(ContentGraph graph, List<Violation> violations) {
        for (Treatment treatment : graph.getTreatments().values()) {
            checkReferences(graph, EntityKind.TREATMENT, treatment.getId(), "complication symptom",
                EntityKind.SYMPTOM, treatment.getComplicationSymptomIds(), violations);
        }
    }

    private void checkReferences(ContentGraph graph, EntityKind ownerKind, String ownerId, String role,
                                 EntityKind targetKind, Collection<String> references, List<Violation> violations) {
        for (String reference : references) {
            if (!graph.contains(targetKind, reference)) {
                violations.add(dangling(ownerKind, ownerId, role, reference));
            }
        }
    }

    private static Violation dangling(EntityKind kind, String entityId, String role, String reference) {
        return new Violation(ViolationType.DANGLING_REFERENCE, kind, entityId,
            role + " " + reference + " does not exist", List.of(reference));
    }
}
