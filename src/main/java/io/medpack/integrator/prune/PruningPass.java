package io.medpack.integrator.prune;

import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.pipeline.IntegrationStage;
import io.medpack.integrator.report.IntegrationReport;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deletes removed diseases and everything no retained disease can reach.
 *
 * <p>Reachability starts at the main and secondary symptoms of retained diseases and follows, until
 * nothing new is found:
 * <ul>
 *   <li>symptom to the symptoms it collapses into</li>
 *   <li>symptom to its examinations and its treatment</li>
 *   <li>examination to its lab peers, in both directions</li>
 *   <li>surgical treatment to its complication symptoms</li>
 * </ul>
 * Running the pass on its own output changes nothing.</p>
 */
@ApplicationScoped
public class PruningPass implements IntegrationStage {

    private static final Logger logger = LoggerFactory.getLogger(PruningPass.class);

    @Override
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        return prune(graph, context.report());
    }

    @Override
    public String getName() {
        return "prune";
    }

    /**
     * Prunes the graph.
     *
     * @param graph  graph to prune
     * @param report receives every deleted entity
     * @return graph holding only retained diseases and what they reach
     */
    public ContentGraph prune(@NotNull ContentGraph graph, @NotNull IntegrationReport report) {
        Reachable reachable = reachableFrom(graph);

        ContentGraph.Builder builder = graph.toBuilder();
        int pruned = 0;
        for (String diseaseId : new TreeSet<>(graph.getRemovedDiseaseIds())) {
            builder.removeDisease(diseaseId);
            report.addPrunedEntity(new IntegrationReport.PrunedEntity(EntityKind.DISEASE, diseaseId));
            pruned++;
        }
        for (String symptomId : graph.getSymptoms().keySet()) {
            if (!reachable.symptoms.contains(symptomId)) {
                builder.removeSymptom(symptomId);
                report.addPrunedEntity(new IntegrationReport.PrunedEntity(EntityKind.SYMPTOM, symptomId));
                pruned++;
            }
        }
        for (String examinationId : graph.getExaminations().keySet()) {
            if (!reachable.examinations.contains(examinationId)) {
                builder.removeExamination(examinationId);
                report.addPrunedEntity(new IntegrationReport.PrunedEntity(EntityKind.EXAMINATION, examinationId));
                pruned++;
            }
        }
        for (String treatmentId : graph.getTreatments().keySet()) {
            if (!reachable.treatments.contains(treatmentId)) {
                builder.removeTreatment(treatmentId);
                report.addPrunedEntity(new IntegrationReport.PrunedEntity(EntityKind.TREATMENT, treatmentId));
                pruned++;
            }
        }

        if (pruned == 0) {
            logger.info("Pruning removed nothing");
            return graph;
        }
        ContentGraph result = builder.build();
        logger.info("Pruning removed {} entities: {}", pruned, result);
        return result;
    }

    private Reachable reachableFrom(ContentGraph graph) {
        Map<String, Set<String>> labPeers = undirectedLabPeers(graph);
        Reachable reachable = new Reachable();
        Deque<String> pendingSymptoms = new ArrayDeque<>();

        for (Disease disease : graph.retainedDiseases()) {
            for (String symptomId : disease.getAllSymptomIds()) {
                reachable.addSymptom(graph, symptomId, pendingSymptoms);
            }
        }

        while (!pendingSymptoms.isEmpty()) {
            Symptom symptom = graph.getSymptoms().get(pendingSymptoms.pop());

            for (String collapseId : symptom.getCollapseSymptomIds()) {
                reachable.addSymptom(graph, collapseId, pendingSymptoms);
            }

            Deque<String> pendingExaminations = new ArrayDeque<>();
            for (String examinationId : symptom.getExaminationIds()) {
                reachable.addExamination(graph, examinationId, pendingExaminations);
            }
            while (!pendingExaminations.isEmpty()) {
                String examinationId = pendingExaminations.pop();
                for (String peerId : labPeers.getOrDefault(examinationId, Set.of())) {
                    reachable.addExamination(graph, peerId, pendingExaminations);
                }
            }

            Treatment treatment = graph.treatment(symptom.getTreatmentId()).orElse(null);
            if (treatment != null && reachable.treatments.add(treatment.getId()) && treatment.isSurgical()) {
                for (String complicationId : treatment.getComplicationSymptomIds()) {
                    reachable.addSymptom(graph, complicationId, pendingSymptoms);
                }
            }
        }
        return reachable;
    }

    private static Map<String, Set<String>> undirectedLabPeers(ContentGraph graph) {
        Map<String, Set<String>> peers = new HashMap<>();
        for (Examination examination : graph.getExaminations().values()) {
            for (String peerId : examination.getLabPeerIds()) {
                peers.computeIfAbsent(examination.getId(), id -> new HashSet<>()).add(peerId);
                peers.computeIfAbsent(peerId, id -> new HashSet<>()).add(examination.getId());
            }
        }
        return peers;
    }

    private static final class Reachable {
        private final Set<String> symptoms = new HashSet<>();
        private final Set<String> examinations = new HashSet<>();
        private final Set<String> treatments = new HashSet<>();

        void addSymptom(ContentGraph graph, String symptomId, Deque<String> pending) {
            if (graph.contains(EntityKind.SYMPTOM, symptomId) && symptoms.add(symptomId)) {
                pending.push(symptomId);
            }
        }

        void addExamination(ContentGraph graph, String examinationId, Deque<String> pending) {
            if (graph.contains(EntityKind.EXAMINATION, examinationId) && examinations.add(examinationId)) {
                pending.push(examinationId);
            }
        }
    }
}
