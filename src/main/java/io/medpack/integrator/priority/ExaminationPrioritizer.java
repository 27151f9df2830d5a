package io.medpack.integrator.priority;

import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.pipeline.IntegrationStage;
import io.medpack.integrator.report.IntegrationReport;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns each examination the priority the engine uses to pick the next test.
 *
 * <p>Examinations are ordered by category rank (ascending), coverage score (descending) and id.
 * The score sums, over every disease the examination can detect, how many diseases share that
 * disease's most widespread detectable symptom. Examinations with the same category and score form
 * a group and share a priority; the first group gets {@code floor + groups - 1} and the last gets
 * {@code floor}. Nothing is removed.</p>
 */
@ApplicationScoped
public class ExaminationPrioritizer implements IntegrationStage {

    private static final Logger logger = LoggerFactory.getLogger(ExaminationPrioritizer.class);

    /**
     * Category and score of one examination.
     */
    public record Ranking(String examinationId, ExamCategory category, int score, int diseaseCount) {
    }

    private static final Comparator<Ranking> ORDER = Comparator
        .comparingInt((Ranking r) -> r.category().rank())
        .thenComparing(Comparator.comparingInt(Ranking::score).reversed())
        .thenComparing(Ranking::examinationId);

    @Override
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        return prioritize(graph, context.settings().priorityFloor(), context.report());
    }

    @Override
    public String getName() {
        return "prioritize-examinations";
    }

    /**
     * Prioritizes every examination in the graph.
     *
     * @param graph  pruned graph
     * @param floor  priority of the last group
     * @param report receives the priority of every examination
     * @return graph with examination priorities set
     */
    public ContentGraph prioritize(@NotNull ContentGraph graph, int floor, @NotNull IntegrationReport report) {
        if (graph.getExaminations().isEmpty()) {
            return graph;
        }
        List<Ranking> rankings = rank(graph);
        rankings.sort(ORDER);

        int groups = 0;
        Ranking previous = null;
        for (Ranking ranking : rankings) {
            if (previous == null || !sameGroup(previous, ranking)) {
                groups++;
            }
            previous = ranking;
        }

        ContentGraph.Builder builder = graph.toBuilder();
        int priority = floor + groups;
        previous = null;
        for (Ranking ranking : rankings) {
            if (previous == null || !sameGroup(previous, ranking)) {
                priority--;
            }
            previous = ranking;
            Examination examination = graph.getExaminations().get(ranking.examinationId());
            builder.examination(examination.withPriority(priority));
            report.addExaminationPriority(new IntegrationReport.ExaminationPriority(
                ranking.examinationId(), ranking.category().getLabel(), ranking.score(), priority));
        }

        logger.info("Prioritized {} examinations in {} groups ({}..{})",
            rankings.size(), groups, floor + groups - 1, floor);
        return builder.build();
    }

    /**
     * Categorizes and scores every examination, in id order.
     */
    public List<Ranking> rank(@NotNull ContentGraph graph) {
        List<Disease> diseases = graph.retainedDiseases();
        Map<String, Integer> symptomFrequency = new HashMap<>();
        for (Disease disease : diseases) {
            for (String symptomId : disease.getAllSymptomIds()) {
                symptomFrequency.merge(symptomId, 1, Integer::sum);
            }
        }

        List<Ranking> rankings = new ArrayList<>();
        for (Examination examination : graph.getExaminations().values()) {
            int score = 0;
            int covered = 0;
            for (Disease disease : diseases) {
                int representative = 0;
                boolean detects = false;
                for (String symptomId : disease.getAllSymptomIds()) {
                    Symptom symptom = graph.getSymptoms().get(symptomId);
                    if (symptom != null && symptom.getExaminationIds().contains(examination.getId())) {
                        detects = true;
                        representative = Math.max(representative, symptomFrequency.getOrDefault(symptomId, 0));
                    }
                }
                if (detects) {
                    score += representative;
                    covered++;
                }
            }
            rankings.add(new Ranking(examination.getId(), ExamCategory.classify(examination), score, covered));
        }
        return rankings;
    }

    private static boolean sameGroup(Ranking a, Ranking b) {
        return a.category() == b.category() && a.score() == b.score();
    }
}
