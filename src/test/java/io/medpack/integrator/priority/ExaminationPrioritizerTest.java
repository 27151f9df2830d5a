package io.medpack.integrator.priority;

import io.medpack.integrator.TestContent;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.report.IntegrationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.medpack.integrator.TestContent.examination;
import static io.medpack.integrator.TestContent.mainSymptom;
import static org.junit.jupiter.api.Assertions.*;

class ExaminationPrioritizerTest {

    private ExaminationPrioritizer prioritizer;
    private IntegrationReport report;

    @BeforeEach
    void setUp() {
        prioritizer = new ExaminationPrioritizer();
        report = new IntegrationReport("test-run");
    }

    private static int priorityOf(ContentGraph graph, String id) {
        return graph.getExaminations().get(id).getPriority();
    }

    @Test
    @DisplayName("should score examinations by the diseases they help detect")
    void shouldScoreCoverage() {
        Map<String, ExaminationPrioritizer.Ranking> rankings = prioritizer.rank(TestContent.clinic()).stream()
            .collect(Collectors.toMap(ExaminationPrioritizer.Ranking::examinationId, r -> r));

        // headache is shared by both diseases, so the interview counts it twice
        assertEquals(4, rankings.get("interview").score());
        assertEquals(2, rankings.get("interview").diseaseCount());
        assertEquals(1, rankings.get("temperature").score());
        assertEquals(1, rankings.get("neuro_exam").score());
        assertEquals(ExamCategory.IMAGING, rankings.get("neuro_exam").category());
    }

    @Test
    @DisplayName("should count priorities down to the floor by category then score")
    void shouldAssignPriorities() {
        ContentGraph result = prioritizer.prioritize(TestContent.clinic(), 25, report);

        assertEquals(27, priorityOf(result, "interview"));
        assertEquals(26, priorityOf(result, "temperature"));
        assertEquals(25, priorityOf(result, "neuro_exam"));
        assertEquals(3, report.getExaminationPriorities().size());
        assertEquals("interview", report.getExaminationPriorities().get(0).examinationId());
    }

    @Test
    @DisplayName("should give examinations with equal category and score the same priority")
    void shouldShareGroupPriority() {
        ContentGraph graph = TestContent.clinic().toBuilder()
            .symptom(mainSymptom("fever", "rest", "temperature", "palpation"))
            .examination(examination("palpation", "DoctorOffice"))
            .build();

        ContentGraph result = prioritizer.prioritize(graph, 10, report);

        assertEquals(priorityOf(result, "palpation"), priorityOf(result, "temperature"));
        assertEquals(11, priorityOf(result, "temperature"));
        assertEquals(10, priorityOf(result, "neuro_exam"));
    }

    @Test
    @DisplayName("should not remove anything")
    void shouldKeepEveryExamination() {
        ContentGraph graph = TestContent.clinic().toBuilder()
            .examination(examination("unused", "Lab"))
            .build();

        ContentGraph result = prioritizer.prioritize(graph, 25, report);

        assertEquals(graph.getExaminations().keySet(), result.getExaminations().keySet());
        assertEquals(0, prioritizer.rank(graph).stream()
            .filter(r -> r.examinationId().equals("unused")).findFirst().orElseThrow().score());
    }

    @Nested
    @DisplayName("ExamCategory")
    class CategoryTests {

        private Examination equipped(String facility, String... equipment) {
            return Examination.builder().id("exam").name("Exam").facility(facility)
                .requiredEquipment(List.of(equipment)).build();
        }

        @Test
        @DisplayName("should treat examinations with lab peers as lab work")
        void shouldClassifyLabPeers() {
            Examination exam = examination("ferritin", "DoctorOffice").withLabPeerIds(List.of("blood_count"));
            assertEquals(ExamCategory.LAB, ExamCategory.classify(exam));
        }

        @Test
        @DisplayName("should split office examinations by equipment")
        void shouldSplitOfficeByEquipment() {
            assertEquals(ExamCategory.OFFICE_NO_EQUIPMENT, ExamCategory.classify(equipped("DoctorOffice")));
            assertEquals(ExamCategory.OFFICE_NO_EQUIPMENT,
                ExamCategory.classify(equipped("DoctorOffice", "sit_exam", "clean_hands")));
            assertEquals(ExamCategory.OFFICE_SIMPLE_EQUIPMENT,
                ExamCategory.classify(equipped("DoctorOffice", "stethoscope")));
        }

        @Test
        @DisplayName("should classify by facility name")
        void shouldClassifyByFacility() {
            assertEquals(ExamCategory.LAB, ExamCategory.classify(equipped("Lab")));
            assertEquals(ExamCategory.OBSERVATION, ExamCategory.classify(equipped("Observation")));
            assertEquals(ExamCategory.OBSERVATION, ExamCategory.classify(equipped("IntensiveCare")));
            assertEquals(ExamCategory.IMAGING, ExamCategory.classify(equipped("Radiology")));
            assertEquals(ExamCategory.IMAGING, ExamCategory.classify(equipped("SpecialistUnit")));
        }
    }
}
