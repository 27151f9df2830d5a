package io.medpack.integrator.prune;

import io.medpack.integrator.TestContent;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.report.IntegrationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.medpack.integrator.TestContent.disease;
import static io.medpack.integrator.TestContent.examination;
import static io.medpack.integrator.TestContent.mainSymptom;
import static io.medpack.integrator.TestContent.secondarySymptom;
import static io.medpack.integrator.TestContent.surgery;
import static io.medpack.integrator.TestContent.treatment;
import static org.junit.jupiter.api.Assertions.*;

class PruningPassTest {

    private PruningPass pruningPass;
    private IntegrationReport report;

    @BeforeEach
    void setUp() {
        pruningPass = new PruningPass();
        report = new IntegrationReport("test-run");
    }

    @Test
    @DisplayName("should return the same graph when everything is reachable")
    void shouldKeepReachableGraph() {
        ContentGraph graph = TestContent.clinic();

        assertSame(graph, pruningPass.prune(graph, report));
        assertTrue(report.getPrunedEntities().isEmpty());
    }

    @Test
    @DisplayName("should delete a removed disease and what only it reached")
    void shouldDeleteRemovedDisease() {
        ContentGraph graph = TestContent.clinic().toBuilder().markRemoved("migraine").build();

        ContentGraph result = pruningPass.prune(graph, report);

        assertEquals(Set.of("flu"), result.getDiseases().keySet());
        assertEquals(Set.of("fever", "headache"), result.getSymptoms().keySet());
        assertEquals(Set.of("temperature", "interview"), result.getExaminations().keySet());
        assertEquals(Set.of("rest", "painkillers"), result.getTreatments().keySet());
        assertTrue(result.getRemovedDiseaseIds().isEmpty());
        assertEquals(List.of(
            new IntegrationReport.PrunedEntity(EntityKind.DISEASE, "migraine"),
            new IntegrationReport.PrunedEntity(EntityKind.SYMPTOM, "aura"),
            new IntegrationReport.PrunedEntity(EntityKind.EXAMINATION, "neuro_exam")
        ), report.getPrunedEntities());
    }

    @Test
    @DisplayName("should be idempotent")
    void shouldBeIdempotent() {
        ContentGraph graph = TestContent.clinic().toBuilder()
            .markRemoved("migraine")
            .symptom(mainSymptom("orphan", "rest", "temperature"))
            .build();

        ContentGraph once = pruningPass.prune(graph, report);
        ContentGraph twice = pruningPass.prune(once, new IntegrationReport("again"));

        assertEquals(once, twice);
    }

    @Nested
    @DisplayName("Closure")
    class ClosureTests {

        @Test
        @DisplayName("should keep symptoms a kept symptom collapses into, transitively")
        void shouldFollowCollapseChain() {
            ContentGraph graph = ContentGraph.builder()
                .disease(disease("sepsis", "InternalMedicine", "infection"))
                .symptom(mainSymptom("infection", "antibiotics", "blood_test").toBuilder()
                    .collapseSymptomIds(List.of("shock")).build())
                .symptom(secondarySymptom("shock", "fluids", "blood_test").toBuilder()
                    .collapseSymptomIds(List.of("organ_failure")).build())
                .symptom(secondarySymptom("organ_failure", "dialysis", "kidney_panel"))
                .symptom(secondarySymptom("unused", "fluids", "blood_test"))
                .examination(examination("blood_test", "Lab"))
                .examination(examination("kidney_panel", "Lab"))
                .treatment(treatment("antibiotics"))
                .treatment(treatment("fluids"))
                .treatment(treatment("dialysis"))
                .build();

            ContentGraph result = pruningPass.prune(graph, report);

            assertEquals(Set.of("infection", "shock", "organ_failure"), result.getSymptoms().keySet());
            assertEquals(Set.of("blood_test", "kidney_panel"), result.getExaminations().keySet());
            assertEquals(Set.of("antibiotics", "fluids", "dialysis"), result.getTreatments().keySet());
        }

        @Test
        @DisplayName("should keep lab peers in both directions")
        void shouldKeepLabPeers() {
            ContentGraph graph = ContentGraph.builder()
                .disease(disease("anemia", "InternalMedicine", "fatigue"))
                .symptom(mainSymptom("fatigue", "iron", "blood_count"))
                .examination(examination("blood_count", "Lab"))
                .examination(examination("ferritin", "Lab").withLabPeerIds(List.of("blood_count")))
                .examination(examination("smear", "Lab").withLabPeerIds(List.of("ferritin")))
                .examination(examination("urine", "Lab"))
                .treatment(treatment("iron"))
                .build();

            ContentGraph result = pruningPass.prune(graph, report);

            assertEquals(Set.of("blood_count", "ferritin", "smear"), result.getExaminations().keySet());
        }

        @Test
        @DisplayName("should keep complications of surgical treatments only")
        void shouldKeepSurgicalComplications() {
            ContentGraph graph = ContentGraph.builder()
                .disease(disease("appendicitis", "Surgery", "abdominal_pain"))
                .disease(disease("gastritis", "InternalMedicine", "heartburn"))
                .symptom(mainSymptom("abdominal_pain", "appendectomy", "palpation"))
                .symptom(mainSymptom("heartburn", "antacids", "palpation"))
                .symptom(secondarySymptom("wound_infection", "antibiotics", "palpation"))
                .symptom(secondarySymptom("nausea", "antiemetics", "palpation"))
                .examination(examination("palpation", "DoctorOffice"))
                .treatment(surgery("appendectomy", "wound_infection"))
                .treatment(treatment("antacids").withComplicationSymptomIds(List.of("nausea")))
                .treatment(treatment("antibiotics"))
                .treatment(treatment("antiemetics"))
                .build();

            ContentGraph result = pruningPass.prune(graph, report);

            assertTrue(result.getSymptoms().containsKey("wound_infection"));
            assertTrue(result.getTreatments().containsKey("antibiotics"));
            assertFalse(result.getSymptoms().containsKey("nausea"));
            assertFalse(result.getTreatments().containsKey("antiemetics"));
        }

        @Test
        @DisplayName("should keep a symptom shared with a retained disease")
        void shouldKeepSharedSymptom() {
            ContentGraph graph = TestContent.clinic().toBuilder().markRemoved("flu").build();

            ContentGraph result = pruningPass.prune(graph, report);

            assertTrue(result.getSymptoms().containsKey("headache"));
            assertFalse(result.getSymptoms().containsKey("fever"));
            assertFalse(result.getTreatments().containsKey("rest"));
        }
    }
}
