package io.medpack.integrator.validate;

import io.medpack.integrator.TestContent;
import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.medpack.integrator.TestContent.disease;
import static io.medpack.integrator.TestContent.examination;
import static io.medpack.integrator.TestContent.mainSymptom;
import static io.medpack.integrator.TestContent.secondarySymptom;
import static io.medpack.integrator.TestContent.treatment;
import static org.junit.jupiter.api.Assertions.*;

class ConflictValidatorTest {

    private ConflictValidator validator;
    private IntegrationSettings settings;

    @BeforeEach
    void setUp() {
        validator = new ConflictValidator();
        settings = IntegrationSettings.defaults();
    }

    private List<ViolationType> typesOf(List<Violation> violations) {
        return violations.stream().map(Violation::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("should accept a coherent graph")
    void shouldAcceptCoherentGraph() {
        assertTrue(validator.validate(TestContent.clinic(), settings).isEmpty());
    }

    @Test
    @DisplayName("should not modify the graph")
    void shouldNotModifyGraph() {
        ContentGraph graph = TestContent.clinic().toBuilder()
            .examination(examination("hydrotherapy", "Hydrotherapy"))
            .build();
        ContentGraph copy = graph.toBuilder().build();

        validator.validate(graph, settings);

        assertEquals(copy, graph);
    }

    @Nested
    @DisplayName("Main symptoms")
    class MainSymptomTests {

        @Test
        @DisplayName("should report every disease sharing a main symptom")
        void shouldReportSharedMainSymptom() {
            // two dermatology packages both use itching as the main symptom
            ContentGraph graph = ContentGraph.builder()
                .disease(disease("eczema", "Dermatology", "skin_itching"))
                .disease(disease("scabies", "Dermatology", "skin_itching"))
                .symptom(mainSymptom("skin_itching", "ointment", "skin_check"))
                .examination(examination("skin_check", "DoctorOffice"))
                .treatment(treatment("ointment"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(1, violations.size());
            Violation violation = violations.get(0);
            assertEquals(ViolationType.DUPLICATE_MAIN_SYMPTOM, violation.type());
            assertEquals(EntityKind.SYMPTOM, violation.kind());
            assertEquals("skin_itching", violation.entityId());
            assertEquals(List.of("eczema", "scabies"), violation.relatedIds());
            assertTrue(violation.isHard());
        }

        @Test
        @DisplayName("should ignore diseases marked removed")
        void shouldIgnoreRemovedDiseases() {
            ContentGraph graph = ContentGraph.builder()
                .disease(disease("eczema", "Dermatology", "skin_itching"))
                .disease(disease("scabies", "Dermatology", "skin_itching"))
                .markRemoved("scabies")
                .symptom(mainSymptom("skin_itching", "ointment", "skin_check"))
                .examination(examination("skin_check", "DoctorOffice"))
                .treatment(treatment("ointment"))
                .build();

            assertTrue(validator.validate(graph, settings).isEmpty());
        }

        @Test
        @DisplayName("should require the main symptom to carry the main flag")
        void shouldRequireMainFlag() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .symptom(secondarySymptom("fever", "rest", "temperature"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.MAIN_SYMPTOM_NOT_FLAGGED), typesOf(violations));
            assertEquals("flu", violations.get(0).entityId());
        }

        @Test
        @DisplayName("should reject a secondary symptom flagged as main")
        void shouldRejectMainFlagOnSecondary() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .symptom(mainSymptom("headache", "painkillers", "interview"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(2, violations.size());
            assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.MAIN_FLAG_ON_SECONDARY));
        }
    }

    @Nested
    @DisplayName("Symptoms")
    class SymptomTests {

        @Test
        @DisplayName("should report a symptom without treatment")
        void shouldReportMissingTreatment() {
            Symptom untreated = Symptom.builder()
                .id("fever").name("Fever").main(true)
                .examinationIds(List.of("temperature"))
                .build();
            ContentGraph graph = TestContent.clinic().toBuilder().symptom(untreated).build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.MISSING_TREATMENT), typesOf(violations));
            assertEquals("fever", violations.get(0).entityId());
        }

        @Test
        @DisplayName("should report a treatment reference that does not resolve")
        void shouldReportDanglingTreatment() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .symptom(mainSymptom("fever", "antibiotics", "temperature"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.MISSING_TREATMENT), typesOf(violations));
            assertEquals(List.of("antibiotics"), violations.get(0).relatedIds());
        }

        @Test
        @DisplayName("should report a symptom no examination can detect")
        void shouldReportUncoveredSymptom() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .symptom(mainSymptom("fever", "rest", "thermal_scan"))
                .build();

            List<ViolationType> types = typesOf(validator.validate(graph, settings));

            assertTrue(types.contains(ViolationType.DANGLING_REFERENCE));
            assertTrue(types.contains(ViolationType.UNCOVERED_SYMPTOM));
        }

        @Test
        @DisplayName("should accept a symptom with at least one resolvable examination")
        void shouldAcceptPartiallyResolvableExaminations() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .symptom(mainSymptom("fever", "rest", "temperature", "thermal_scan"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.DANGLING_REFERENCE), typesOf(violations));
        }
    }

    @Nested
    @DisplayName("References and facilities")
    class ReferenceTests {

        @Test
        @DisplayName("should report an unresolved disease symptom")
        void shouldReportDanglingDiseaseSymptom() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .disease(disease("flu", "GeneralPractice", "fever", "headache", "cough"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.DANGLING_REFERENCE), typesOf(violations));
            assertEquals(EntityKind.DISEASE, violations.get(0).kind());
            assertEquals(List.of("cough"), violations.get(0).relatedIds());
        }

        @Test
        @DisplayName("should report a facility outside the configured set")
        void shouldReportUnknownFacility() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .examination(examination("interview", "Hydrotherapy"))
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(List.of(ViolationType.UNKNOWN_FACILITY), typesOf(violations));
        }

        @Test
        @DisplayName("should report unresolved lab peers, collapse symptoms and complications")
        void shouldReportSupplementaryReferences() {
            Examination temperature = examination("temperature", "DoctorOffice").withLabPeerIds(List.of("urine"));
            Symptom fever = mainSymptom("fever", "rest", "temperature").toBuilder()
                .collapseSymptomIds(List.of("shock"))
                .build();
            Treatment rest = treatment("rest").withComplicationSymptomIds(List.of("bedsores"));
            ContentGraph graph = TestContent.clinic().toBuilder()
                .examination(temperature)
                .symptom(fever)
                .treatment(rest)
                .build();

            List<Violation> violations = validator.validate(graph, settings);

            assertEquals(3, violations.size());
            assertTrue(violations.stream().allMatch(v -> v.type() == ViolationType.DANGLING_REFERENCE));
        }

        @Test
        @DisplayName("should run every check instead of stopping at the first problem")
        void shouldRunAllChecks() {
            ContentGraph graph = TestContent.clinic().toBuilder()
                .disease(disease("cold", "GeneralPractice", "fever"))
                .examination(examination("interview", "Hydrotherapy"))
                .symptom(mainSymptom("aura", "surgery", "neuro_exam"))
                .build();

            List<ViolationType> types = typesOf(validator.validate(graph, settings));

            assertTrue(types.contains(ViolationType.DUPLICATE_MAIN_SYMPTOM));
            assertTrue(types.contains(ViolationType.UNKNOWN_FACILITY));
            assertTrue(types.contains(ViolationType.MISSING_TREATMENT));
        }
    }
}
