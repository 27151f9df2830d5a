package io.medpack.integrator.reassign;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.exception.UnknownDepartmentException;
import io.medpack.integrator.exception.UnknownEntityReferenceException;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.report.IntegrationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.medpack.integrator.TestContent.examination;
import static io.medpack.integrator.TestContent.mainSymptom;
import static io.medpack.integrator.TestContent.treatment;
import static org.junit.jupiter.api.Assertions.*;

class ReassignmentEngineTest {

    private ReassignmentEngine engine;
    private IntegrationSettings settings;
    private IntegrationReport report;

    @BeforeEach
    void setUp() {
        engine = new ReassignmentEngine();
        settings = IntegrationSettings.builder()
            .departments(List.of("GeneralPractice", "Psychology", "Neurology", "Psychiatry"))
            .build();
        report = new IntegrationReport("test-run");
    }

    private static Disease tagged(String id, String department, String mainSymptomId, String... tags) {
        return Disease.builder()
            .id(id)
            .name(id)
            .department(department)
            .mainSymptomId(mainSymptomId)
            .tags(List.of(tags))
            .build();
    }

    /**
     * Psychology holds two mental-health diseases and one sleep disorder.
     */
    private static ContentGraph psychology() {
        return ContentGraph.builder()
            .disease(tagged("depression", "Psychology", "low_mood", "mental-health"))
            .disease(tagged("anxiety", "Psychology", "worry", "Mental-Health"))
            .disease(tagged("insomnia", "Psychology", "sleeplessness", "sleep"))
            .disease(tagged("migraine", "Neurology", "aura"))
            .symptom(mainSymptom("low_mood", "therapy", "interview"))
            .symptom(mainSymptom("worry", "therapy", "interview"))
            .symptom(mainSymptom("sleeplessness", "sleeping_pills", "interview"))
            .symptom(mainSymptom("aura", "painkillers", "interview").withDepartment("Neurology"))
            .examination(examination("interview", "DoctorOffice"))
            .treatment(treatment("therapy"))
            .treatment(treatment("sleeping_pills"))
            .treatment(treatment("painkillers"))
            .build();
    }

    private ContentGraph run(ContentGraph graph, ReassignmentDirective... directives) {
        return engine.apply(graph, new IntegrationContext(settings, List.of(directives), report));
    }

    @Test
    @DisplayName("should skip when there are no directives")
    void shouldSkipWithoutDirectives() {
        assertTrue(engine.shouldSkip(IntegrationContext.of(settings, report)));
        assertFalse(engine.shouldSkip(new IntegrationContext(settings,
            List.of(new MoveToDepartment("migraine", "Psychology")), report)));
    }

    @Nested
    @DisplayName("restrictToCategory")
    class RestrictTests {

        @Test
        @DisplayName("should mark Psychology diseases without a kept tag as removed")
        void shouldRestrictPsychology() {
            ContentGraph result = run(psychology(), new RestrictToCategory("Psychology", Set.of("mental-health")));

            assertEquals(Set.of("insomnia"), result.getRemovedDiseaseIds());
            assertTrue(result.getDiseases().containsKey("insomnia"));
            assertEquals(List.of("insomnia"), report.getRemovedDiseases());
            assertFalse(result.isRemoved("migraine"));
        }

        @Test
        @DisplayName("should match keep tags case-insensitively")
        void shouldMatchTagsIgnoringCase() {
            ContentGraph result = run(psychology(), new RestrictToCategory("Psychology", Set.of("MENTAL-HEALTH")));

            assertFalse(result.isRemoved("anxiety"));
            assertFalse(result.isRemoved("depression"));
        }

        @Test
        @DisplayName("should fail on a department nobody knows")
        void shouldRejectUnknownDepartment() {
            assertThrows(UnknownDepartmentException.class,
                () -> run(psychology(), new RestrictToCategory("Astrology", Set.of("stars"))));
        }
    }

    @Nested
    @DisplayName("moveToDepartment")
    class MoveTests {

        @Test
        @DisplayName("should move a disease")
        void shouldMoveDisease() {
            ContentGraph result = run(psychology(), new MoveToDepartment("insomnia", "Neurology"));

            assertEquals("Neurology", result.getDiseases().get("insomnia").getDepartment());
            assertEquals(List.of("insomnia"), report.getAppliedDirectives().get(0).affectedIds());
        }

        @Test
        @DisplayName("should move a symptom when the kind says so")
        void shouldMoveSymptom() {
            ContentGraph result = run(psychology(), new MoveToDepartment(EntityKind.SYMPTOM, "aura", "Psychiatry"));

            assertEquals("Psychiatry", result.getSymptoms().get("aura").getDepartment());
            assertEquals("Neurology", result.getDiseases().get("migraine").getDepartment());
        }

        @Test
        @DisplayName("should fail on an unknown entity")
        void shouldRejectUnknownEntity() {
            UnknownEntityReferenceException e = assertThrows(UnknownEntityReferenceException.class,
                () -> run(psychology(), new MoveToDepartment("narcolepsy", "Neurology")));

            assertTrue(e.getMessage().contains("narcolepsy"));
        }

        @Test
        @DisplayName("should accept a department that only appears in content")
        void shouldAcceptContentDepartment() {
            settings = IntegrationSettings.builder().departments(List.of()).build();

            ContentGraph result = run(psychology(), new MoveToDepartment("migraine", "Psychology"));

            assertEquals("Psychology", result.getDiseases().get("migraine").getDepartment());
        }
    }

    @Nested
    @DisplayName("mergeDepartments")
    class MergeDepartmentsTests {

        @Test
        @DisplayName("should move every disease and symptom of the source department")
        void shouldMergeDepartments() {
            ContentGraph result = run(psychology(), new MergeDepartments("Neurology", "Psychiatry"));

            assertEquals("Psychiatry", result.getDiseases().get("migraine").getDepartment());
            assertEquals("Psychiatry", result.getSymptoms().get("aura").getDepartment());
            assertEquals(List.of("migraine", "aura"), report.getAppliedDirectives().get(0).affectedIds());
        }
    }

    @Test
    @DisplayName("should keep earlier directives in the report when a later one fails")
    void shouldRecordDirectivesBeforeFailure() {
        ContentGraph graph = psychology();

        assertThrows(UnknownDepartmentException.class, () -> run(graph,
            new MoveToDepartment("insomnia", "Neurology"),
            new RestrictToCategory("Psychology", Set.of("mental-health")),
            new MoveToDepartment("migraine", "Astrology")));

        assertEquals(2, report.getAppliedDirectives().size());
        assertEquals(0, report.getAppliedDirectives().get(0).index());
        assertEquals(1, report.getAppliedDirectives().get(1).index());
        assertTrue(report.getRemovedDiseases().isEmpty());
    }

    @Test
    @DisplayName("should apply directives in declaration order")
    void shouldApplyInOrder() {
        ContentGraph result = run(psychology(),
            new MoveToDepartment("insomnia", "Neurology"),
            new RestrictToCategory("Psychology", Set.of("mental-health")));

        assertTrue(result.getRemovedDiseaseIds().isEmpty());
    }
}
