package io.medpack.integrator.weight;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.validate.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WeightNormalizerTest {

    private static final double EPSILON = 1e-9;

    private WeightNormalizer normalizer;
    private IntegrationReport report;

    @BeforeEach
    void setUp() {
        normalizer = new WeightNormalizer();
        report = new IntegrationReport("test-run");
    }

    private static Disease weighted(String id, String department, Double weight) {
        return Disease.builder()
            .id(id)
            .name(id)
            .department(department)
            .mainSymptomId(id + "_symptom")
            .frequencyWeight(weight)
            .build();
    }

    private static double weightOf(ContentGraph graph, String id) {
        return graph.getDiseases().get(id).getFrequencyWeight();
    }

    private static ContentGraph departments() {
        return ContentGraph.builder()
            .disease(weighted("flu", "GeneralPractice", 2.0))
            .disease(weighted("cold", "GeneralPractice", 1.0))
            .disease(weighted("migraine", "Neurology", 3.0))
            .disease(weighted("epilepsy", "Neurology", 1.0))
            .build();
    }

    @Test
    @DisplayName("should give each department its share and keep ratios inside it")
    void shouldApplySharesAndKeepRatios() {
        IntegrationSettings settings = IntegrationSettings.builder()
            .totalWeight(1000)
            .departmentShares(Map.of("GeneralPractice", 0.75, "Neurology", 0.25))
            .build();

        ContentGraph result = normalizer.normalize(departments(), settings, report);

        assertEquals(500.0, weightOf(result, "flu"), EPSILON);
        assertEquals(250.0, weightOf(result, "cold"), EPSILON);
        assertEquals(187.5, weightOf(result, "migraine"), EPSILON);
        assertEquals(62.5, weightOf(result, "epilepsy"), EPSILON);
        assertEquals(2.0, weightOf(result, "flu") / weightOf(result, "cold"), EPSILON);
        assertEquals(0.75, report.getDepartmentShares().get("GeneralPractice"), EPSILON);
    }

    @Test
    @DisplayName("should use raw fractions for departments without a share")
    void shouldFallBackToRawFraction() {
        IntegrationSettings settings = IntegrationSettings.builder().totalWeight(70).build();

        ContentGraph result = normalizer.normalize(departments(), settings, report);

        assertEquals(20.0, weightOf(result, "flu"), EPSILON);
        assertEquals(10.0, weightOf(result, "cold"), EPSILON);
        assertEquals(30.0, weightOf(result, "migraine"), EPSILON);
        assertEquals(10.0, weightOf(result, "epilepsy"), EPSILON);
    }

    @Test
    @DisplayName("should keep a configured share when another department has none")
    void shouldKeepConfiguredShareBesideUnconfiguredDepartment() {
        ContentGraph graph = ContentGraph.builder()
            .disease(weighted("anxiety", "Psychology", 5.0))
            .disease(weighted("flu", "GeneralPractice", 5.0))
            .build();
        IntegrationSettings settings = IntegrationSettings.builder()
            .totalWeight(1000)
            .departmentShares(Map.of("Psychology", 0.2))
            .build();

        ContentGraph result = normalizer.normalize(graph, settings, report);

        assertEquals(200.0, weightOf(result, "anxiety"), EPSILON);
        assertEquals(800.0, weightOf(result, "flu"), EPSILON);
        assertEquals(0.2, report.getDepartmentShares().get("Psychology"), EPSILON);
        assertEquals(0.8, report.getDepartmentShares().get("GeneralPractice"), EPSILON);
    }

    @Test
    @DisplayName("should split the remaining share over unconfigured departments by raw weight")
    void shouldSplitRemainderByRawWeight() {
        ContentGraph graph = departments().toBuilder()
            .disease(weighted("anxiety", "Psychology", 10.0))
            .build();
        IntegrationSettings settings = IntegrationSettings.builder()
            .totalWeight(1000)
            .departmentShares(Map.of("Psychology", 0.6))
            .build();

        ContentGraph result = normalizer.normalize(graph, settings, report);

        assertEquals(600.0, weightOf(result, "anxiety"), EPSILON);
        // GeneralPractice 3 and Neurology 4 raw share the remaining 0.4
        assertEquals(400.0 * 3 / 7, weightOf(result, "flu") + weightOf(result, "cold"), EPSILON);
        assertEquals(400.0 * 4 / 7, weightOf(result, "migraine") + weightOf(result, "epilepsy"), EPSILON);
        assertEquals(3.0, weightOf(result, "migraine") / weightOf(result, "epilepsy"), EPSILON);
    }

    @Test
    @DisplayName("should not zero unconfigured departments when configured shares use up the total")
    void shouldFallBackWhenConfiguredSharesLeaveNothing() {
        ContentGraph graph = ContentGraph.builder()
            .disease(weighted("anxiety", "Psychology", 5.0))
            .disease(weighted("flu", "GeneralPractice", 5.0))
            .build();
        IntegrationSettings settings = IntegrationSettings.builder()
            .totalWeight(100)
            .departmentShares(Map.of("Psychology", 1.0))
            .build();

        ContentGraph result = normalizer.normalize(graph, settings, report);

        assertTrue(weightOf(result, "flu") > 0);
        assertEquals(100.0, weightOf(result, "anxiety") + weightOf(result, "flu"), EPSILON);
    }

    @Test
    @DisplayName("should renormalize shares that do not sum to one")
    void shouldRenormalizeShares() {
        IntegrationSettings settings = IntegrationSettings.builder()
            .totalWeight(100)
            .departmentShares(Map.of("GeneralPractice", 3.0, "Neurology", 1.0))
            .build();

        ContentGraph result = normalizer.normalize(departments(), settings, report);

        double total = result.getDiseases().values().stream().mapToDouble(Disease::getFrequencyWeight).sum();
        assertEquals(100.0, total, EPSILON);
        assertEquals(75.0, weightOf(result, "flu") + weightOf(result, "cold"), EPSILON);
    }

    @Test
    @DisplayName("should warn about a zero weight and use the baseline")
    void shouldReplaceZeroWeight() {
        ContentGraph graph = ContentGraph.builder()
            .disease(weighted("flu", "GeneralPractice", 0.0))
            .disease(weighted("cold", "GeneralPractice", null))
            .build();
        IntegrationSettings settings = IntegrationSettings.builder().baselineWeight(1.0).totalWeight(10).build();

        ContentGraph result = normalizer.normalize(graph, settings, report);

        assertEquals(5.0, weightOf(result, "flu"), EPSILON);
        assertEquals(5.0, weightOf(result, "cold"), EPSILON);
        assertEquals(1, report.getWarnings().size());
        assertEquals(ViolationType.ZERO_WEIGHT, report.getWarnings().get(0).type());
        assertFalse(report.hasHardViolations());
    }

    @Test
    @DisplayName("should leave removed diseases untouched")
    void shouldSkipRemovedDiseases() {
        ContentGraph graph = departments().toBuilder().markRemoved("epilepsy").build();
        IntegrationSettings settings = IntegrationSettings.builder().totalWeight(60).build();

        ContentGraph result = normalizer.normalize(graph, settings, report);

        assertEquals(1.0, weightOf(result, "epilepsy"), EPSILON);
        assertEquals(30.0, weightOf(result, "migraine"), EPSILON);
        assertEquals(3, report.getWeights().size());
    }
}
