package io.medpack.integrator.weight;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.pipeline.IntegrationContext;
import io.medpack.integrator.pipeline.IntegrationStage;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.validate.Violation;
import io.medpack.integrator.validate.ViolationType;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rescales disease frequency weights so that each department holds its share of the total.
 *
 * <p>For a department d with share s(d), every disease i of d gets
 * {@code raw(i) / sum(raw in d) * s(d) * totalWeight}, which keeps the ratios between diseases of
 * one department. Configured shares are kept as given. Departments without a positive share split
 * the remainder {@code 1 - sum(configured)} in proportion to their raw weights. When every
 * department is configured the shares are rescaled to sum to 1; when configured shares already
 * reach 1 while some department is unconfigured, all departments fall back to raw fractions.</p>
 *
 * <p>A missing raw weight is the baseline. A raw weight of zero or less is reported as
 * {@link ViolationType#ZERO_WEIGHT} and also treated as the baseline, so no disease ends at zero.</p>
 */
@ApplicationScoped
public class WeightNormalizer implements IntegrationStage {

    private static final Logger logger = LoggerFactory.getLogger(WeightNormalizer.class);

    /**
     * Department key for diseases that belong to none.
     */
    static final String UNASSIGNED = "";

    @Override
    public ContentGraph apply(@NotNull ContentGraph graph, @NotNull IntegrationContext context) {
        return normalize(graph, context.settings(), context.report());
    }

    @Override
    public String getName() {
        return "normalize-weights";
    }

    /**
     * Normalizes the weights of all retained diseases.
     *
     * @param graph    pruned graph
     * @param settings baseline, total and department shares
     * @param report   receives warnings, effective shares and every weight change
     * @return graph with normalized weights
     */
    public ContentGraph normalize(@NotNull ContentGraph graph, @NotNull IntegrationSettings settings,
                                  @NotNull IntegrationReport report) {
        List<Disease> diseases = graph.retainedDiseases();
        if (diseases.isEmpty()) {
            return graph;
        }

        Map<String, Double> rawWeights = new LinkedHashMap<>();
        Map<String, Double> rawByDepartment = new TreeMap<>();
        double rawTotal = 0.0;
        for (Disease disease : diseases) {
            double raw = rawWeight(disease, settings, report);
            rawWeights.put(disease.getId(), raw);
            rawByDepartment.merge(departmentOf(disease), raw, Double::sum);
            rawTotal += raw;
        }

        Map<String, Double> shares = effectiveShares(rawByDepartment, rawTotal, settings);
        shares.forEach(report::putDepartmentShare);

        ContentGraph.Builder builder = graph.toBuilder();
        for (Disease disease : diseases) {
            String department = departmentOf(disease);
            double raw = rawWeights.get(disease.getId());
            double normalized = raw / rawByDepartment.get(department) * shares.get(department) * settings.totalWeight();
            builder.disease(disease.withFrequencyWeight(normalized));
            report.addWeightChange(new IntegrationReport.WeightChange(disease.getId(), disease.getDepartment(),
                raw, normalized));
        }

        logger.info("Normalized {} disease weights across {} department(s) to a total of {}",
            diseases.size(), shares.size(), settings.totalWeight());
        return builder.build();
    }

    private double rawWeight(Disease disease, IntegrationSettings settings, IntegrationReport report) {
        Double weight = disease.getFrequencyWeight();
        if (weight == null) {
            return settings.baselineWeight();
        }
        if (!Double.isFinite(weight) || weight <= 0) {
            report.addViolation(Violation.of(ViolationType.ZERO_WEIGHT, EntityKind.DISEASE, disease.getId(),
                "frequency weight " + weight + " replaced by baseline " + settings.baselineWeight()));
            logger.warn("Disease {} has weight {}; using baseline {}", disease.getId(), weight, settings.baselineWeight());
            return settings.baselineWeight();
        }
        return weight;
    }

    private Map<String, Double> effectiveShares(Map<String, Double> rawByDepartment, double rawTotal,
                                                IntegrationSettings settings) {
        Map<String, Double> shares = new TreeMap<>();
        List<String> unconfigured = new ArrayList<>();
        double configuredSum = 0.0;
        double unconfiguredRaw = 0.0;
        for (Map.Entry<String, Double> entry : rawByDepartment.entrySet()) {
            Double configured = settings.departmentShares().get(entry.getKey());
            if (configured != null && configured > 0) {
                shares.put(entry.getKey(), configured);
                configuredSum += configured;
            } else {
                if (configured != null) {
                    logger.warn("Department {} has share {}; treating it as unconfigured", entry.getKey(), configured);
                }
                unconfigured.add(entry.getKey());
                unconfiguredRaw += entry.getValue();
            }
        }

        if (unconfigured.isEmpty()) {
            return rescale(shares, configuredSum);
        }
        logger.debug("Departments without a configured share: {}", unconfigured);

        if (configuredSum >= 1.0) {
            // Nothing left for the unconfigured departments; a zero share would zero their diseases.
            logger.warn("Configured shares sum to {} and leave nothing for {}; using raw fractions for all departments",
                configuredSum, unconfigured);
            for (String department : unconfigured) {
                shares.put(department, rawByDepartment.get(department) / rawTotal);
            }
            return rescale(shares, shares.values().stream().mapToDouble(Double::doubleValue).sum());
        }

        double remainder = 1.0 - configuredSum;
        for (String department : unconfigured) {
            shares.put(department, remainder * rawByDepartment.get(department) / unconfiguredRaw);
        }
        return shares;
    }

    private static Map<String, Double> rescale(Map<String, Double> shares, double sum) {
        shares.replaceAll((department, share) -> share / sum);
        return shares;
    }

    private static String departmentOf(Disease disease) {
        return disease.getDepartment() == null ? UNASSIGNED : disease.getDepartment();
    }
}
