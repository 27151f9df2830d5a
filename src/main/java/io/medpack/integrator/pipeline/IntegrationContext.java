package io.medpack.integrator.pipeline;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.reassign.ReassignmentDirective;
import io.medpack.integrator.report.IntegrationReport;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Everything a stage needs besides the graph itself.
 *
 * @param settings     immutable run settings
 * @param reassignments curator reassignment directives, in declaration order
 * @param report       report of the run
 */
public record IntegrationContext(
    @NotNull IntegrationSettings settings,
    @NotNull List<ReassignmentDirective> reassignments,
    @NotNull IntegrationReport report
) {

    public IntegrationContext {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(report, "report must not be null");
        reassignments = reassignments == null ? List.of() : List.copyOf(reassignments);
    }

    public static IntegrationContext of(IntegrationSettings settings, IntegrationReport report) {
        return new IntegrationContext(settings, List.of(), report);
    }
}
