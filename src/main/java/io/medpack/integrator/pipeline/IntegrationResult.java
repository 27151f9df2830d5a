package io.medpack.integrator.pipeline;

import io.medpack.integrator.export.ExportFormat;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.report.IntegrationReport;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Outcome of a successful integration run.
 *
 * @param report   everything the run decided
 * @param graph    final graph
 * @param format   format of the exported document
 * @param document exported document
 */
public record IntegrationResult(
    @NotNull IntegrationReport report,
    @NotNull ContentGraph graph,
    @NotNull ExportFormat format,
    @NotNull String document
) {

    public IntegrationResult {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(document, "document must not be null");
    }
}
