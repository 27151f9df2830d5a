package io.medpack.integrator.rest;

import io.medpack.integrator.pipeline.IntegrationResult;
import io.medpack.integrator.report.IntegrationReport;

/**
 * Response wrapper for a successful integration.
 *
 * @param format   format of {@code document}
 * @param mimeType MIME type of {@code document}
 * @param document exported content for the downstream engine
 * @param report   integration report
 */
public record IntegrationResponse(
    String format,
    String mimeType,
    String document,
    IntegrationReport report
) {

    public IntegrationResponse(IntegrationResult result) {
        this(
            result.format().getExtension(),
            result.format().getMimeType(),
            result.document(),
            result.report()
        );
    }
}
