package io.medpack.integrator.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.medpack.integrator.report.IntegrationReport;

/**
 * Problem details body (RFC 7807) returned by the REST interface.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance,
    IntegrationReport report
) {

    public ErrorResponse(String type, String title, int status, String detail, String instance) {
        this(type, title, status, detail, instance, null);
    }
}
