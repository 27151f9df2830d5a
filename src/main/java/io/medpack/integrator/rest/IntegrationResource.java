package io.medpack.integrator.rest;

import io.medpack.integrator.exception.PackageLoadException;
import io.medpack.integrator.export.ExportFormat;
import io.medpack.integrator.load.PackageDocument;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.pipeline.IntegrationResult;
import io.medpack.integrator.pipeline.IntegrationService;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.report.MarkdownReportRenderer;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * REST resource running integrations over packages posted in the request body.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code POST /integrations} - integrate and return the exported document with the report</li>
 *   <li>{@code POST /integrations/report} - integrate and return only the report as Markdown</li>
 * </ul>
 *
 * <p>Failures are mapped to {@code application/problem+json} by
 * {@link io.medpack.integrator.exception.IntegrationExceptionMapper}; a rejected run answers 422
 * with the report attached.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * POST /integrations
 * Content-Type: application/json
 *
 * {
 *   "packages": [{"tag": "neuro", "priority": 10, "diseases": [...], "symptoms": [...]}],
 *   "directives": {"reassignments": [{"type": "mergeDepartments", "source": "Neuro", "target": "Neurology"}]},
 *   "format": "json"
 * }
 * }</pre>
 */
@Path("/integrations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class IntegrationResource {

    private static final Logger LOG = Logger.getLogger(IntegrationResource.class);

    private final IntegrationService integrationService;
    private final MarkdownReportRenderer reportRenderer;

    @Inject
    public IntegrationResource(IntegrationService integrationService, MarkdownReportRenderer reportRenderer) {
        this.integrationService = integrationService;
        this.reportRenderer = reportRenderer;
    }

    @POST
    public Response integrate(@Valid @NotNull IntegrationRequest request) {
        IntegrationResult result = run(request);
        return Response.ok(new IntegrationResponse(result)).build();
    }

    @POST
    @Path("/report")
    @Produces("text/markdown")
    public Response report(@Valid @NotNull IntegrationRequest request) {
        IntegrationResult result = run(request);
        return Response.ok(reportRenderer.renderToString(result.report()), "text/markdown").build();
    }

    private IntegrationResult run(IntegrationRequest request) {
        ExportFormat format = parseFormat(request.format());
        List<ContentPackage> packages = toPackages(request.packages());
        IntegrationReport report = integrationService.newReport();

        LOG.infof("Integration request: run=%s, packages=%d, merges=%d, reassignments=%d, format=%s",
            report.getRunId(), packages.size(), request.directivesOrEmpty().merges().size(),
            request.directivesOrEmpty().reassignments().size(), format);

        IntegrationResult result = integrationService.integratePackages(
            packages, request.directivesOrEmpty(), format, report);
        LOG.infof("Integration completed: %s", report.toLogString());
        return result;
    }

    private static ExportFormat parseFormat(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ExportFormat.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
    }

    private static List<ContentPackage> toPackages(List<PackageDocument> documents) {
        List<ContentPackage> packages = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            PackageDocument document = documents.get(i);
            if (document == null) {
                throw new PackageLoadException("Package #" + i + " is empty");
            }
            if (document.tag() == null || document.tag().isBlank()) {
                throw new PackageLoadException("Package #" + i + " has no tag");
            }
            String nullEntry = document.firstNullEntry();
            if (nullEntry != null) {
                throw new PackageLoadException("Package '" + document.tag() + "' has a null entry at " + nullEntry);
            }
            packages.add(document.toContentPackage());
        }
        return packages;
    }
}
