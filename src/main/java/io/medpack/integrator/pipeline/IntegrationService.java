package io.medpack.integrator.pipeline;

import io.medpack.integrator.config.IntegrationConfig;
import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.directive.DirectiveFile;
import io.medpack.integrator.exception.IntegrationException;
import io.medpack.integrator.exception.UnknownDepartmentException;
import io.medpack.integrator.exception.UnknownEntityReferenceException;
import io.medpack.integrator.exception.ValidationFailedException;
import io.medpack.integrator.export.ContentExporter;
import io.medpack.integrator.export.ContentExporterFactory;
import io.medpack.integrator.export.ExportFormat;
import io.medpack.integrator.load.SourceLoader;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.priority.ExaminationPrioritizer;
import io.medpack.integrator.prune.PruningPass;
import io.medpack.integrator.reassign.ReassignmentEngine;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.resolve.IdentityResolver;
import io.medpack.integrator.resolve.ResolutionResult;
import io.medpack.integrator.validate.ConflictValidator;
import io.medpack.integrator.weight.WeightNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Runs a complete integration: load, resolve, validate, reassign, prune, normalize weights,
 * prioritize examinations and export.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li>{@code integration.run} - id of the run, also the report's run id</li>
 *   <li>{@code integration.stage} - stage currently executing</li>
 * </ul>
 *
 * <p>The caller supplies the report so that it keeps everything recorded before a failure. On
 * failure the report's status is set and the exception is rethrown; nothing is exported.</p>
 */
@ApplicationScoped
public class IntegrationService {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrationService.class);

    static final String MDC_RUN = "integration.run";

    private final IntegrationSettings settings;
    private final SourceLoader sourceLoader;
    private final IdentityResolver identityResolver;
    private final IntegrationPipeline pipeline;
    private final ContentExporterFactory exporterFactory;

    @Inject
    public IntegrationService(
            IntegrationConfig config,
            SourceLoader sourceLoader,
            IdentityResolver identityResolver,
            ConflictValidator conflictValidator,
            ReassignmentEngine reassignmentEngine,
            PruningPass pruningPass,
            WeightNormalizer weightNormalizer,
            ExaminationPrioritizer examinationPrioritizer,
            ContentExporterFactory exporterFactory) {
        this(IntegrationSettings.from(config), sourceLoader, identityResolver,
            standardPipeline(conflictValidator, reassignmentEngine, pruningPass, weightNormalizer,
                examinationPrioritizer),
            exporterFactory);
    }

    public IntegrationService(
            IntegrationSettings settings,
            SourceLoader sourceLoader,
            IdentityResolver identityResolver,
            IntegrationPipeline pipeline,
            ContentExporterFactory exporterFactory) {
        this.settings = settings;
        this.sourceLoader = sourceLoader;
        this.identityResolver = identityResolver;
        this.pipeline = pipeline;
        this.exporterFactory = exporterFactory;
    }

    /**
     * Service built from plain objects, for use without a container.
     */
    public static IntegrationService standalone(@NotNull IntegrationSettings settings) {
        return new IntegrationService(
            settings,
            new SourceLoader(),
            new IdentityResolver(),
            standardPipeline(new ConflictValidator(), new ReassignmentEngine(), new PruningPass(),
                new WeightNormalizer(), new ExaminationPrioritizer()),
            ContentExporterFactory.standalone());
    }

    /**
     * Stages in execution order.
     */
    public static IntegrationPipeline standardPipeline(
            ConflictValidator conflictValidator,
            ReassignmentEngine reassignmentEngine,
            PruningPass pruningPass,
            WeightNormalizer weightNormalizer,
            ExaminationPrioritizer examinationPrioritizer) {
        return IntegrationPipeline.builder()
            .addStage(conflictValidator)
            .addStage(reassignmentEngine)
            .addStage(pruningPass)
            .addStage(weightNormalizer)
            .addStage(examinationPrioritizer)
            .build();
    }

    public IntegrationSettings getSettings() {
        return settings;
    }

    /**
     * Creates an empty report with a fresh run id.
     */
    public IntegrationReport newReport() {
        return new IntegrationReport(UUID.randomUUID().toString());
    }

    /**
     * Integrates packages read from disk.
     *
     * @param sources    package directories or single-file packages
     * @param directives curator directives
     * @param format     export format, or null for the configured default
     * @param report     report of this run
     * @return the final graph and exported document
     */
    public IntegrationResult integrate(@NotNull List<Path> sources, @NotNull DirectiveFile directives,
                                       @Nullable ExportFormat format, @NotNull IntegrationReport report) {
        return run(report, () -> sourceLoader.load(sources, settings, report), directives, format);
    }

    /**
     * Integrates packages already in memory.
     */
    public IntegrationResult integratePackages(@NotNull List<ContentPackage> packages, @NotNull DirectiveFile directives,
                                               @Nullable ExportFormat format, @NotNull IntegrationReport report) {
        return run(report, () -> sourceLoader.prepare(packages, report), directives, format);
    }

    private IntegrationResult run(IntegrationReport report, PackageSupplier packages, DirectiveFile directives,
                                  @Nullable ExportFormat format) {
        MDC.put(MDC_RUN, report.getRunId());
        long startTime = System.currentTimeMillis();
        try {
            IntegrationSettings runSettings = settings.withDepartmentShares(directives.departmentShares());
            ExportFormat exportFormat = format != null ? format : runSettings.exportFormat();
            ContentExporter exporter = exporterFactory.getExporter(exportFormat);

            MDC.put(IntegrationPipeline.MDC_STAGE, "load");
            List<ContentPackage> loaded = packages.get();

            MDC.put(IntegrationPipeline.MDC_STAGE, "resolve");
            ResolutionResult resolution = identityResolver.resolve(loaded, directives.merges(), runSettings, report);

            IntegrationContext context = new IntegrationContext(runSettings, directives.reassignments(), report);
            ContentGraph graph = pipeline.execute(resolution.graph(), context);

            MDC.put(IntegrationPipeline.MDC_STAGE, "export");
            String document = exporter.exportToString(graph);

            report.succeeded();
            LOG.info("Integration succeeded in {}ms: {}", System.currentTimeMillis() - startTime, report.toLogString());
            return new IntegrationResult(report, graph, exportFormat, document);
        } catch (ValidationFailedException e) {
            report.rejected(e.getMessage());
            LOG.warn("Integration rejected: {}", report.toLogString());
            throw e;
        } catch (UnknownEntityReferenceException | UnknownDepartmentException e) {
            report.rejected(e.getMessage());
            LOG.warn("Integration rejected: directive failed: {}", e.getMessage());
            throw e;
        } catch (IntegrationException e) {
            report.failed(e.getMessage());
            LOG.error("Integration failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(IntegrationPipeline.MDC_STAGE);
            MDC.remove(MDC_RUN);
        }
    }

    @FunctionalInterface
    private interface PackageSupplier {
        List<ContentPackage> get();
    }
}
