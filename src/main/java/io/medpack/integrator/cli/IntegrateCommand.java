package io.medpack.integrator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.medpack.integrator.directive.DirectiveFile;
import io.medpack.integrator.directive.DirectiveFileReader;
import io.medpack.integrator.exception.IntegrationException;
import io.medpack.integrator.exception.UnknownDepartmentException;
import io.medpack.integrator.exception.UnknownEntityReferenceException;
import io.medpack.integrator.exception.ValidationFailedException;
import io.medpack.integrator.pipeline.IntegrationResult;
import io.medpack.integrator.pipeline.IntegrationService;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.report.MarkdownReportRenderer;
import io.medpack.integrator.validate.Violation;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <p>With arguments, runs one integration and exits; without, keeps the application running so
 * the REST endpoint serves requests.</p>
 *
 * <h2>Exit codes:</h2>
 * <ul>
 *   <li>{@code 0} - integrated and exported</li>
 *   <li>{@code 1} - hard violations</li>
 *   <li>{@code 2} - a directive names an unknown entity or department</li>
 *   <li>{@code 3} - loading, directive parsing, export or output failed</li>
 *   <li>{@code 64} - usage error</li>
 * </ul>
 */
@QuarkusMain
public class IntegrateCommand implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(IntegrateCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_DIRECTIVE = 2;
    public static final int EXIT_FAILURE = 3;
    public static final int EXIT_USAGE = 64;

    private final IntegrationService integrationService;
    private final DirectiveFileReader directiveReader;
    private final MarkdownReportRenderer reportRenderer;
    private final ObjectMapper reportMapper;

    @Inject
    public IntegrateCommand(
            IntegrationService integrationService,
            DirectiveFileReader directiveReader,
            MarkdownReportRenderer reportRenderer,
            ObjectMapper objectMapper) {
        this.integrationService = integrationService;
        this.directiveReader = directiveReader;
        this.reportRenderer = reportRenderer;
        this.reportMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public int run(String... args) {
        if (args.length == 0) {
            Quarkus.waitForExit();
            return EXIT_OK;
        }
        return execute(System.err, args);
    }

    /**
     * Runs one integration from command arguments.
     *
     * @param err  receives the usage text and curator-facing failure messages
     * @param args command arguments
     * @return process exit code
     */
    public int execute(PrintStream err, String... args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (CommandLineOptions.UsageException e) {
            err.println(e.getMessage());
            err.println(CommandLineOptions.USAGE);
            return EXIT_USAGE;
        }

        IntegrationReport report = integrationService.newReport();
        LOG.infof("Integrating %d package source(s) into %s (run %s)",
            options.packages().size(), options.out(), report.getRunId());
        int exitCode = integrate(options, report, err);
        if (options.report() != null && !writeReport(options, report, err) && exitCode == EXIT_OK) {
            exitCode = EXIT_FAILURE;
        }
        return exitCode;
    }

    private int integrate(CommandLineOptions options, IntegrationReport report, PrintStream err) {
        try {
            DirectiveFile directives = options.directives() != null
                ? directiveReader.read(options.directives())
                : DirectiveFile.empty();
            IntegrationResult result = integrationService.integrate(
                options.packages(), directives, options.format(), report);
            writeDocument(options.out(), result.document());
            LOG.infof("Wrote %s document to %s", result.format().getExtension(), options.out());
            return EXIT_OK;
        } catch (ValidationFailedException e) {
            err.println(e.getMessage());
            for (Violation violation : e.getViolations()) {
                err.println("  " + violation.toLogString());
            }
            return EXIT_VIOLATIONS;
        } catch (UnknownEntityReferenceException | UnknownDepartmentException e) {
            err.println("Directive failed: " + e.getMessage());
            return EXIT_DIRECTIVE;
        } catch (IntegrationException e) {
            err.println("Integration failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.errorf(e, "Could not write %s", options.out());
            err.println("Could not write " + options.out() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void writeDocument(Path out, String document) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(out, document, StandardCharsets.UTF_8);
    }

    private boolean writeReport(CommandLineOptions options, IntegrationReport report, PrintStream err) {
        try (OutputStream out = Files.newOutputStream(options.report())) {
            if (options.markdownReport()) {
                reportRenderer.render(report, out);
            } else {
                reportMapper.writeValue(out, report);
            }
            LOG.debugf("Wrote report to %s", options.report());
            return true;
        } catch (IOException e) {
            LOG.errorf(e, "Could not write report %s", options.report());
            err.println("Could not write report " + options.report() + ": " + e.getMessage());
            return false;
        }
    }
}
