package io.medpack.integrator.report;

import io.medpack.integrator.validate.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an integration report as Markdown for curators.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * # Integration Report
 *
 * Run: 3f1c... | Status: REJECTED
 *
 * ## Violations (1)
 *
 * | Type | Kind | Entity | Message |
 * |------|------|--------|---------|
 * | DUPLICATE_MAIN_SYMPTOM | symptom | skin_itching | ... |
 * </pre>
 *
 * <p>Empty sections are left out.</p>
 */
@ApplicationScoped
public class MarkdownReportRenderer {

    public String getMimeType() {
        return "text/markdown";
    }

    public String getFileExtension() {
        return "md";
    }

    public void render(@NotNull IntegrationReport report, @NotNull OutputStream outputStream) throws IOException {
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        write(report, writer);
        writer.flush();
    }

    @NotNull
    public String renderToString(@NotNull IntegrationReport report) {
        StringWriter out = new StringWriter();
        try (BufferedWriter writer = new BufferedWriter(out)) {
            write(report, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render report", e);
        }
        return out.toString();
    }

    private void write(IntegrationReport report, BufferedWriter writer) throws IOException {
        line(writer, "# Integration Report");
        writer.newLine();
        line(writer, "Run: " + report.getRunId() + " | Status: " + report.getStatus());
        if (report.getFailure() != null) {
            writer.newLine();
            line(writer, "> " + escape(report.getFailure()));
        }

        if (!report.getPackages().isEmpty()) {
            header(writer, "Packages", report.getPackages().size(), "Tag", "Version", "Priority", "Entities");
            for (IntegrationReport.PackageSummary p : report.getPackages()) {
                row(writer, p.tag(), p.version() != null ? p.version() : "-",
                    String.valueOf(p.priority()), String.valueOf(p.entities()));
            }
        }

        writeViolations(writer, "Violations", report.getViolations());
        writeViolations(writer, "Warnings", report.getWarnings());

        if (!report.getMerges().isEmpty()) {
            header(writer, "Merges", report.getMerges().size(), "Kind", "Superseded", "Canonical", "Directed");
            for (IntegrationReport.Merge m : report.getMerges()) {
                row(writer, kind(m.kind().name()), m.supersededId(), m.canonicalId(), m.directed() ? "yes" : "no");
            }
        }

        if (!report.getNearDuplicates().isEmpty()) {
            header(writer, "Near Duplicates", report.getNearDuplicates().size(), "Kind", "First", "Second", "Similarity");
            for (IntegrationReport.NearDuplicate n : report.getNearDuplicates()) {
                row(writer, kind(n.kind().name()), n.firstId(), n.secondId(),
                    String.format(Locale.ROOT, "%.2f", n.similarity()));
            }
        }

        if (!report.getIdCollisions().isEmpty()) {
            header(writer, "Id Collisions", report.getIdCollisions().size(), "Kind", "Original", "Assigned", "Package");
            for (IntegrationReport.IdCollision c : report.getIdCollisions()) {
                row(writer, kind(c.kind().name()), c.originalId(), c.assignedId(), c.packageTag());
            }
        }

        if (!report.getDuplicateDefinitions().isEmpty()) {
            header(writer, "Duplicate Definitions", report.getDuplicateDefinitions().size(), "Package", "Kind", "Id");
            for (IntegrationReport.DuplicateDefinition d : report.getDuplicateDefinitions()) {
                row(writer, d.packageTag(), kind(d.kind().name()), d.id());
            }
        }

        if (!report.getAppliedDirectives().isEmpty()) {
            header(writer, "Applied Directives", report.getAppliedDirectives().size(), "#", "Directive", "Affected");
            for (IntegrationReport.AppliedDirective a : report.getAppliedDirectives()) {
                row(writer, String.valueOf(a.index()), a.description(), String.join(", ", a.affectedIds()));
            }
        }

        if (!report.getPrunedEntities().isEmpty()) {
            header(writer, "Pruned Entities", report.getPrunedEntities().size(), "Kind", "Id");
            for (IntegrationReport.PrunedEntity p : report.getPrunedEntities()) {
                row(writer, kind(p.kind().name()), p.id());
            }
        }

        if (!report.getDepartmentShares().isEmpty()) {
            header(writer, "Department Shares", report.getDepartmentShares().size(), "Department", "Share");
            for (Map.Entry<String, Double> e : report.getDepartmentShares().entrySet()) {
                row(writer, e.getKey().isEmpty() ? "(none)" : e.getKey(),
                    String.format(Locale.ROOT, "%.4f", e.getValue()));
            }
        }

        if (!report.getWeights().isEmpty()) {
            header(writer, "Weights", report.getWeights().size(), "Disease", "Department", "Raw", "Normalized");
            for (IntegrationReport.WeightChange w : report.getWeights()) {
                row(writer, w.diseaseId(), w.department() != null && !w.department().isEmpty() ? w.department() : "-",
                    String.format(Locale.ROOT, "%.2f", w.rawWeight()),
                    String.format(Locale.ROOT, "%.2f", w.normalizedWeight()));
            }
        }

        if (!report.getExaminationPriorities().isEmpty()) {
            header(writer, "Examination Priorities", report.getExaminationPriorities().size(),
                "Examination", "Category", "Score", "Priority");
            for (IntegrationReport.ExaminationPriority e : report.getExaminationPriorities()) {
                row(writer, e.examinationId(), e.category(),
                    String.format(Locale.ROOT, "%.0f", e.score()), String.valueOf(e.priority()));
            }
        }
    }

    private void writeViolations(BufferedWriter writer, String title, List<Violation> violations) throws IOException {
        if (violations.isEmpty()) {
            return;
        }
        header(writer, title, violations.size(), "Type", "Kind", "Entity", "Message");
        for (Violation v : violations) {
            row(writer, v.type().name(), kind(v.kind().name()), v.entityId(), v.message());
        }
    }

    private void header(BufferedWriter writer, String title, int count, String... columns) throws IOException {
        writer.newLine();
        line(writer, "## " + title + " (" + count + ")");
        writer.newLine();
        row(writer, columns);
        StringBuilder separator = new StringBuilder("|");
        for (String column : columns) {
            separator.append("-".repeat(column.length() + 2)).append('|');
        }
        line(writer, separator.toString());
    }

    private void row(BufferedWriter writer, String... cells) throws IOException {
        StringBuilder row = new StringBuilder("|");
        for (String cell : cells) {
            row.append(' ').append(escape(cell)).append(" |");
        }
        line(writer, row.toString());
    }

    private static void line(BufferedWriter writer, String text) throws IOException {
        writer.write(text);
        writer.newLine();
    }

    private static String kind(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Replaces pipes and newlines which would break table formatting.
     */
    private static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text
            .replace("|", "\\|")
            .replace("\n", " ")
            .replace("\r", "");
    }
}
