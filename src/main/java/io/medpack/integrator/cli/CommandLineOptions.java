package io.medpack.integrator.cli;

import io.medpack.integrator.export.ExportFormat;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed arguments of the {@code integrate} command.
 *
 * <pre>
 * integrate --packages &lt;dir...&gt; [--directives &lt;file&gt;] --out &lt;file&gt; [--report &lt;file&gt;] [--format xml|json]
 * </pre>
 *
 * @param packages   package directories or single-file packages, at least one
 * @param directives directive file, or null for none
 * @param out        where the exported document is written
 * @param report     where the report is written; Markdown when it ends in {@code .md}, JSON otherwise
 * @param format     export format, or null for the configured default
 */
public record CommandLineOptions(
    @NotNull List<Path> packages,
    @Nullable Path directives,
    @NotNull Path out,
    @Nullable Path report,
    @Nullable ExportFormat format
) {

    static final String COMMAND = "integrate";
    static final String USAGE =
        "Usage: integrate --packages <dir...> [--directives <file>] --out <file> [--report <file>] [--format xml|json]";

    public CommandLineOptions {
        packages = List.copyOf(packages);
        Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Parses command arguments; a leading {@code integrate} is accepted and ignored.
     *
     * @throws UsageException if an option is unknown, repeated, missing its value, or a required
     *                        option is absent
     */
    public static CommandLineOptions parse(@NotNull String... args) {
        List<Path> packages = new ArrayList<>();
        Path directives = null;
        Path out = null;
        Path report = null;
        ExportFormat format = null;

        int i = 0;
        if (args.length > 0 && COMMAND.equals(args[0])) {
            i++;
        }
        while (i < args.length) {
            String option = args[i++];
            switch (option) {
                case "--packages":
                    if (!packages.isEmpty()) {
                        throw new UsageException("--packages given more than once");
                    }
                    while (i < args.length && !args[i].startsWith("--")) {
                        packages.add(Path.of(args[i++]));
                    }
                    if (packages.isEmpty()) {
                        throw new UsageException("--packages needs at least one directory");
                    }
                    break;
                case "--directives":
                    directives = single(option, directives, args, i++);
                    break;
                case "--out":
                    out = single(option, out, args, i++);
                    break;
                case "--report":
                    report = single(option, report, args, i++);
                    break;
                case "--format":
                    if (format != null) {
                        throw new UsageException("--format given more than once");
                    }
                    format = parseFormat(value(option, args, i++));
                    break;
                default:
                    throw new UsageException("Unknown option: " + option);
            }
        }

        if (packages.isEmpty()) {
            throw new UsageException("--packages is required");
        }
        if (out == null) {
            throw new UsageException("--out is required");
        }
        return new CommandLineOptions(packages, directives, out, report, format);
    }

    public boolean markdownReport() {
        return report != null && report.getFileName().toString().toLowerCase().endsWith(".md");
    }

    private static Path single(String option, Path current, String[] args, int index) {
        if (current != null) {
            throw new UsageException(option + " given more than once");
        }
        return Path.of(value(option, args, index));
    }

    private static String value(String option, String[] args, int index) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new UsageException(option + " needs a value");
        }
        return args[index];
    }

    private static ExportFormat parseFormat(String value) {
        try {
            return ExportFormat.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    /**
     * Thrown for malformed command lines.
     */
    public static class UsageException extends IllegalArgumentException {
        public UsageException(String message) {
            super(message);
        }
    }
}
