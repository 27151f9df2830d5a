package io.medpack.integrator.export;

import io.medpack.integrator.exception.IntegrationException;
import io.medpack.integrator.exception.UnsupportedEntityShapeException;
import io.medpack.integrator.model.ContentGraph;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes a final content graph in a format the engine reads.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST NOT modify the graph or touch anything but the stream</li>
 *   <li>MUST fail with {@link UnsupportedEntityShapeException} before writing anything when an
 *       entity cannot be represented</li>
 *   <li>MUST NOT close the output stream (caller responsibility)</li>
 * </ul>
 *
 * @see ContentExporterFactory
 */
public interface ContentExporter {

    /**
     * Exports the graph to the output stream.
     *
     * @param graph        final graph (removed diseases are skipped)
     * @param outputStream stream to write to
     * @throws UnsupportedEntityShapeException if an entity cannot be represented
     * @throws IOException                     if writing fails
     */
    void export(@NotNull ContentGraph graph, @NotNull OutputStream outputStream) throws IOException;

    /**
     * Gets the export format this exporter handles.
     */
    ExportFormat getFormat();

    default String getMimeType() {
        return getFormat().getMimeType();
    }

    default String getFileExtension() {
        return getFormat().getExtension();
    }

    /**
     * Exports the graph to a UTF-8 string.
     */
    default String exportToString(@NotNull ContentGraph graph) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            export(graph, buffer);
        } catch (IOException e) {
            throw new IntegrationException("Export to " + getFormat() + " failed", e);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
