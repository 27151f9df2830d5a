package io.medpack.integrator.export;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the {@link ContentExporter} for a format.
 *
 * <p>Uses CDI to discover all available exporters; outside a container the factory can be built
 * from an explicit list.</p>
 */
@ApplicationScoped
public class ContentExporterFactory {

    private final Map<ExportFormat, ContentExporter> exporters;

    /**
     * Default constructor for CDI proxy.
     */
    public ContentExporterFactory() {
        this.exporters = new EnumMap<>(ExportFormat.class);
    }

    /**
     * Constructs the factory with CDI-discovered exporters.
     *
     * @param exporterInstances All ContentExporter implementations
     */
    @Inject
    public ContentExporterFactory(Instance<ContentExporter> exporterInstances) {
        this(exporterInstances.stream().toList());
    }

    public ContentExporterFactory(List<ContentExporter> exporterList) {
        this.exporters = new EnumMap<>(ExportFormat.class);
        for (ContentExporter exporter : exporterList) {
            exporters.put(exporter.getFormat(), exporter);
        }
    }

    /**
     * Both built-in exporters, for use without a container.
     */
    public static ContentExporterFactory standalone() {
        return new ContentExporterFactory(List.of(new GameDbXmlExporter(), new JsonContentExporter()));
    }

    /**
     * Gets the exporter for the specified format.
     *
     * @throws IllegalArgumentException if no exporter is registered for the format
     */
    @NotNull
    public ContentExporter getExporter(@NotNull ExportFormat format) {
        ContentExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new IllegalArgumentException(
                    "No exporter registered for format: " + format +
                    ". Available formats: " + exporters.keySet());
        }
        return exporter;
    }

    public boolean hasExporter(@NotNull ExportFormat format) {
        return exporters.containsKey(format);
    }
}
