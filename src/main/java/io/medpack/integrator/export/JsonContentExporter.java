package io.medpack.integrator.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports the graph as JSON, one array per entity kind, in the same field names packages use.
 */
@ApplicationScoped
public class JsonContentExporter implements ContentExporter {

    private static final Logger logger = LoggerFactory.getLogger(JsonContentExporter.class);

    @JsonPropertyOrder({"diseases", "symptoms", "examinations", "treatments"})
    record ContentDocument(
        List<Disease> diseases,
        List<Symptom> symptoms,
        List<Examination> examinations,
        List<Treatment> treatments
    ) {
    }

    private final ObjectMapper objectMapper;

    public JsonContentExporter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void export(@NotNull ContentGraph graph, @NotNull OutputStream outputStream) throws IOException {
        ExportShapeChecker.check(graph);
        ContentDocument document = new ContentDocument(
            graph.retainedDiseases(),
            new ArrayList<>(graph.getSymptoms().values()),
            new ArrayList<>(graph.getExaminations().values()),
            new ArrayList<>(graph.getTreatments().values())
        );
        objectMapper.writeValue(new NonClosingOutputStream(outputStream), document);
        logger.info("Exported JSON: {}", graph);
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.JSON;
    }
}
