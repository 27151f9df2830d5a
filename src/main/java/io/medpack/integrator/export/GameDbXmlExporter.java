package io.medpack.integrator.export;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
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
 * Exports the graph as an engine content database (GameDB XML).
 *
 * <p>Format:</p>
 * <pre>
 * &lt;Database&gt;
 *   &lt;GameDBMedicalCondition ID="..."&gt;
 *     &lt;Symptoms&gt;&lt;GameDBSymptomRules&gt;&lt;GameDBSymptomRef&gt;...&lt;/GameDBSymptomRef&gt;...
 *   &lt;GameDBSymptom ID="..."&gt;...
 *   &lt;GameDBExamination ID="..."&gt;&lt;Procedure&gt;&lt;RequiredRoomTags&gt;...
 *   &lt;GameDBTreatment ID="..."&gt;...
 * &lt;/Database&gt;
 * </pre>
 */
@ApplicationScoped
public class GameDbXmlExporter implements ContentExporter {

    private static final Logger logger = LoggerFactory.getLogger(GameDbXmlExporter.class);

    private final XmlMapper xmlMapper;

    public GameDbXmlExporter() {
        this.xmlMapper = XmlMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
            .build();
    }

    @Override
    public void export(@NotNull ContentGraph graph, @NotNull OutputStream outputStream) throws IOException {
        ExportShapeChecker.check(graph);
        GameDbDatabase database = toDatabase(graph);
        xmlMapper.writeValue(new NonClosingOutputStream(outputStream), database);
        logger.info("Exported GameDB XML: {}", graph);
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.XML;
    }

    GameDbDatabase toDatabase(ContentGraph graph) {
        List<GameDbDatabase.Condition> conditions = new ArrayList<>();
        for (Disease disease : graph.retainedDiseases()) {
            List<GameDbDatabase.SymptomRule> rules = new ArrayList<>();
            rules.add(new GameDbDatabase.SymptomRule(disease.getMainSymptomId(), true));
            for (String secondaryId : disease.getSecondarySymptomIds()) {
                rules.add(new GameDbDatabase.SymptomRule(secondaryId, false));
            }
            conditions.add(new GameDbDatabase.Condition(
                disease.getId(),
                disease.getName(),
                disease.getDepartment(),
                disease.getFrequencyWeight(),
                disease.getTreatmentCost(),
                new ArrayList<>(disease.getTags()),
                rules
            ));
        }

        List<GameDbDatabase.Symptom> symptoms = new ArrayList<>();
        for (Symptom symptom : graph.getSymptoms().values()) {
            symptoms.add(new GameDbDatabase.Symptom(
                symptom.getId(),
                symptom.getName(),
                symptom.getDepartment(),
                symptom.isMain(),
                symptom.getSeverity(),
                symptom.getDiscomfort(),
                symptom.getComplicationRisk(),
                new ArrayList<>(symptom.getExaminationIds()),
                symptom.getTreatmentId() == null ? List.of() : List.of(symptom.getTreatmentId()),
                new ArrayList<>(symptom.getCollapseSymptomIds())
            ));
        }

        List<GameDbDatabase.Examination> examinations = new ArrayList<>();
        for (Examination examination : graph.getExaminations().values()) {
            List<GameDbDatabase.Equipment> equipment = new ArrayList<>();
            examination.getRequiredEquipment().forEach(tag -> equipment.add(new GameDbDatabase.Equipment(tag)));
            examinations.add(new GameDbDatabase.Examination(
                examination.getId(),
                examination.getName(),
                new GameDbDatabase.Procedure(
                    List.of(ExportShapeChecker.facilityOf(examination).getDisplayName()),
                    equipment,
                    examination.getDurationMinutes(),
                    examination.getPriority()
                ),
                examination.getDiscomfort(),
                new ArrayList<>(examination.getLabPeerIds())
            ));
        }

        List<GameDbDatabase.Treatment> treatments = new ArrayList<>();
        for (Treatment treatment : graph.getTreatments().values()) {
            treatments.add(new GameDbDatabase.Treatment(
                treatment.getId(),
                treatment.getName(),
                treatment.getTreatmentKind().getWireName(),
                treatment.isHospitalizationRequired(),
                treatment.getDiscomfort(),
                new ArrayList<>(treatment.getComplicationSymptomIds())
            ));
        }

        return new GameDbDatabase(conditions, symptoms, examinations, treatments);
    }
}
