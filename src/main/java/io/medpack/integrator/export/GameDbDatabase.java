package io.medpack.integrator.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

/**
 * XML document layout of the engine's content database.
 */
@JacksonXmlRootElement(localName = "Database")
record GameDbDatabase(
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "GameDBMedicalCondition")
    List<Condition> conditions,

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "GameDBSymptom")
    List<Symptom> symptoms,

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "GameDBExamination")
    List<Examination> examinations,

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "GameDBTreatment")
    List<Treatment> treatments
) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Condition(
        @JacksonXmlProperty(isAttribute = true, localName = "ID") String id,
        @JacksonXmlProperty(localName = "Name") String name,
        @JacksonXmlProperty(localName = "DepartmentRef") String departmentRef,
        @JacksonXmlProperty(localName = "Frequency") Double frequency,
        @JacksonXmlProperty(localName = "TreatmentCost") Integer treatmentCost,
        @JacksonXmlElementWrapper(localName = "Tags") @JacksonXmlProperty(localName = "Tag") List<String> tags,
        @JacksonXmlElementWrapper(localName = "Symptoms") @JacksonXmlProperty(localName = "GameDBSymptomRules")
        List<SymptomRule> rules
    ) {
    }

    record SymptomRule(
        @JacksonXmlProperty(localName = "GameDBSymptomRef") String symptomRef,
        @JacksonXmlProperty(localName = "IsMainSymptom") boolean main
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Symptom(
        @JacksonXmlProperty(isAttribute = true, localName = "ID") String id,
        @JacksonXmlProperty(localName = "Name") String name,
        @JacksonXmlProperty(localName = "DepartmentRef") String departmentRef,
        @JacksonXmlProperty(localName = "IsMainSymptom") boolean main,
        @JacksonXmlProperty(localName = "Severity") Integer severity,
        @JacksonXmlProperty(localName = "Discomfort") Integer discomfort,
        @JacksonXmlProperty(localName = "ComplicationRisk") Double complicationRisk,
        @JacksonXmlElementWrapper(localName = "Examinations") @JacksonXmlProperty(localName = "ExaminationRef")
        List<String> examinationRefs,
        @JacksonXmlElementWrapper(localName = "Treatments") @JacksonXmlProperty(localName = "TreatmentRef")
        List<String> treatmentRefs,
        @JacksonXmlElementWrapper(useWrapping = false) @JacksonXmlProperty(localName = "CollapseSymptomRef")
        List<String> collapseSymptomRefs
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Examination(
        @JacksonXmlProperty(isAttribute = true, localName = "ID") String id,
        @JacksonXmlProperty(localName = "Name") String name,
        @JacksonXmlProperty(localName = "Procedure") Procedure procedure,
        @JacksonXmlProperty(localName = "Discomfort") Integer discomfort,
        @JacksonXmlElementWrapper(useWrapping = false) @JacksonXmlProperty(localName = "LabTestingExaminationRef")
        List<String> labTestingRefs
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Procedure(
        @JacksonXmlElementWrapper(localName = "RequiredRoomTags") @JacksonXmlProperty(localName = "Tag")
        List<String> roomTags,
        @JacksonXmlElementWrapper(localName = "RequiredEquipmentList") @JacksonXmlProperty(localName = "RequiredEquipment")
        List<Equipment> equipment,
        @JacksonXmlProperty(localName = "DurationMinutes") Integer durationMinutes,
        @JacksonXmlProperty(localName = "Priority") Integer priority
    ) {
    }

    record Equipment(@JacksonXmlProperty(localName = "Tag") String tag) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Treatment(
        @JacksonXmlProperty(isAttribute = true, localName = "ID") String id,
        @JacksonXmlProperty(localName = "Name") String name,
        @JacksonXmlProperty(localName = "Type") String type,
        @JacksonXmlProperty(localName = "HospitalizationRequired")
        boolean hospitalization,
        @JacksonXmlProperty(localName = "Discomfort") Integer discomfort,
        @JacksonXmlElementWrapper(localName = "Complication") @JacksonXmlProperty(localName = "SymptomRef")
        List<String> complicationRefs
    ) {
    }
}
