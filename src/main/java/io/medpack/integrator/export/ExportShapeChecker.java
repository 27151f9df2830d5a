package io.medpack.integrator.export;

import io.medpack.integrator.exception.UnsupportedEntityShapeException;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.FacilityKind;
import io.medpack.integrator.model.Treatment;

/**
 * Rejects graphs holding entities the engine cannot represent.
 */
final class ExportShapeChecker {

    private ExportShapeChecker() {
    }

    static void check(ContentGraph graph) {
        for (Disease disease : graph.retainedDiseases()) {
            Double weight = disease.getFrequencyWeight();
            if (weight != null && !Double.isFinite(weight)) {
                throw new UnsupportedEntityShapeException(EntityKind.DISEASE, disease.getId(),
                    "frequency weight " + weight + " is not a finite number");
            }
        }
        for (Examination examination : graph.getExaminations().values()) {
            facilityOf(examination);
        }
        for (Treatment treatment : graph.getTreatments().values()) {
            if (treatment.getTreatmentKind() == null) {
                throw new UnsupportedEntityShapeException(EntityKind.TREATMENT, treatment.getId(),
                    "treatment kind is missing");
            }
        }
    }

    static FacilityKind facilityOf(Examination examination) {
        return FacilityKind.fromName(examination.getFacility())
            .orElseThrow(() -> new UnsupportedEntityShapeException(EntityKind.EXAMINATION, examination.getId(),
                "facility '" + examination.getFacility() + "' is not one of " + FacilityKind.displayNames()));
    }
}
