package io.medpack.integrator.load;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * JSON shape of a package: a manifest ({@code package.json}) when the collections are absent, or a
 * complete single-file package.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PackageDocument(
    @JsonProperty("tag") String tag,
    @JsonProperty("version") @Nullable String version,
    @JsonProperty("priority") int priority,
    @JsonProperty("diseases") List<Disease> diseases,
    @JsonProperty("symptoms") List<Symptom> symptoms,
    @JsonProperty("examinations") List<Examination> examinations,
    @JsonProperty("treatments") List<Treatment> treatments
) {

    @JsonCreator
    public PackageDocument {
        diseases = diseases == null ? List.of() : diseases;
        symptoms = symptoms == null ? List.of() : symptoms;
        examinations = examinations == null ? List.of() : examinations;
        treatments = treatments == null ? List.of() : treatments;
    }

    /**
     * Locates the first null element of the entity arrays, as in {@code "diseases": [null]}.
     *
     * @return position such as {@code diseases[0]}, or {@code null} if every element is present
     */
    @Nullable
    public String firstNullEntry() {
        String position = firstNullEntry("diseases", diseases);
        if (position == null) {
            position = firstNullEntry("symptoms", symptoms);
        }
        if (position == null) {
            position = firstNullEntry("examinations", examinations);
        }
        if (position == null) {
            position = firstNullEntry("treatments", treatments);
        }
        return position;
    }

    @Nullable
    static String firstNullEntry(String collection, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                return collection + "[" + i + "]";
            }
        }
        return null;
    }

    public ContentPackage toContentPackage() {
        return new ContentPackage(tag, version, priority, diseases, symptoms, examinations, treatments);
    }
}
