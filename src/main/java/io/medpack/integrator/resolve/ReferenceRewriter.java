package io.medpack.integrator.resolve;

import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites the references held by canonical entities to canonical ids.
 *
 * <p>Handles:
 * <ul>
 *   <li>Disease main and secondary symptoms</li>
 *   <li>Symptom examinations, treatment and collapse symptoms</li>
 *   <li>Examination lab peers</li>
 *   <li>Treatment complication symptoms</li>
 * </ul>
 * Self references among collapse symptoms and lab peers are dropped, and references that become
 * equal after rewriting are collapsed into one, keeping the first position. A secondary symptom
 * that rewrites to the main symptom is dropped.</p>
 */
public final class ReferenceRewriter {

    private static final Logger LOG = Logger.getLogger(ReferenceRewriter.class);

    private final CanonicalIdIndex index;
    private int rewritten;

    public ReferenceRewriter(@NotNull CanonicalIdIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * Number of references changed so far.
     */
    public int rewrittenCount() {
        return rewritten;
    }

    @NotNull
    public Disease rewrite(@NotNull Disease disease) {
        String tag = disease.getPackageTag();
        String main = resolve(EntityKind.SYMPTOM, tag, disease.getMainSymptomId());
        Set<String> secondaries = resolveAll(EntityKind.SYMPTOM, tag, disease.getSecondarySymptomIds(), main);
        if (main.equals(disease.getMainSymptomId()) && secondaries.equals(disease.getSecondarySymptomIds())) {
            return disease;
        }
        LOG.debugf("Rewrote symptom references of disease %s", disease.getId());
        return disease.withSymptoms(main, secondaries);
    }

    @NotNull
    public Symptom rewrite(@NotNull Symptom symptom) {
        String tag = symptom.getPackageTag();
        Set<String> exams = resolveAll(EntityKind.EXAMINATION, tag, symptom.getExaminationIds(), null);
        String treatment = symptom.getTreatmentId() == null
            ? null
            : resolve(EntityKind.TREATMENT, tag, symptom.getTreatmentId());
        Set<String> collapse = resolveAll(EntityKind.SYMPTOM, tag, symptom.getCollapseSymptomIds(), symptom.getId());
        if (exams.equals(symptom.getExaminationIds())
                && Objects.equals(treatment, symptom.getTreatmentId())
                && collapse.equals(symptom.getCollapseSymptomIds())) {
            return symptom;
        }
        LOG.debugf("Rewrote references of symptom %s", symptom.getId());
        return symptom.withReferences(exams, treatment, collapse);
    }

    @NotNull
    public Examination rewrite(@NotNull Examination examination) {
        Set<String> peers = resolveAll(EntityKind.EXAMINATION, examination.getPackageTag(),
            examination.getLabPeerIds(), examination.getId());
        if (peers.equals(examination.getLabPeerIds())) {
            return examination;
        }
        LOG.debugf("Rewrote lab peers of examination %s", examination.getId());
        return examination.withLabPeerIds(peers);
    }

    @NotNull
    public Treatment rewrite(@NotNull Treatment treatment) {
        Set<String> complications = resolveAll(EntityKind.SYMPTOM, treatment.getPackageTag(),
            treatment.getComplicationSymptomIds(), null);
        if (complications.equals(treatment.getComplicationSymptomIds())) {
            return treatment;
        }
        LOG.debugf("Rewrote complications of treatment %s", treatment.getId());
        return treatment.withComplicationSymptomIds(complications);
    }

    private String resolve(EntityKind kind, @Nullable String tag, String reference) {
        String resolved = index.resolve(kind, tag, reference);
        if (!resolved.equals(reference)) {
            rewritten++;
        }
        return resolved;
    }

    private Set<String> resolveAll(EntityKind kind, @Nullable String tag, Collection<String> references,
                                   @Nullable String excluded) {
        List<String> resolved = new ArrayList<>(references.size());
        for (String reference : references) {
            resolved.add(resolve(kind, tag, reference));
        }
        Set<String> unique = new LinkedHashSet<>(resolved);
        if (excluded != null) {
            unique.remove(excluded);
        }
        return unique;
    }
}
