package io.medpack.integrator.resolve;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.exception.UnknownEntityReferenceException;
import io.medpack.integrator.model.ContentGraph;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.MedicalEntity;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.validate.Violation;
import io.medpack.integrator.validate.ViolationType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges the packages' definitions into one graph of canonical entities.
 *
 * <p>Algorithm, per entity kind:
 * <ol>
 *   <li>Collect every package's definitions as candidates, in (package tag, id) order</li>
 *   <li>Connect candidates with identical normalized names, and those named by merge directives</li>
 *   <li>Each connected component becomes one canonical entity whose attributes come from the
 *       highest-priority package (ties: smallest tag, then smallest id)</li>
 *   <li>Canonical entities that would share an id are re-identified as {@code id@packageTag},
 *       except the highest-ranked one</li>
 *   <li>Distinct canonical entities with similar names are reported as near-duplicates</li>
 * </ol>
 * Finally every reference is rewritten to canonical ids. The outcome does not depend on the order
 * in which packages are supplied.</p>
 */
@ApplicationScoped
public class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Comparator<Candidate> AUTHORED_ORDER = Comparator
        .comparing(Candidate::packageTag)
        .thenComparing(Candidate::id);

    private final NameSimilarityCalculator similarityCalculator;

    @Inject
    public IdentityResolver(NameSimilarityCalculator similarityCalculator) {
        this.similarityCalculator = similarityCalculator;
    }

    public IdentityResolver() {
        this(new NameSimilarityCalculator());
    }

    /**
     * Resolves identities across packages.
     *
     * @param packages   loaded packages, any order
     * @param directives explicit merge directives
     * @param settings   run settings (similarity threshold and weights)
     * @param report     receives merges, collisions and near-duplicates
     * @return the merged graph and id mappings
     * @throws UnknownEntityReferenceException if a directive names an entity no package defines
     */
    public ResolutionResult resolve(
            @NotNull List<ContentPackage> packages,
            @NotNull List<MergeDirective> directives,
            @NotNull IntegrationSettings settings,
            @NotNull IntegrationReport report) {
        Objects.requireNonNull(packages, "packages must not be null");
        Objects.requireNonNull(directives, "directives must not be null");
        long startTime = System.currentTimeMillis();

        CanonicalIdIndex index = new CanonicalIdIndex();
        Map<EntityKind, List<MedicalEntity>> canonicalByKind = new LinkedHashMap<>();
        int candidateCount = 0;
        int mergedCount = 0;
        int collisionCount = 0;
        int nearDuplicateCount = 0;

        for (EntityKind kind : EntityKind.values()) {
            List<Candidate> candidates = collectCandidates(packages, kind);
            candidateCount += candidates.size();

            List<List<Candidate>> groups = group(candidates, kindDirectives(directives, kind));
            List<Candidate> canonicals = new ArrayList<>();
            for (List<Candidate> members : groups) {
                members.sort(Candidate.CANONICAL_ORDER);
                canonicals.add(members.get(0));
            }

            Map<Candidate, String> assignedIds = assignIds(kind, canonicals, report);
            collisionCount += (int) assignedIds.entrySet().stream()
                .filter(e -> !e.getKey().id().equals(e.getValue()))
                .count();

            List<MedicalEntity> entities = new ArrayList<>();
            for (List<Candidate> members : groups) {
                Candidate canonical = members.get(0);
                String canonicalId = assignedIds.get(canonical);
                for (Candidate member : members) {
                    index.register(kind, member.qualifiedId(), canonicalId);
                    if (member != canonical) {
                        mergedCount++;
                        boolean directed = !member.normalizedName().equals(canonical.normalizedName());
                        report.addMerge(new IntegrationReport.Merge(kind, member.qualifiedId(), canonicalId, directed));
                        logger.info("Merged {} {} into {} ({})", kind.name().toLowerCase(), member.qualifiedId(),
                            canonicalId, directed ? "directive" : "same name");
                    }
                }
                entities.add(reidentify(canonical.entity(), canonicalId));
            }
            canonicalByKind.put(kind, entities);

            nearDuplicateCount += flagNearDuplicates(kind, canonicals, assignedIds, settings, report);
        }

        ReferenceRewriter rewriter = new ReferenceRewriter(index);
        ContentGraph.Builder builder = ContentGraph.builder();
        for (MedicalEntity entity : canonicalByKind.get(EntityKind.DISEASE)) {
            builder.disease(rewriter.rewrite((Disease) entity));
        }
        for (MedicalEntity entity : canonicalByKind.get(EntityKind.SYMPTOM)) {
            builder.symptom(rewriter.rewrite((Symptom) entity));
        }
        for (MedicalEntity entity : canonicalByKind.get(EntityKind.EXAMINATION)) {
            builder.examination(rewriter.rewrite((Examination) entity));
        }
        for (MedicalEntity entity : canonicalByKind.get(EntityKind.TREATMENT)) {
            builder.treatment(rewriter.rewrite((Treatment) entity));
        }

        ResolutionResult result = new ResolutionResult(
            builder.build(),
            index,
            candidateCount,
            mergedCount,
            nearDuplicateCount,
            collisionCount,
            rewriter.rewrittenCount(),
            System.currentTimeMillis() - startTime
        );
        logger.info(result.toLogString());
        return result;
    }

    private List<Candidate> collectCandidates(List<ContentPackage> packages, EntityKind kind) {
        Map<String, Candidate> byQualifiedId = new TreeMap<>();
        for (ContentPackage contentPackage : packages) {
            for (MedicalEntity entity : contentPackage.entitiesOf(kind)) {
                Candidate candidate = new Candidate(
                    contentPackage.tag(),
                    contentPackage.priority(),
                    tagged(entity, contentPackage.tag()),
                    NameNormalizer.normalize(entity.getName(), contentPackage.tag())
                );
                byQualifiedId.put(candidate.qualifiedId(), candidate);
            }
        }
        List<Candidate> candidates = new ArrayList<>(byQualifiedId.values());
        candidates.sort(AUTHORED_ORDER);
        return candidates;
    }

    private List<MergeDirective> kindDirectives(List<MergeDirective> directives, EntityKind kind) {
        List<MergeDirective> result = new ArrayList<>();
        for (MergeDirective directive : directives) {
            if (directive.kind() == kind) {
                result.add(directive);
            }
        }
        return result;
    }

    private List<List<Candidate>> group(List<Candidate> candidates, List<MergeDirective> directives) {
        CandidateClusterer clusterer = new CandidateClusterer(candidates.size());
        List<String> keys = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            // entities without a usable name only merge through directives
            keys.add(candidate.normalizedName().isEmpty() ? "\u0000" + i : candidate.normalizedName());
        }
        clusterer.connectByKey(keys);

        for (MergeDirective directive : directives) {
            List<Integer> sources = matching(candidates, directive.kind(), directive.source());
            List<Integer> targets = matching(candidates, directive.kind(), directive.target());
            clusterer.connectAll(targets.get(0), sources);
            clusterer.connectAll(targets.get(0), targets);
            logger.debug("Merge directive {} {} -> {} joins {} definition(s)", directive.kind(),
                directive.source(), directive.target(), sources.size() + targets.size());
        }

        List<List<Candidate>> groups = new ArrayList<>();
        for (List<Integer> component : clusterer.components()) {
            List<Candidate> members = new ArrayList<>(component.size());
            for (Integer i : component) {
                members.add(candidates.get(i));
            }
            groups.add(members);
        }
        return groups;
    }

    private List<Integer> matching(List<Candidate> candidates, EntityKind kind, String reference) {
        List<Integer> matches = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (candidate.qualifiedId().equals(reference) || candidate.id().equals(reference)) {
                matches.add(i);
            }
        }
        if (matches.isEmpty()) {
            throw new UnknownEntityReferenceException(kind, reference);
        }
        return matches;
    }

    /**
     * Gives every canonical its own id; on a clash the best-ranked canonical keeps the authored id.
     */
    private Map<Candidate, String> assignIds(EntityKind kind, List<Candidate> canonicals, IntegrationReport report) {
        Map<String, List<Candidate>> byId = new TreeMap<>();
        for (Candidate canonical : canonicals) {
            byId.computeIfAbsent(canonical.id(), id -> new ArrayList<>()).add(canonical);
        }

        // authored ids are reserved first so a generated id never takes one of them
        Set<String> taken = new HashSet<>(byId.keySet());
        Map<Candidate, String> assigned = new LinkedHashMap<>();
        for (Map.Entry<String, List<Candidate>> entry : byId.entrySet()) {
            List<Candidate> clashing = entry.getValue();
            clashing.sort(Candidate.CANONICAL_ORDER);
            assigned.put(clashing.get(0), entry.getKey());
            for (int i = 1; i < clashing.size(); i++) {
                Candidate loser = clashing.get(i);
                String newId = freeId(entry.getKey() + "@" + loser.packageTag(), taken);
                assigned.put(loser, newId);
                report.addIdCollision(new IntegrationReport.IdCollision(kind, entry.getKey(), newId, loser.packageTag()));
                logger.warn("Id collision: {} {} from package {} re-identified as {}",
                    kind.name().toLowerCase(), entry.getKey(), loser.packageTag(), newId);
            }
        }
        return assigned;
    }

    private static String freeId(String preferred, Set<String> taken) {
        String id = preferred;
        for (int suffix = 2; !taken.add(id); suffix++) {
            id = preferred + "~" + suffix;
        }
        return id;
    }

    private int flagNearDuplicates(EntityKind kind, List<Candidate> canonicals, Map<Candidate, String> assignedIds,
                                   IntegrationSettings settings, IntegrationReport report) {
        List<Candidate> ordered = new ArrayList<>(canonicals);
        ordered.sort(Comparator.comparing(assignedIds::get));
        int flagged = 0;
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                Candidate first = ordered.get(i);
                Candidate second = ordered.get(j);
                double similarity = similarityCalculator.computeSimilarity(
                    first.normalizedName(), second.normalizedName(), settings);
                if (similarity >= settings.similarityThreshold()) {
                    String firstId = assignedIds.get(first);
                    String secondId = assignedIds.get(second);
                    report.addNearDuplicate(new IntegrationReport.NearDuplicate(kind, firstId, secondId, similarity));
                    report.addViolation(new Violation(ViolationType.NEAR_DUPLICATE, kind, firstId,
                        String.format("'%s' and '%s' have similar names (%.2f); left distinct",
                            first.entity().getName(), second.entity().getName(), similarity),
                        List.of(secondId)));
                    flagged++;
                }
            }
        }
        return flagged;
    }

    private static MedicalEntity tagged(MedicalEntity entity, String packageTag) {
        if (packageTag.equals(entity.getPackageTag())) {
            return entity;
        }
        switch (entity.getKind()) {
            case DISEASE:
                return ((Disease) entity).withPackageTag(packageTag);
            case SYMPTOM:
                return ((Symptom) entity).withPackageTag(packageTag);
            case EXAMINATION:
                return ((Examination) entity).withPackageTag(packageTag);
            case TREATMENT:
                return ((Treatment) entity).withPackageTag(packageTag);
            default:
                throw new IllegalStateException("Unsupported kind: " + entity.getKind());
        }
    }

    private static MedicalEntity reidentify(MedicalEntity entity, String canonicalId) {
        if (entity.getId().equals(canonicalId)) {
            return entity;
        }
        switch (entity.getKind()) {
            case DISEASE:
                return ((Disease) entity).withId(canonicalId);
            case SYMPTOM:
                return ((Symptom) entity).withId(canonicalId);
            case EXAMINATION:
                return ((Examination) entity).withId(canonicalId);
            case TREATMENT:
                return ((Treatment) entity).withId(canonicalId);
            default:
                throw new IllegalStateException("Unsupported kind: " + entity.getKind());
        }
    }
}
