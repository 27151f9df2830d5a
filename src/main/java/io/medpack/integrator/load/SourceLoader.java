package io.medpack.integrator.load;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.exception.PackageLoadException;
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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Loads content packages and prepares them for identity resolution.
 *
 * <p>Packages are read concurrently on a bounded pool and returned sorted by tag, so the result
 * does not depend on completion order. Preparation rejects duplicate package tags and, inside each
 * package, keeps only the last definition of a repeated id.</p>
 */
@ApplicationScoped
public class SourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(SourceLoader.class);

    private final JsonPackageReader reader;

    @Inject
    public SourceLoader(JsonPackageReader reader) {
        this.reader = reader;
    }

    public SourceLoader() {
        this(new JsonPackageReader());
    }

    /**
     * Reads every source and prepares the packages.
     *
     * @param sources  package directories or single-file packages
     * @param settings supplies the loader pool size
     * @param report   receives package summaries and dropped duplicate definitions
     * @return packages sorted by tag
     * @throws PackageLoadException if a source cannot be read or two packages share a tag
     */
    public List<ContentPackage> load(
            @NotNull List<Path> sources,
            @NotNull IntegrationSettings settings,
            @NotNull IntegrationReport report) {
        if (sources.isEmpty()) {
            throw new PackageLoadException("No package sources given");
        }
        long startTime = System.currentTimeMillis();
        int numThreads = Math.min(settings.loaderThreads(), sources.size());
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        List<ContentPackage> loaded = new ArrayList<>();
        try {
            List<CompletableFuture<ContentPackage>> futures = new ArrayList<>();
            for (Path source : sources) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    ContentPackage contentPackage = reader.read(source);
                    logger.debug("Read package {} ({} entities) from {}",
                        contentPackage.tag(), contentPackage.entityCount(), source);
                    return contentPackage;
                }, executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<ContentPackage> future : futures) {
                loaded.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof PackageLoadException) {
                throw (PackageLoadException) e.getCause();
            }
            throw new PackageLoadException("Package loading failed: " + e.getCause(), e.getCause());
        } finally {
            executor.shutdown();
        }

        List<ContentPackage> prepared = prepare(loaded, report);
        logger.info("Loaded {} package(s) from {} source(s) in {}ms",
            prepared.size(), sources.size(), System.currentTimeMillis() - startTime);
        return prepared;
    }

    /**
     * Sorts packages by tag, rejects duplicate tags and drops repeated definitions.
     *
     * @throws PackageLoadException if two packages share a tag
     */
    public List<ContentPackage> prepare(@NotNull List<ContentPackage> packages, @NotNull IntegrationReport report) {
        Map<String, ContentPackage> byTag = new TreeMap<>();
        for (ContentPackage contentPackage : packages) {
            if (byTag.putIfAbsent(contentPackage.tag(), contentPackage) != null) {
                throw new PackageLoadException("Duplicate package tag '" + contentPackage.tag() + "'");
            }
        }

        List<ContentPackage> prepared = new ArrayList<>();
        for (ContentPackage contentPackage : byTag.values()) {
            ContentPackage deduplicated = keepLastDefinitions(contentPackage, report);
            report.addPackage(new IntegrationReport.PackageSummary(
                deduplicated.tag(), deduplicated.version(), deduplicated.priority(), deduplicated.entityCount()));
            prepared.add(deduplicated);
        }
        prepared.sort(Comparator.comparing(ContentPackage::tag));
        return prepared;
    }

    /**
     * Keeps only the last definition of each id, at the position of that definition.
     */
    ContentPackage keepLastDefinitions(ContentPackage contentPackage, IntegrationReport report) {
        List<Disease> diseases = lastDefinitions(contentPackage, EntityKind.DISEASE, contentPackage.diseases(), report);
        List<Symptom> symptoms = lastDefinitions(contentPackage, EntityKind.SYMPTOM, contentPackage.symptoms(), report);
        List<Examination> examinations = lastDefinitions(contentPackage, EntityKind.EXAMINATION,
            contentPackage.examinations(), report);
        List<Treatment> treatments = lastDefinitions(contentPackage, EntityKind.TREATMENT,
            contentPackage.treatments(), report);
        int dropped = contentPackage.entityCount()
            - (diseases.size() + symptoms.size() + examinations.size() + treatments.size());
        if (dropped == 0) {
            return contentPackage;
        }
        return new ContentPackage(contentPackage.tag(), contentPackage.version(), contentPackage.priority(),
            diseases, symptoms, examinations, treatments);
    }

    private <T extends MedicalEntity> List<T> lastDefinitions(
            ContentPackage contentPackage, EntityKind kind, List<T> entities, IntegrationReport report) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T entity : entities) {
            if (byId.remove(entity.getId()) != null) {
                report.addDuplicateDefinition(
                    new IntegrationReport.DuplicateDefinition(contentPackage.tag(), kind, entity.getId()));
                report.addViolation(Violation.of(ViolationType.DUPLICATE_DEFINITION, kind, entity.getId(),
                    "defined more than once in package " + contentPackage.tag() + "; last definition kept"));
                logger.warn("Package {} defines {} {} more than once; keeping the last definition",
                    contentPackage.tag(), kind.name().toLowerCase(), entity.getId());
            }
            byId.put(entity.getId(), entity);
        }
        return new ArrayList<>(byId.values());
    }
}
