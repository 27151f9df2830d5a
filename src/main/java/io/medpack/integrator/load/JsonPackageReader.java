package io.medpack.integrator.load;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.medpack.integrator.exception.PackageLoadException;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.Examination;
import io.medpack.integrator.model.Symptom;
import io.medpack.integrator.model.Treatment;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads content packages stored as JSON.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>a directory with {@code package.json} (tag, version, priority) and optional
 *       {@code diseases.json}, {@code symptoms.json}, {@code examinations.json} and
 *       {@code treatments.json}, each a JSON array</li>
 *   <li>a single {@code .json} file holding the manifest fields and the four arrays</li>
 * </ul>
 * Unknown properties are ignored.</p>
 */
@ApplicationScoped
public class JsonPackageReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonPackageReader.class);

    static final String MANIFEST_FILE = "package.json";

    private final ObjectMapper objectMapper;

    @Inject
    public JsonPackageReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public JsonPackageReader() {
        this(new ObjectMapper());
    }

    /**
     * Reads one package from a directory or a single JSON file.
     *
     * @param source package directory or file
     * @return the package, entities in document order
     * @throws PackageLoadException if the source is missing, unreadable or malformed
     */
    @NotNull
    public ContentPackage read(@NotNull Path source) {
        if (Files.isDirectory(source)) {
            return readDirectory(source);
        }
        if (Files.isRegularFile(source) && source.getFileName().toString().endsWith(".json")) {
            PackageDocument document = readValue(source, objectMapper.constructType(PackageDocument.class));
            return toPackage(source, document);
        }
        throw new PackageLoadException(source, "not a package directory or .json file");
    }

    private ContentPackage readDirectory(Path directory) {
        Path manifestFile = directory.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            throw new PackageLoadException(directory, "missing " + MANIFEST_FILE);
        }
        PackageDocument manifest = readValue(manifestFile, objectMapper.constructType(PackageDocument.class));

        List<Disease> diseases = readCollection(directory, EntityKind.DISEASE, Disease.class);
        List<Symptom> symptoms = readCollection(directory, EntityKind.SYMPTOM, Symptom.class);
        List<Examination> examinations = readCollection(directory, EntityKind.EXAMINATION, Examination.class);
        List<Treatment> treatments = readCollection(directory, EntityKind.TREATMENT, Treatment.class);

        // collections embedded in the manifest come first, files after
        PackageDocument merged = new PackageDocument(
            manifest.tag(),
            manifest.version(),
            manifest.priority(),
            concat(manifest.diseases(), diseases),
            concat(manifest.symptoms(), symptoms),
            concat(manifest.examinations(), examinations),
            concat(manifest.treatments(), treatments)
        );
        return toPackage(manifestFile, merged);
    }

    private <T> List<T> readCollection(Path directory, EntityKind kind, Class<T> type) {
        Path file = directory.resolve(kind.getCollectionName() + ".json");
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<T> values = readValue(file, objectMapper.getTypeFactory().constructCollectionType(List.class, type));
        if (values == null) {
            return List.of();
        }
        String nullEntry = PackageDocument.firstNullEntry(kind.getCollectionName(), values);
        if (nullEntry != null) {
            throw new PackageLoadException(file, "null entry at " + nullEntry);
        }
        logger.debug("Read {} {} from {}", values.size(), kind.getCollectionName(), file);
        return values;
    }

    private <T> T readValue(Path file, JavaType type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (JsonProcessingException e) {
            throw new PackageLoadException(file, "malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PackageLoadException(file, "cannot read file: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new PackageLoadException(file, "invalid content: " + e.getMessage(), e);
        }
    }

    private ContentPackage toPackage(Path source, PackageDocument document) {
        if (document == null) {
            throw new PackageLoadException(source, "empty document");
        }
        if (document.tag() == null || document.tag().isBlank()) {
            throw new PackageLoadException(source, "package tag is missing");
        }
        String nullEntry = document.firstNullEntry();
        if (nullEntry != null) {
            throw new PackageLoadException(source, "null entry at " + nullEntry);
        }
        return document.toContentPackage();
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        List<T> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
