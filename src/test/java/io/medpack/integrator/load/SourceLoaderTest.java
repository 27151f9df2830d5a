package io.medpack.integrator.load;

import io.medpack.integrator.config.IntegrationSettings;
import io.medpack.integrator.exception.PackageLoadException;
import io.medpack.integrator.model.ContentPackage;
import io.medpack.integrator.model.Disease;
import io.medpack.integrator.model.EntityKind;
import io.medpack.integrator.model.TreatmentKind;
import io.medpack.integrator.report.IntegrationReport;
import io.medpack.integrator.validate.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static io.medpack.integrator.TestContent.pkg;
import static io.medpack.integrator.TestContent.treatment;
import static org.junit.jupiter.api.Assertions.*;

class SourceLoaderTest {

    @TempDir
    Path tempDir;

    private SourceLoader loader;
    private IntegrationSettings settings;
    private IntegrationReport report;

    @BeforeEach
    void setUp() {
        loader = new SourceLoader();
        settings = IntegrationSettings.builder().loaderThreads(2).build();
        report = new IntegrationReport("test-run");
    }

    private Path packageDirectory(String name, String manifest) throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve(name));
        Files.writeString(directory.resolve("package.json"), manifest);
        return directory;
    }

    private Path neurologyDirectory() throws IOException {
        Path directory = packageDirectory("neuro", "{\"tag\": \"neuro\", \"version\": \"2.1\", \"priority\": 10}");
        Files.writeString(directory.resolve("diseases.json"),
            "[{\"id\": \"migraine\", \"name\": \"Migraine\", \"department\": \"Neurology\","
                + " \"main_symptom\": \"aura\", \"secondary_symptoms\": [\"headache\"],"
                + " \"frequency_weight\": 2.5, \"tags\": [\"chronic\"]}]");
        Files.writeString(directory.resolve("symptoms.json"),
            "[{\"id\": \"aura\", \"name\": \"Aura\", \"is_main\": true, \"treatment\": \"painkillers\","
                + " \"examinations\": [\"neuro_exam\"]},"
                + " {\"id\": \"headache\", \"name\": \"Headache\", \"treatment\": \"painkillers\","
                + " \"examinations\": [\"interview\"]}]");
        Files.writeString(directory.resolve("examinations.json"),
            "[{\"id\": \"neuro_exam\", \"name\": \"Neurological Exam\", \"facility\": \"SpecialistUnit\","
                + " \"equipment\": [\"reflex_hammer\"]}]");
        Files.writeString(directory.resolve("treatments.json"),
            "[{\"id\": \"painkillers\", \"name\": \"Painkillers\", \"kind\": \"NonSurgical\"}]");
        return directory;
    }

    @Nested
    @DisplayName("Reading")
    class ReadingTests {

        @Test
        @DisplayName("should read a package directory")
        void shouldReadDirectory() throws IOException {
            List<ContentPackage> packages = loader.load(List.of(neurologyDirectory()), settings, report);

            assertEquals(1, packages.size());
            ContentPackage neuro = packages.get(0);
            assertEquals("neuro", neuro.tag());
            assertEquals("2.1", neuro.version());
            assertEquals(10, neuro.priority());
            Disease migraine = neuro.diseases().get(0);
            assertEquals("aura", migraine.getMainSymptomId());
            assertEquals(2.5, migraine.getFrequencyWeight());
            assertTrue(neuro.symptoms().get(0).isMain());
            assertFalse(neuro.symptoms().get(1).isMain());
            assertEquals("SpecialistUnit", neuro.examinations().get(0).getFacility());
            assertEquals(TreatmentKind.NON_SURGICAL, neuro.treatments().get(0).getTreatmentKind());
            assertEquals(1, report.getPackages().size());
            assertEquals(5, report.getPackages().get(0).entities());
        }

        @Test
        @DisplayName("should read a single-file package")
        void shouldReadSingleFile() throws IOException {
            Path file = tempDir.resolve("derm.json");
            Files.writeString(file, "{\"tag\": \"derm\", \"priority\": 3,"
                + " \"treatments\": [{\"id\": \"excision\", \"name\": \"Excision\", \"kind\": \"Surgical\","
                + " \"complications\": [\"scarring\"]}]}");

            ContentPackage derm = loader.load(List.of(file), settings, report).get(0);

            assertEquals("derm", derm.tag());
            assertTrue(derm.treatments().get(0).isSurgical());
            assertTrue(derm.treatments().get(0).getComplicationSymptomIds().contains("scarring"));
        }

        @Test
        @DisplayName("should sort packages by tag whatever the source order")
        void shouldSortByTag() throws IOException {
            Path neuro = neurologyDirectory();
            Path alpha = packageDirectory("alpha", "{\"tag\": \"alpha\", \"priority\": 1}");
            Path zulu = packageDirectory("zulu", "{\"tag\": \"zulu\", \"priority\": 1}");

            List<String> tags = loader.load(List.of(zulu, neuro, alpha), settings, report).stream()
                .map(ContentPackage::tag)
                .collect(Collectors.toList());

            assertEquals(List.of("alpha", "neuro", "zulu"), tags);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should reject two packages with the same tag")
        void shouldRejectDuplicateTags() throws IOException {
            Path first = packageDirectory("first", "{\"tag\": \"neuro\", \"priority\": 1}");
            Path second = packageDirectory("second", "{\"tag\": \"neuro\", \"priority\": 2}");

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> loader.load(List.of(first, second), settings, report));

            assertTrue(e.getMessage().contains("neuro"));
        }

        @Test
        @DisplayName("should name the malformed file")
        void shouldNameMalformedFile() throws IOException {
            Path directory = packageDirectory("broken", "{\"tag\": \"broken\", \"priority\": 1}");
            Files.writeString(directory.resolve("symptoms.json"), "[{\"id\": \"aura\", ");

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> loader.load(List.of(directory), settings, report));

            assertTrue(e.getMessage().contains("symptoms.json"));
        }

        @Test
        @DisplayName("should reject a disease without main symptom")
        void shouldRejectMissingMainSymptom() throws IOException {
            Path directory = packageDirectory("bad", "{\"tag\": \"bad\", \"priority\": 1}");
            Files.writeString(directory.resolve("diseases.json"), "[{\"id\": \"flu\", \"name\": \"Flu\"}]");

            assertThrows(PackageLoadException.class, () -> loader.load(List.of(directory), settings, report));
        }

        @Test
        @DisplayName("should name the file holding a null entity")
        void shouldRejectNullEntryInSingleFile() throws IOException {
            Path file = tempDir.resolve("holes.json");
            Files.writeString(file, "{\"tag\": \"holes\", \"priority\": 1, \"diseases\": [null]}");

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> loader.load(List.of(file), settings, report));

            assertEquals(file, e.getSource());
            assertTrue(e.getMessage().contains("holes.json"));
            assertTrue(e.getMessage().contains("diseases[0]"));
        }

        @Test
        @DisplayName("should name the collection file holding a null entity")
        void shouldRejectNullEntryInCollectionFile() throws IOException {
            Path directory = packageDirectory("holes", "{\"tag\": \"holes\", \"priority\": 1}");
            Files.writeString(directory.resolve("treatments.json"),
                "[{\"id\": \"rest\", \"name\": \"Rest\", \"kind\": \"NonSurgical\"}, null]");

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> loader.load(List.of(directory), settings, report));

            assertTrue(e.getMessage().contains("treatments.json"));
            assertTrue(e.getMessage().contains("treatments[1]"));
        }

        @Test
        @DisplayName("should keep the cause of an unexpected reader failure")
        void shouldKeepCauseOfReaderFailure() {
            IllegalStateException failure = new IllegalStateException("disk vanished");
            SourceLoader failing = new SourceLoader(new JsonPackageReader() {
                @Override
                public ContentPackage read(Path source) {
                    throw failure;
                }
            });

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> failing.load(List.of(tempDir), settings, report));

            assertSame(failure, e.getCause());
            assertTrue(e.getMessage().contains("disk vanished"));
        }

        @Test
        @DisplayName("should reject a directory without manifest")
        void shouldRejectMissingManifest() throws IOException {
            Path directory = Files.createDirectories(tempDir.resolve("empty"));

            PackageLoadException e = assertThrows(PackageLoadException.class,
                () -> loader.load(List.of(directory), settings, report));

            assertTrue(e.getMessage().contains("package.json"));
        }

        @Test
        @DisplayName("should reject an empty source list")
        void shouldRejectNoSources() {
            assertThrows(PackageLoadException.class, () -> loader.load(List.of(), settings, report));
        }
    }

    @Test
    @DisplayName("should keep the last definition of an id repeated inside one package")
    void shouldKeepLastDefinition() {
        ContentPackage repeated = pkg("neuro", 1)
            .treatment(treatment("painkillers"))
            .treatment(treatment("rest"))
            .treatment(treatment("painkillers").withComplicationSymptomIds(List.of("nausea")))
            .build();

        ContentPackage prepared = loader.prepare(List.of(repeated), report).get(0);

        assertEquals(2, prepared.treatments().size());
        assertEquals("rest", prepared.treatments().get(0).getId());
        assertTrue(prepared.treatments().get(1).getComplicationSymptomIds().contains("nausea"));
        assertEquals(1, report.getDuplicateDefinitions().size());
        assertEquals(EntityKind.TREATMENT, report.getDuplicateDefinitions().get(0).kind());
        assertEquals(ViolationType.DUPLICATE_DEFINITION, report.getWarnings().get(0).type());
        assertFalse(report.hasHardViolations());
    }
}
