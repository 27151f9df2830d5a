package io.medpack.integrator.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    @Test
    @DisplayName("should fold case and collapse whitespace")
    void shouldFoldCaseAndWhitespace() {
        assertEquals("blood test", NameNormalizer.normalize("  Blood\t  TEST ", null));
    }

    @Test
    @DisplayName("should strip bracketed and parenthesized qualifiers")
    void shouldStripQualifiers() {
        assertEquals("blood test", NameNormalizer.normalize("[Neuro] Blood Test", "neuro"));
        assertEquals("blood test", NameNormalizer.normalize("Blood Test (PSY)", "psych"));
    }

    @Test
    @DisplayName("should strip a leading package tag prefix")
    void shouldStripPackagePrefix() {
        assertEquals("blood test", NameNormalizer.normalize("neuro:Blood Test", "neuro"));
        assertEquals("blood test", NameNormalizer.normalize("NEURO/Blood Test", "neuro"));
    }

    @Test
    @DisplayName("should keep prefixes of other packages")
    void shouldKeepForeignPrefix() {
        assertEquals("psych:blood test", NameNormalizer.normalize("psych:Blood Test", "neuro"));
    }
}
