package eu.virtualparadox.notedraft.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * Line structure must survive cleaning; everything invisible goes.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        assertThat(cleaner.cleanText("Patient denies suicidal ideation.")).isEqualTo("Patient denies suicidal ideation.");
    }

    @Test
    void testNullAndEmptyBecomeEmpty() {
        assertThat(cleaner.cleanText(null)).isEmpty();
        assertThat(cleaner.cleanText("")).isEmpty();
    }

    @Test
    void testLineBreaksAreKeptAndUnified() {
        assertThat(cleaner.cleanText("Date of Service: 03/04/2023\r\nDischarge Summary\rPlan"))
                .isEqualTo("Date of Service: 03/04/2023\nDischarge Summary\nPlan");
    }

    @Test
    void testBlankLineRunsCollapse() {
        assertThat(cleaner.cleanText("line1\n\n\n\n\nline2")).isEqualTo("line1\n\nline2");
    }

    @Test
    void testControlCharactersAreRemoved() {
        assertThat(cleaner.cleanText("valid\u0007text")).isEqualTo("validtext");
    }

    @Test
    void testTabsSurvive() {
        assertThat(cleaner.cleanText("Med:\tsertraline")).isEqualTo("Med:\tsertraline");
    }

    @Test
    void testNonBreakingSpaceIsNormalized() {
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testZeroWidthVariantsAreRemoved() {
        assertThat(cleaner.cleanText("word1\u200Bword2")).isEqualTo("word1word2");
        assertThat(cleaner.cleanText("word1\u200Cword2")).isEqualTo("word1word2");
        assertThat(cleaner.cleanText("word1\u200Dword2")).isEqualTo("word1word2");
        assertThat(cleaner.cleanText("\uFEFFword1")).isEqualTo("word1");
    }

    @Test
    void testSoftHyphenIsRemoved() {
        assertThat(cleaner.cleanText("psycho\u00ADtherapy")).isEqualTo("psychotherapy");
    }

    @Test
    void testTrailingBlanksPerLineAreStripped() {
        assertThat(cleaner.cleanText("first   \nsecond\t\nthird")).isEqualTo("first\nsecond\nthird");
    }
}
