package pl.marcinmilkowski.ident_gen.morph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StemLexiconTest {

    @Test
    void testWordsGroupedByStem() {
        StemLexicon lexicon = new StemLexicon(List.of("employ", "employment", "employer", "emperor"));
        Set<String> related = lexicon.relatedForms("employs");
        assertTrue(related.contains("employ"));
        assertTrue(related.contains("employment"));
        assertTrue(related.contains("employer"));
        assertFalse(related.contains("emperor"));
    }

    @Test
    void testPopulationFamily() {
        StemLexicon lexicon = new StemLexicon(List.of("population", "populate", "popular"));
        Set<String> related = lexicon.relatedForms("population");
        assertTrue(related.contains("populate"));
        assertFalse(related.contains("popular"));
    }

    @Test
    void testUnknownWord() {
        StemLexicon lexicon = new StemLexicon(List.of("employ"));
        assertTrue(lexicon.relatedForms("harbour").isEmpty());
        assertFalse(lexicon.contains("harbour"));
        assertTrue(lexicon.contains("Employ"));
    }

    @Test
    void testSizeCountsDistinctWords() {
        StemLexicon lexicon = new StemLexicon(List.of("employ", "Employ", " employ "));
        assertEquals(1, lexicon.size());
    }

    @Test
    void testLoadFileSkipsComments(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("words.txt");
        Files.writeString(file, "# header\nmanage\n\nmanagement\n");
        StemLexicon lexicon = StemLexicon.load(file);
        assertEquals(2, lexicon.size());
        assertTrue(lexicon.relatedForms("manage").contains("management"));
    }

    @Test
    void testLoadMissingFile(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> StemLexicon.load(tempDir.resolve("missing.txt")));
    }

    @Test
    void testBundledLexicon() throws IOException {
        StemLexicon lexicon = StemLexicon.loadDefault();
        assertTrue(lexicon.size() > 100);
        assertTrue(lexicon.relatedForms("employ").contains("employment"));
    }
}
