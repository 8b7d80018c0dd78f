package pl.marcinmilkowski.ident_gen.generation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.AbbreviationRule;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;
import pl.marcinmilkowski.ident_gen.naming.EnumEntry;
import pl.marcinmilkowski.ident_gen.tracking.WordTracker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationRunTest {

    @Test
    void testGenerateFile(@TempDir Path tempDir) throws IOException {
        Path labels = tempDir.resolve("frequency_codes.json");
        Files.writeString(labels, "[{\"value\": 1, \"label_en\": \"Annual population\", \"label_fr\": \"Population annuelle\"},"
            + " {\"value\": 2, \"label_en\": \"Quarterly population\"}]");
        GenerationRun run = new GenerationRun(GeneratorConfig.defaults(),
            new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population"))),
            MorphologyProvider.NONE, new WordTracker());

        Path written = run.generateFile(new JsonLabelSource(labels), tempDir.resolve("enums"), false);

        assertEquals(tempDir.resolve("enums/frequency_codes.py"), written);
        String source = Files.readString(written);
        assertTrue(source.contains("class FrequencyCodes(Enum):\n"));
        assertTrue(source.contains("    Frequency Codes\n"));
        assertTrue(source.contains("    ANNUAL_POP = 1  # Annual population // Population annuelle\n"));
        assertTrue(source.contains("    QUARTERLY_POP = 2  # Quarterly population\n"));
        assertTrue(run.getTracker().getStats("quarterly").isPresent());
    }

    @Test
    void testFileNamesThatAreNotIdentifiers(@TempDir Path tempDir) throws IOException {
        Path census = tempDir.resolve("2021_census.json");
        Files.writeString(census, "[{\"value\": 1, \"label_en\": \"Total population\"}]");
        Path versioned = tempDir.resolve("labels.v2.json");
        Files.writeString(versioned, "[{\"value\": 1, \"label_en\": \"Total population\"}]");
        GenerationRun run = new GenerationRun(GeneratorConfig.defaults(),
            new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population"))),
            MorphologyProvider.NONE, null);

        Path written = run.generateFile(new JsonLabelSource(census), tempDir.resolve("enums"), false);
        assertEquals(tempDir.resolve("enums/_2021_census.py"), written);
        assertTrue(Files.readString(written).contains("class _2021Census(Enum):\n"));

        written = run.generateFile(new JsonLabelSource(versioned), tempDir.resolve("enums"), false);
        assertEquals(tempDir.resolve("enums/labels_v2.py"), written);
        assertTrue(Files.readString(written).contains("class LabelsV2(Enum):\n"));
    }

    @Test
    void testUnusableSourceNameFailsBeforeGenerating(@TempDir Path tempDir) throws IOException {
        Path labels = tempDir.resolve("labels.json");
        Files.writeString(labels, "[{\"value\": 1, \"label_en\": \"Quarterly population\"}]");
        GenerationRun run = new GenerationRun(GeneratorConfig.defaults(),
            new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population"))),
            MorphologyProvider.NONE, new WordTracker());

        assertThrows(IllegalArgumentException.class,
            () -> run.generateFile(new JsonLabelSource(labels, "---"), tempDir.resolve("enums"), false));
        assertEquals(0, run.getTracker().size());
        assertFalse(Files.exists(tempDir.resolve("enums")));
    }

    @Test
    void testClassName() {
        assertEquals("FrequencyCodes", GenerationRun.className("frequency_codes"));
        assertEquals("_2021Census", GenerationRun.className("2021_census"));
        assertEquals("LabelsV2", GenerationRun.className("labels.v2"));
        assertEquals("MontrealCodes", GenerationRun.className("montréal codes"));
    }

    @Test
    void testEnginesShareRunCache() {
        AbbreviationMap map = new AbbreviationMap(List.of(AbbreviationRule.of("pop", "population")));
        GenerationRun run = new GenerationRun(GeneratorConfig.defaults(), map, MorphologyProvider.NONE, null);
        assertEquals(1, run.getCache().size());
        assertNull(run.getTracker());
        assertEquals(List.of(new EnumEntry("POP", 1, "Population")),
            run.newGenerator("CODE").generate(List.of(new LabelRecord(1, "Population")), "s"));
    }

    @Test
    void testBundledResources() throws IOException {
        GenerationRun run = GenerationRun.create(GeneratorConfig.defaults(), true);
        List<EnumEntry> entries = run.newGenerator("CODE").generate(List.of(
            new LabelRecord(1, "Population density"),
            new LabelRecord(2, "Employment by industry"),
            new LabelRecord(3, "Industries - seasonally adjusted")), "s");

        assertEquals("POP_DENS", entries.get(0).name());
        assertEquals("EMP_BY_IND", entries.get(1).name());
        assertEquals("IND", entries.get(2).name());
        assertNotNull(run.getTracker());
    }
}
