package pl.marcinmilkowski.ident_gen.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationConfigLoader;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.morph.EnglishMorphologyProvider;
import pl.marcinmilkowski.ident_gen.morph.MorphologyProvider;
import pl.marcinmilkowski.ident_gen.morph.StemLexicon;
import pl.marcinmilkowski.ident_gen.naming.DuplicateNameResolver;
import pl.marcinmilkowski.ident_gen.naming.EnumEntry;
import pl.marcinmilkowski.ident_gen.naming.IdentifierCleaner;
import pl.marcinmilkowski.ident_gen.naming.InvalidNameException;
import pl.marcinmilkowski.ident_gen.substitution.LookupTableCache;
import pl.marcinmilkowski.ident_gen.substitution.SubstitutionEngine;
import pl.marcinmilkowski.ident_gen.tracking.WordTracker;
import pl.marcinmilkowski.ident_gen.utils.NameCase;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One generation run: the shared engine, resolver and tracker used for every label source.
 *
 * The lookup table cache lives as long as the run, so engines created for the
 * same configuration within a run share one table.
 */
public class GenerationRun {

    private static final Logger logger = LoggerFactory.getLogger(GenerationRun.class);

    private final GeneratorConfig config;
    private final MorphologyProvider provider;
    private final LookupTableCache cache;
    private final SubstitutionEngine engine;
    private final DuplicateNameResolver resolver;
    private final WordTracker tracker;
    private final EnumFileWriter writer;

    /**
     * @param tracker may be null to disable word tracking
     */
    public GenerationRun(GeneratorConfig config, AbbreviationMap abbreviations, MorphologyProvider provider,
                         WordTracker tracker) {
        this.config = config;
        this.provider = provider;
        this.cache = new LookupTableCache(config.cacheCapacity());
        this.engine = new SubstitutionEngine(abbreviations, provider, config, cache);
        this.resolver = new DuplicateNameResolver(engine, config.sentinelName());
        this.tracker = tracker;
        this.writer = new EnumFileWriter();
    }

    /**
     * Set up a run from configuration, loading the abbreviations and the lexicon it names
     * (or the bundled ones).
     */
    public static GenerationRun create(GeneratorConfig config, boolean tracking) throws IOException {
        AbbreviationMap abbreviations = config.abbreviationsPath() != null
            ? AbbreviationConfigLoader.load(config.abbreviationsPath())
            : AbbreviationMap.defaults();
        StemLexicon lexicon = config.lexiconPath() != null
            ? StemLexicon.load(config.lexiconPath())
            : StemLexicon.loadDefault();
        MorphologyProvider provider = new EnglishMorphologyProvider(lexicon);
        logger.info("Generation run: {} abbreviation rules, morphology {}", abbreviations.size(), provider.getName());
        return new GenerationRun(config, abbreviations, provider, tracking ? new WordTracker() : null);
    }

    /**
     * A generator for one batch, sharing this run's engine, resolver and tracker.
     */
    public EnumGenerator newGenerator(String fallbackPrefix) {
        return new EnumGenerator(engine, resolver, tracker, fallbackPrefix);
    }

    public List<EnumEntry> generate(LabelSource source) throws IOException {
        return newGenerator(EnumGenerator.DEFAULT_FALLBACK_PREFIX).generate(source.fetch(), source.getName());
    }

    /**
     * Generate entries for the source and write them as a module named after it.
     *
     * @return the written file, {@code <output dir>/<source_name>.py}
     * @throws IllegalArgumentException if the source name cannot form a class name; nothing is generated then
     */
    public Path generateFile(LabelSource source, Path outputDir, boolean overwrite) throws IOException {
        String className = className(source.getName());
        List<EnumEntry> entries = generate(source);
        Path output = outputDir.resolve(NameCase.camelToSnake(className) + ".py");
        writer.write(output, className, NameCase.camelToTitle(className), entries, overwrite);
        return output;
    }

    /**
     * Class name for a source: cleaned, then camel-cased; a leading digit keeps its '_' prefix.
     *
     * @throws IllegalArgumentException if the name has no usable characters
     */
    static String className(String sourceName) {
        String cleaned;
        try {
            cleaned = IdentifierCleaner.clean(sourceName, false);
        } catch (InvalidNameException e) {
            throw new IllegalArgumentException("Source name '" + sourceName + "' does not form a class name", e);
        }
        String camel = NameCase.snakeToCamel(cleaned);
        return Character.isDigit(camel.charAt(0)) ? "_" + camel : camel;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public MorphologyProvider getProvider() {
        return provider;
    }

    public LookupTableCache getCache() {
        return cache;
    }

    public SubstitutionEngine getEngine() {
        return engine;
    }

    public DuplicateNameResolver getResolver() {
        return resolver;
    }

    /**
     * @return the tracker, or null when tracking is disabled
     */
    public WordTracker getTracker() {
        return tracker;
    }
}
