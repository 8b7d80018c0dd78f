package pl.marcinmilkowski.ident_gen.morph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tartarus.snowball.ext.EnglishStemmer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Word list grouped by Snowball English stem.
 *
 * Words sharing a stem are treated as derivationally related
 * (manage, manager, management -> "manag").
 *
 * Lexicon file format: one word per line, '#' starts a comment line.
 */
public class StemLexicon {

    private static final Logger logger = LoggerFactory.getLogger(StemLexicon.class);

    public static final String DEFAULT_RESOURCE = "lexicon/english.txt";

    private final Map<String, SortedSet<String>> wordsByStem = new HashMap<>();
    private final EnglishStemmer stemmer = new EnglishStemmer();
    private int size;

    public StemLexicon(Collection<String> words) {
        for (String word : words) {
            add(word);
        }
    }

    /**
     * Load the lexicon bundled on the classpath.
     */
    public static StemLexicon loadDefault() throws IOException {
        try (InputStream in = StemLexicon.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Lexicon resource not found: " + DEFAULT_RESOURCE);
            }
            StemLexicon lexicon = new StemLexicon(readWords(new BufferedReader(
                new InputStreamReader(in, StandardCharsets.UTF_8))));
            logger.info("Loaded {} lexicon words from classpath:{}", lexicon.size(), DEFAULT_RESOURCE);
            return lexicon;
        }
    }

    /**
     * Load a lexicon file.
     */
    public static StemLexicon load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Lexicon file not found: " + file);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            StemLexicon lexicon = new StemLexicon(readWords(reader));
            logger.info("Loaded {} lexicon words from {}", lexicon.size(), file);
            return lexicon;
        }
    }

    private static List<String> readWords(BufferedReader reader) throws IOException {
        List<String> words = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            words.add(line);
        }
        return words;
    }

    private void add(String word) {
        String lower = word.trim().toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) {
            return;
        }
        if (wordsByStem.computeIfAbsent(stem(lower), k -> new TreeSet<>()).add(lower)) {
            size++;
        }
    }

    /**
     * Snowball English stem of a lowercase word.
     */
    public synchronized String stem(String word) {
        stemmer.setCurrent(word.toLowerCase(Locale.ROOT));
        stemmer.stem();
        return stemmer.getCurrent();
    }

    /**
     * Lexicon words sharing the stem of the given word, in alphabetical order.
     * The word itself is included only if it is in the lexicon.
     */
    public SortedSet<String> relatedForms(String word) {
        SortedSet<String> forms = wordsByStem.get(stem(word));
        return forms != null ? Collections.unmodifiableSortedSet(forms) : Collections.emptySortedSet();
    }

    public boolean contains(String word) {
        return relatedForms(word).contains(word.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return size;
    }
}
