package pl.marcinmilkowski.ident_gen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.config.AbbreviationConfigLoader;
import pl.marcinmilkowski.ident_gen.config.AbbreviationMap;
import pl.marcinmilkowski.ident_gen.config.AbbreviationReviewer;
import pl.marcinmilkowski.ident_gen.config.GeneratorConfig;
import pl.marcinmilkowski.ident_gen.generation.GenerationRun;
import pl.marcinmilkowski.ident_gen.generation.JsonLabelSource;
import pl.marcinmilkowski.ident_gen.morph.EnglishMorphologyProvider;
import pl.marcinmilkowski.ident_gen.morph.StemLexicon;
import pl.marcinmilkowski.ident_gen.substitution.VariantGenerator;
import pl.marcinmilkowski.ident_gen.tracking.OpportunityReport;
import pl.marcinmilkowski.ident_gen.tracking.TrackingDataStore;
import pl.marcinmilkowski.ident_gen.tracking.WordTracker;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 *
 * Commands:
 *   generate --input labels.json [--input more.json] --output enums/ [--config generator.json]
 *   report --tracking tracking.json [--format markdown|plain] [--output report.md]
 *   review [--abbreviations abbreviations.json]
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CRITICAL = 3;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return EXIT_OK;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "generate":
                    return handleGenerateCommand(args);
                case "report":
                    return handleReportCommand(args);
                case "review":
                    return handleReviewCommand(args);
                case "help":
                    showUsage();
                    return EXIT_OK;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
                    return EXIT_ERROR;
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            return EXIT_ERROR;
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar ident-gen.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  generate --input <labels.json> [--input ...] --output <dir>");
        System.out.println("      Generate one identifier module per label file");
        System.out.println("      Options:");
        System.out.println("        --config <file>          Generator settings (JSON)");
        System.out.println("        --abbreviations <file>   Abbreviation rules (default: bundled)");
        System.out.println("        --no-inflections         Do not expand terms with inflected forms");
        System.out.println("        --no-derivations         Do not expand terms with derived forms");
        System.out.println("        --track <file>           Accumulate unabbreviated word statistics");
        System.out.println("        --overwrite              Replace existing modules");
        System.out.println();
        System.out.println("  report --tracking <file> [--format markdown|plain] [--output <file>]");
        System.out.println("      Rank words that would benefit from a new abbreviation");
        System.out.println("      Options:");
        System.out.println("        --abbreviations <file>   Rules checked for conflicts");
        System.out.println("        --min-frequency <n>      Minimum occurrences (default: 2)");
        System.out.println("        --contexts               Show usage contexts");
        System.out.println();
        System.out.println("  review [--abbreviations <file>]");
        System.out.println("      Check abbreviation rules");
        System.out.println("      Exit status: 0 ok, 1 errors, 2 consolidation available, 3 rules unreadable");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar ident-gen.jar generate \\");
        System.out.println("    --input data/frequency.json --output enums/ --track data/tracking.json");
        System.out.println();
        System.out.println("  java -jar ident-gen.jar report --tracking data/tracking.json --contexts");
    }

    private static int handleGenerateCommand(String[] args) throws IOException {
        List<Path> inputs = new ArrayList<>();
        String outputDir = null;
        String configPath = null;
        String abbreviationsPath = null;
        String trackingPath = null;
        boolean inflections = true;
        boolean derivations = true;
        boolean overwrite = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    inputs.add(Paths.get(args[++i]));
                    break;
                case "--output":
                case "-o":
                    outputDir = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--abbreviations":
                case "-a":
                    abbreviationsPath = args[++i];
                    break;
                case "--track":
                    trackingPath = args[++i];
                    break;
                case "--no-inflections":
                    inflections = false;
                    break;
                case "--no-derivations":
                    derivations = false;
                    break;
                case "--overwrite":
                    overwrite = true;
                    break;
            }
        }

        if (inputs.isEmpty() || outputDir == null) {
            System.err.println("Error: --input and --output are required");
            return EXIT_ERROR;
        }

        GeneratorConfig config = configPath != null ? GeneratorConfig.load(Paths.get(configPath)) : GeneratorConfig.defaults();
        if (abbreviationsPath != null) {
            config = config.withAbbreviationsPath(Paths.get(abbreviationsPath));
        }
        config = config.withMorphology(inflections && config.includeInflections(),
            derivations && config.includeDerivations());

        GenerationRun run = GenerationRun.create(config, trackingPath != null);
        if (trackingPath != null) {
            TrackingDataStore.load(run.getTracker(), Paths.get(trackingPath));
        }

        for (Path input : inputs) {
            Path written = run.generateFile(new JsonLabelSource(input), Paths.get(outputDir), overwrite);
            System.out.println("Wrote " + written);
        }

        if (trackingPath != null) {
            TrackingDataStore.save(run.getTracker(), Paths.get(trackingPath));
            System.out.println("Tracking data: " + run.getTracker().size() + " words -> " + trackingPath);
        }
        return EXIT_OK;
    }

    private static int handleReportCommand(String[] args) throws IOException {
        String trackingPath = null;
        String abbreviationsPath = null;
        String outputPath = null;
        OpportunityReport.Format format = OpportunityReport.Format.MARKDOWN;
        int minFrequency = 2;
        boolean contexts = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--tracking":
                case "-t":
                    trackingPath = args[++i];
                    break;
                case "--abbreviations":
                case "-a":
                    abbreviationsPath = args[++i];
                    break;
                case "--output":
                case "-o":
                    outputPath = args[++i];
                    break;
                case "--format":
                    format = OpportunityReport.Format.valueOf(args[++i].toUpperCase());
                    break;
                case "--min-frequency":
                    minFrequency = Integer.parseInt(args[++i]);
                    break;
                case "--contexts":
                    contexts = true;
                    break;
            }
        }

        if (trackingPath == null) {
            System.err.println("Error: --tracking is required");
            return EXIT_ERROR;
        }

        WordTracker tracker = new WordTracker();
        if (TrackingDataStore.load(tracker, Paths.get(trackingPath)) == 0) {
            System.out.println("No tracking data in " + trackingPath);
            return EXIT_OK;
        }
        AbbreviationMap existing = abbreviationsPath != null
            ? AbbreviationConfigLoader.load(Paths.get(abbreviationsPath))
            : AbbreviationMap.defaults();

        OpportunityReport report = new OpportunityReport(tracker, existing,
            Clock.systemUTC(), minFrequency, 6);
        if (outputPath != null) {
            report.write(Paths.get(outputPath), format, contexts);
            System.out.println("Report written to " + outputPath);
        } else {
            System.out.println(report.render(format, contexts));
        }
        return EXIT_OK;
    }

    private static int handleReviewCommand(String[] args) throws IOException {
        String abbreviationsPath = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--abbreviations") || args[i].equals("-a")) {
                abbreviationsPath = args[++i];
            }
        }

        AbbreviationMap map;
        try {
            map = abbreviationsPath != null
                ? AbbreviationConfigLoader.load(Paths.get(abbreviationsPath))
                : AbbreviationMap.defaults();
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Cannot read abbreviation rules", e);
            System.err.println("CRITICAL: " + e.getMessage());
            return EXIT_CRITICAL;
        }

        VariantGenerator variants = new VariantGenerator(
            new EnglishMorphologyProvider(StemLexicon.loadDefault()), GeneratorConfig.defaults().maxVariantsPerWord());
        AbbreviationReviewer.ReviewResult result = new AbbreviationReviewer(variants).review(map);

        System.out.println("=== Abbreviation Review ===");
        System.out.println("Rules: " + map.size());
        for (String error : result.errors()) {
            System.out.println("ERROR: " + error);
        }
        for (AbbreviationReviewer.Consolidation c : result.consolidations()) {
            System.out.println("CONSOLIDATE: '" + c.abbreviation() + "' needs only '" + c.baseTerm()
                + "', which covers " + c.redundantTerms());
        }
        System.out.println("Status: " + result.status());
        return result.status().getExitCode();
    }
}
