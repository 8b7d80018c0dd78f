package pl.marcinmilkowski.ident_gen.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ident_gen.naming.EntryBatch;
import pl.marcinmilkowski.ident_gen.naming.EnumEntry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Writes an identifier set as a Python {@code Enum} module.
 *
 * Output layout:
 * <pre>
 * # !! This file is automatically generated by: ident-gen
 *
 * from enum import Enum
 *
 *
 * class Frequency(Enum):
 *     """
 *     Automatically generated Enum for Frequency
 *     """
 *     ANNUAL = 1  # Annual // Annuel
 * </pre>
 * The date line is only written when enabled, so regenerated files are
 * byte-identical unless their entries change.
 */
public class EnumFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(EnumFileWriter.class);

    public static final String GENERATOR_NAME = "ident-gen";
    private static final String INDENT = "    ";
    private static final Pattern CLASS_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final boolean includeTimestamp;
    private final Clock clock;

    public EnumFileWriter() {
        this(false, Clock.systemUTC());
    }

    public EnumFileWriter(boolean includeTimestamp, Clock clock) {
        this.includeTimestamp = includeTimestamp;
        this.clock = clock;
    }

    /**
     * Render the module source. Entries are validated first (unique names and values, uppercase names).
     *
     * @param description extra docstring text; may be null
     */
    public String render(String className, String description, List<EnumEntry> entries) {
        if (className == null || !CLASS_NAME.matcher(className).matches()) {
            throw new IllegalArgumentException("Invalid class name: " + className);
        }
        EntryBatch.validate(entries, true);

        StringBuilder sb = new StringBuilder();
        sb.append("# !! This file is automatically generated by: ").append(GENERATOR_NAME).append('\n');
        if (includeTimestamp) {
            sb.append("#     date: ").append(clock.instant()).append('\n');
        }
        sb.append('\n');
        sb.append("from enum import Enum\n");
        sb.append("\n\n");
        sb.append("class ").append(className).append("(Enum):\n");
        sb.append(INDENT).append("\"\"\"\n");
        sb.append(INDENT).append("Automatically generated Enum for ").append(className).append('\n');
        if (description != null && !description.isBlank()) {
            sb.append(INDENT).append('\n');
            for (String line : description.strip().split("\\R")) {
                String stripped = line.strip();
                sb.append(stripped.isEmpty() ? "" : INDENT + stripped).append('\n');
            }
        }
        sb.append(INDENT).append("\"\"\"\n");
        for (EnumEntry entry : entries) {
            sb.append(INDENT).append(entry).append('\n');
        }
        return sb.toString();
    }

    /**
     * Write the module to a file.
     *
     * @throws FileAlreadyExistsException if the file exists and {@code overwrite} is false
     */
    public void write(Path output, String className, String description, List<EnumEntry> entries,
                      boolean overwrite) throws IOException {
        if (!overwrite && Files.exists(output)) {
            throw new FileAlreadyExistsException(output.toString(), null,
                "Module already exists; pass overwrite to regenerate");
        }
        String source = render(className, description, entries);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, source, StandardCharsets.UTF_8);
        logger.info("Enum file written to {} ({} entries)", output, entries.size());
    }
}
