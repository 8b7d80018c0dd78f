package pl.marcinmilkowski.ident_gen.generation;

import java.io.IOException;
import java.util.List;

/**
 * Supplier of label records for one identifier set.
 */
public interface LabelSource {

    List<LabelRecord> fetch() throws IOException;

    /**
     * Name of the source, used as the tracking source tag and in log messages.
     */
    String getName();
}
