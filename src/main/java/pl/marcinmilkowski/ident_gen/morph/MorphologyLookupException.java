package pl.marcinmilkowski.ident_gen.morph;

/**
 * Exception thrown when a morphology provider cannot analyse a word.
 */
public class MorphologyLookupException extends Exception {

    public MorphologyLookupException(String message) {
        super(message);
    }

    public MorphologyLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
