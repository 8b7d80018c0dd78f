package pl.marcinmilkowski.ident_gen.naming;

/**
 * Base class of identifier naming failures.
 */
public class NamingException extends RuntimeException {

    public NamingException(String message) {
        super(message);
    }

    public NamingException(String message, Throwable cause) {
        super(message, cause);
    }
}
