package pl.marcinmilkowski.ident_gen.naming;

/**
 * Exception thrown when a name is not a valid identifier, or cleaning leaves nothing.
 *
 * Recoverable: callers substitute a sentinel name.
 */
public class InvalidNameException extends NamingException {

    public InvalidNameException(String message) {
        super(message);
    }

    public InvalidNameException(String message, Throwable cause) {
        super(message, cause);
    }
}
