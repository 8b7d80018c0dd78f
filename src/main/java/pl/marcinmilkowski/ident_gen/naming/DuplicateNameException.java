package pl.marcinmilkowski.ident_gen.naming;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when names still collide after duplicate resolution. Fatal for the batch.
 *
 * Carries every colliding name with the values of its members.
 */
public class DuplicateNameException extends NamingException {

    private final Map<String, List<Long>> collisions;

    public DuplicateNameException(String message, Map<String, List<Long>> collisions) {
        super(message + ": " + collisions);
        this.collisions = new LinkedHashMap<>(collisions);
    }

    public Map<String, List<Long>> getCollisions() {
        return collisions;
    }
}
