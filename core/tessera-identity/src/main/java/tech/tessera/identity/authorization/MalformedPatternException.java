package tech.tessera.identity.authorization;

/**
 * Thrown when a permission pattern string cannot be parsed.
 */
public class MalformedPatternException extends Exception {

    private final String pattern;

    public MalformedPatternException(String pattern, String reason) {
        super("Malformed permission pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
