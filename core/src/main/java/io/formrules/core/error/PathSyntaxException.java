package io.formrules.core.error;

/** Thrown when a field path such as {@code items[].name} has invalid syntax. */
public final class PathSyntaxException extends RuleSetException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public PathSyntaxException(String message, String path) {
        this(message, path, null, null);
    }

    public PathSyntaxException(String message, String path, String ruleSetId, String source) {
        super(message, ruleSetId, source);
        this.path = path;
    }

    /** The offending path string exactly as it was given. */
    public String path() {
        return path;
    }
}
