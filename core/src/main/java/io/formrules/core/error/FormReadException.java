package io.formrules.core.error;

/**
 * Thrown when a request body cannot be decoded into a form. This is not a rule-set error: the
 * caller is expected to answer with a bad-request response before validation starts.
 */
public final class FormReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FormReadException(String message, Throwable cause) {
        super(message, cause);
    }

    public FormReadException(String message) {
        super(message);
    }
}
