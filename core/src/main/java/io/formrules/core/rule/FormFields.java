package io.formrules.core.rule;

import io.formrules.core.error.PathSyntaxException;
import io.formrules.core.path.Path;
import io.formrules.core.path.WalkContext;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves references to other fields of a form, as used by cross-field rules such as
 * {@code after:start} or {@code same:password}. References are paths without array steps,
 * e.g. {@code period.start}.
 */
final class FormFields {

    private static final Map<String, Optional<Path>> PATHS = new ConcurrentHashMap<>();

    private FormFields() {}

    /**
     * Looks up a field of the form.
     *
     * @return a holder for the field value (which may itself be {@code null}), or empty if the
     *     form has no such field
     */
    static Optional<FieldValue> lookup(Map<String, Object> form, String reference) {
        Optional<Path> path = PATHS.computeIfAbsent(reference, FormFields::parseReference);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        FieldValue[] result = new FieldValue[1];
        path.get().walk(form, (WalkContext context) -> {
            if (!context.notFound()) {
                result[0] = new FieldValue(context.value());
            }
        });
        return Optional.ofNullable(result[0]);
    }

    /** Returns {@code true} if {@code reference} can designate a field. */
    static boolean isReference(String reference) {
        return PATHS.computeIfAbsent(reference, FormFields::parseReference).isPresent();
    }

    private static Optional<Path> parseReference(String reference) {
        try {
            Path path = Path.parse(reference);
            return path.hasArray() ? Optional.empty() : Optional.of(path);
        } catch (PathSyntaxException e) {
            return Optional.empty();
        }
    }

    /** Value of a field that exists in the form. */
    record FieldValue(Object value) {}
}
