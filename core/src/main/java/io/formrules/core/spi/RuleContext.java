package io.formrules.core.spi;

import io.formrules.core.path.WalkContext;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link Rule} can see while validating one value: the field name, the exact path of
 * the value, the value itself, the declaration parameters and the whole form.
 *
 * <p>A context is confined to the validation call that created it.
 */
public final class RuleContext {

    private final String field;
    private final String path;
    private final List<String> parameters;
    private final Map<String, Object> form;
    private final Object parent;
    private final int index;
    private Object value;

    private RuleContext(
            String field,
            String path,
            Object value,
            List<String> parameters,
            Map<String, Object> form,
            Object parent,
            int index) {
        this.field = field;
        this.path = path;
        this.value = value;
        this.parameters = List.copyOf(parameters);
        this.form = Objects.requireNonNull(form, "form must not be null");
        this.parent = parent;
        this.index = index;
    }

    /**
     * Creates a context for a top-level field of the form.
     *
     * @param field      key of the field in {@code form}
     * @param value      current value of the field
     * @param parameters declaration parameters
     * @param form       the whole form, also the container written by {@link #replaceValue}
     */
    public static RuleContext of(String field, Object value, List<String> parameters, Map<String, Object> form) {
        return new RuleContext(field, field, value, parameters, form, form, -1);
    }

    /**
     * Creates a context for a value reached by a path walk.
     *
     * @param walk       the walk context of the value
     * @param value      current value, which may differ from {@code walk.value()} once an earlier
     *                   rule replaced it
     * @param parameters declaration parameters
     * @param form       the root of the walked form
     */
    public static RuleContext of(WalkContext walk, Object value, List<String> parameters, Map<String, Object> form) {
        return new RuleContext(
                walk.name(), walk.path().toString(), value, parameters, form, walk.parent(), walk.index());
    }

    /** Name of the field, empty for list elements. */
    public String field() {
        return field;
    }

    /** Exact path of the value, e.g. {@code attendees[1].email}. */
    public String path() {
        return path;
    }

    public Object value() {
        return value;
    }

    public List<String> parameters() {
        return parameters;
    }

    /** The whole submitted form. Rules may read other fields from it. */
    public Map<String, Object> form() {
        return form;
    }

    /**
     * Replaces the value in its parent container (map key or list slot) and in this context.
     *
     * @throws IllegalStateException if the value has no addressable container
     */
    @SuppressWarnings("unchecked")
    public void replaceValue(Object newValue) {
        if (parent instanceof Map<?, ?> map && !field.isEmpty()) {
            ((Map<String, Object>) map).put(field, newValue);
        } else if (parent instanceof List<?> list && index >= 0) {
            ((List<Object>) list).set(index, newValue);
        } else {
            throw new IllegalStateException("Value at '" + path + "' has no container to write to");
        }
        this.value = newValue;
    }
}
