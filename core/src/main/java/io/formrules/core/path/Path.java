package io.formrules.core.path;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A step in the exploration of an untyped data structure made of {@code Map<String, Object>}
 * and {@code List<Object>} nodes. Steps form a singly linked chain: each step owns its successor.
 * Steps that are not {@link PathType#ELEMENT} always have a successor; an ELEMENT step never has
 * one.
 *
 * <p>Example paths accepted by {@link #parse(String)}:
 *
 * <pre>
 * name
 * object.field
 * object.subobject.field
 * object.array[]
 * object.arrayOfObjects[].field
 * matrix[][]
 * </pre>
 *
 * <p>A parsed path is never modified after {@link #parse(String)} returns, so it can be shared by
 * concurrent walks. Each walk builds its own exact path for the contexts it reports.
 */
public final class Path {

    private String name;
    private PathType type;
    private Integer index;
    private Path next;

    private Path(String name, PathType type, Integer index, Path next) {
        this.name = name;
        this.type = type;
        this.index = index;
        this.next = next;
    }

    /**
     * Parses the given path string.
     *
     * @param path the path, e.g. {@code attendees[].email}
     * @return the first step of the parsed chain
     * @throws io.formrules.core.error.PathSyntaxException if the path is empty or malformed
     */
    public static Path parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        Path root = new Path("", PathType.ELEMENT, null, null);
        Path current = root;

        PathScanner scanner = new PathScanner(path);
        while (scanner.hasNext()) {
            String token = scanner.next();
            switch (token) {
                case "[]" -> {
                    if (current.type == PathType.ARRAY) {
                        current.next = new Path("", PathType.ARRAY, null, null);
                        current = current.next;
                    } else {
                        current.type = PathType.ARRAY;
                    }
                }
                case "." -> {
                    if (current.type == PathType.ARRAY) {
                        current.next = new Path("", PathType.OBJECT, null, new Path("", PathType.ELEMENT, null, null));
                        current = current.next.next;
                    } else {
                        current.type = PathType.OBJECT;
                        current.next = new Path("", PathType.ELEMENT, null, null);
                        current = current.next;
                    }
                }
                default -> current.name = token;
            }
        }

        if (current.type != PathType.ELEMENT) {
            current.next = new Path("", PathType.ELEMENT, null, null);
        }
        return root;
    }

    // --- Programmatic construction ---

    /** Creates a final step. */
    public static Path element(String name) {
        return new Path(Objects.requireNonNull(name, "name must not be null"), PathType.ELEMENT, null, null);
    }

    /** Creates an object step followed by {@code next}. */
    public static Path object(String name, Path next) {
        Objects.requireNonNull(next, "object step requires a next step");
        return new Path(Objects.requireNonNull(name, "name must not be null"), PathType.OBJECT, null, next);
    }

    /**
     * Creates an array step followed by {@code next}.
     *
     * @param name  the key of the list in its parent map, empty for nested lists
     * @param index fixed index to explore, or {@code null} to explore every element
     * @param next  the step applied to the explored elements
     */
    public static Path array(String name, Integer index, Path next) {
        Objects.requireNonNull(next, "array step requires a next step");
        if (index != null && index < 0) {
            throw new IllegalArgumentException("array index must not be negative, got: " + index);
        }
        return new Path(Objects.requireNonNull(name, "name must not be null"), PathType.ARRAY, index, next);
    }

    // --- Accessors ---

    /** Name of this step, empty for the unnamed steps following an array. */
    public String name() {
        return name;
    }

    public PathType type() {
        return type;
    }

    /** The fixed index explored by this array step, or {@code null} to explore every element. */
    public Integer index() {
        return index;
    }

    /** The next step, {@code null} for an ELEMENT step. */
    public Path next() {
        return next;
    }

    // --- Queries ---

    /** Returns {@code true} if at least one step in the path involves an array. */
    public boolean hasArray() {
        for (Path step = this; step != null; step = step.next) {
            if (step.type == PathType.ARRAY) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the step whose successor is the final ELEMENT step, or {@code null} if this path is a
     * single ELEMENT step. This is the step that designates the container holding the final value.
     */
    public Path lastParent() {
        for (Path step = this; step != null; step = step.next) {
            if (step.next != null && step.next.type == PathType.ELEMENT) {
                return step;
            }
        }
        return null;
    }

    /** Returns the last step in the path. */
    public Path tail() {
        Path step = this;
        while (step.next != null) {
            step = step.next;
        }
        return step;
    }

    /** Returns a deep copy of this path. */
    public Path copy() {
        return new Path(name, type, index, next != null ? next.copy() : null);
    }

    // --- Walk ---

    /**
     * Walks this path over {@code data} and calls {@code callback} for each final element matched.
     *
     * <p>If the path cannot be completed because a step's name does not exist in the explored map,
     * or because the explored element does not have the expected shape, the callback is still
     * called once for that branch with {@link WalkContext#notFound()} set. An array step without a
     * fixed index fans out: the rest of the path is explored once per list element, each branch
     * reporting its own exact path.
     *
     * @param data     the root of the structure, usually a {@code Map<String, Object>}
     * @param callback receives one context per final element or unresolved branch
     */
    public void walk(Object data, Consumer<WalkContext> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        Path exact = new Path(name, type, null, null);
        walk(data, null, -1, exact, exact, callback);
    }

    private void walk(
            Object currentElement,
            Object parent,
            int index,
            Path exact,
            Path lastExactStep,
            Consumer<WalkContext> callback) {
        Object element = currentElement;
        if (!name.isEmpty()) {
            boolean found = false;
            if (currentElement instanceof Map<?, ?> map) {
                index = -1;
                found = map.containsKey(name);
                element = map.get(name);
            }
            if (!found) {
                callback.accept(WalkContext.notFound(currentElement, exact, name, index));
                return;
            }
            parent = currentElement;
        }

        switch (type) {
            case ELEMENT -> callback.accept(WalkContext.found(element, parent, exact, name, index));
            case ARRAY -> walkArray(element, parent, index, exact, lastExactStep, callback);
            case OBJECT -> {
                lastExactStep.next = next.detachedStep();
                next.walk(element, parent, index, exact, lastExactStep.next, callback);
            }
        }
    }

    private void walkArray(
            Object element, Object parent, int index, Path exact, Path lastExactStep, Consumer<WalkContext> callback) {
        if (!(element instanceof List<?> list)) {
            callback.accept(WalkContext.notFound(parent, exact, name, index));
            return;
        }
        int length = list.size();
        if (next.type != PathType.ELEMENT && length == 0) {
            callback.accept(WalkContext.notFound(element, exact, "", index));
            return;
        }

        if (this.index != null) {
            int fixed = this.index;
            if (fixed >= length) {
                callback.accept(WalkContext.notFound(element, exact, "", fixed));
                return;
            }
            lastExactStep.index = fixed;
            lastExactStep.next = next.detachedStep();
            next.walk(list.get(fixed), element, fixed, exact, lastExactStep.next, callback);
            return;
        }

        for (int i = 0; i < length; i++) {
            Path branch = exact.copy();
            Path branchTail = branch.tail();
            branchTail.index = i;
            branchTail.next = next.detachedStep();
            next.walk(list.get(i), element, i, branch, branchTail.next, callback);
        }
    }

    /** A copy of this single step, without index nor successor, used to grow exact paths. */
    private Path detachedStep() {
        return new Path(name, type, null, null);
    }

    /**
     * Renders the path in the syntax accepted by {@link #parse(String)}. Array steps carrying an
     * index render it between the brackets, so exact paths read like {@code attendees[2].email}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Path step = this; step != null; step = step.next) {
            builder.append(step.name);
            if (step.type == PathType.ARRAY) {
                builder.append('[');
                if (step.index != null) {
                    builder.append(step.index);
                }
                builder.append(']');
            } else if (step.type == PathType.OBJECT && step.next != null) {
                builder.append('.');
            }
        }
        return builder.toString();
    }
}
