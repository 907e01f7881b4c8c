package io.formrules.core.path;

/**
 * Information handed to the walk callback for every final element reached by
 * {@link Path#walk(Object, java.util.function.Consumer)}.
 *
 * @param value    the resolved value, {@code null} when {@code notFound} is set
 * @param parent   the container holding the value: a {@code Map} or a {@code List}
 * @param path     exact path to the value, with array steps carrying the concrete index
 * @param name     name of the current element, empty for list elements
 * @param index    index of the value in its parent if the parent is a list, else {@code -1}
 * @param notFound {@code true} if the path could not be completely explored
 */
public record WalkContext(Object value, Object parent, Path path, String name, int index, boolean notFound) {

    static WalkContext found(Object value, Object parent, Path path, String name, int index) {
        return new WalkContext(value, parent, path, name, index, false);
    }

    static WalkContext notFound(Object parent, Path path, String name, int index) {
        return new WalkContext(null, parent, path, name, index, true);
    }
}
