package io.formrules.core.path;

import io.formrules.core.error.PathSyntaxException;

/**
 * Splits a path string into tokens: names, {@code "."} and {@code "[]"}. Syntax errors are
 * reported as soon as the offending character pair is reached.
 */
final class PathScanner {

    private final String path;
    private int position;

    PathScanner(String path) {
        this.path = path;
        if (path.isEmpty() || path.charAt(0) == '.') {
            throw illegalSyntax();
        }
    }

    boolean hasNext() {
        return position < path.length();
    }

    String next() {
        int start = position;
        for (int i = start; i < path.length(); i++) {
            char c = path.charAt(i);
            if (i + 1 < path.length()) {
                char following = path.charAt(i + 1);
                if (isIllegal(c, following)) {
                    throw illegalSyntax();
                }
                if (c == '.' && i == start) {
                    position = i + 1;
                    return ".";
                }
                if (following == '.' || following == '[') {
                    position = i + 1;
                    return path.substring(start, i + 1);
                }
            } else if (c == '.' || c == '[') {
                throw illegalSyntax();
            }
        }
        position = path.length();
        return path.substring(start);
    }

    private static boolean isIllegal(char c, char following) {
        return (c == '.' && following == '.')
                || (c == '[' && following != ']')
                || (c == '.' && (following == ']' || following == '['))
                || (c != '.' && c != '[' && following == ']')
                || (c == ']' && following != '[' && following != '.');
    }

    private PathSyntaxException illegalSyntax() {
        return new PathSyntaxException("Illegal path syntax: \"" + path + "\"", path);
    }
}
