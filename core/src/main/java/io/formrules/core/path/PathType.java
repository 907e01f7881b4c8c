package io.formrules.core.path;

/** Kind of a {@link Path} step. */
public enum PathType {
    /** Final step: the explored element is the value to hand to the walk callback. */
    ELEMENT,

    /**
     * The explored element is a list. Every element (or only the step's fixed index) is explored
     * using the next step.
     */
    ARRAY,

    /** The explored element is a map and the next step names one of its keys. */
    OBJECT
}
