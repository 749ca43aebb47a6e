package de.ovgu.bugfixminimizer.data;

/**
 * How a commit touches a file, as declared by the source that mined it.
 */
public enum ModificationType {
    /**
     * The file is new; there is no before side.
     */
    ADD,
    /**
     * The file is removed; there is no after side.
     */
    DELETE,
    /**
     * The file exists on both sides.
     */
    MODIFY
}
