package de.ovgu.bugfixminimizer.normalize;

import java.util.List;

/**
 * Removes blank lines that the after version introduces.
 */
public interface BlankLineStripper {
    /**
     * @return The after lines without the blank lines that do not correspond to a line of the before version
     */
    List<String> stripAddedBlankLines(List<String> before, List<String> after);
}
