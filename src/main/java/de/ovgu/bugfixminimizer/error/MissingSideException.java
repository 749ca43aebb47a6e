package de.ovgu.bugfixminimizer.error;

/**
 * Thrown if a file declared as modified lacks its before or after version.
 */
public class MissingSideException extends MinimizationException {
    private final String path;
    private final String side;

    public MissingSideException(String path, String side) {
        super("Modified file " + path + " has no " + side + " version");
        this.path = path;
        this.side = side;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return <code>before</code> or <code>after</code>
     */
    public String getSide() {
        return side;
    }
}
