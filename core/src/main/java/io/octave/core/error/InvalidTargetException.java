package io.octave.core.error;

/** Thrown when a routing target is neither built in, declared by the schema policy, nor path-shaped. */
public final class InvalidTargetException extends OctaveException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "E009";

    private final String targetName;

    public InvalidTargetException(String targetName) {
        super(
                CODE,
                String.format(
                        "Invalid target '%s': not a builtin, registered custom, or file path target", targetName),
                0,
                0,
                Phase.ROUTE);
        this.targetName = targetName;
    }

    /** The unresolvable target name, without section marker. */
    public String targetName() {
        return targetName;
    }
}
