package io.octave.core.error;

/** Thrown when a holographic pattern or constraint chain text cannot be parsed. */
public final class HolographicPatternException extends OctaveException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "E_HOLOGRAPHIC";

    public HolographicPatternException(String message) {
        super(CODE, message, 0, 0, Phase.SCHEMA);
    }

    public HolographicPatternException(String message, Throwable cause) {
        super(CODE, message, cause, Phase.SCHEMA);
    }
}
