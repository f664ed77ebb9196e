package io.octave.core.error;

/**
 * Thrown when the emitter is handed a value that has no serialization, such as an
 * {@link io.octave.core.model.Absent} in a value position. Signals a caller bug, not bad input.
 */
public final class EmitException extends OctaveException {

    private static final long serialVersionUID = 1L;

    public static final String ABSENT_VALUE = "E_ABSENT_EMIT";

    public EmitException(String message) {
        super(ABSENT_VALUE, message, 0, 0, Phase.EMIT);
    }
}
