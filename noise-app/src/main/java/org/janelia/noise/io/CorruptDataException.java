package org.janelia.noise.io;

/**
 * Thrown when a file claims a supported container format but its pixel payload cannot be decoded.
 */
public class CorruptDataException
        extends IllegalArgumentException {

    public CorruptDataException(final String message) {
        super(message);
    }

    public CorruptDataException(final String message,
                                final Throwable cause) {
        super(message, cause);
    }
}
