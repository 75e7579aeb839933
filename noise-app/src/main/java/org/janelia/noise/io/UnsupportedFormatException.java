package org.janelia.noise.io;

/**
 * Thrown when a file's type, extension or sample layout cannot be handled,
 * or when a target format cannot store an image.
 */
public class UnsupportedFormatException
        extends IllegalArgumentException {

    public UnsupportedFormatException(final String message) {
        super(message);
    }

    public UnsupportedFormatException(final String message,
                                      final Throwable cause) {
        super(message, cause);
    }
}
