package org.janelia.noise.metrics;

/**
 * Thrown when two images that must be compared sample by sample have different shapes.
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    public ShapeMismatchException(final String message) {
        super(message);
    }
}
