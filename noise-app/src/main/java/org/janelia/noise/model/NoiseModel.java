package org.janelia.noise.model;

import java.io.Serializable;

import org.janelia.noise.image.CanonicalImage;

/**
 * Common interface for all noise model implementations.
 */
public interface NoiseModel extends Serializable {

    /**
     * Apply this model.
     *
     * Implementations must not modify the specified image and must return the same result
     * for the same image, parameter and seed.
     *
     * @param  image      image to degrade.
     * @param  parameter  model specific strength parameter (already mapped from a level).
     * @param  seed       seed for any random draws.
     *
     * @return new image with the same shape and data type as the specified image.
     *
     * @throws InvalidNoiseParameterException
     *   if the parameter makes no sense for this model.
     */
    CanonicalImage apply(final CanonicalImage image,
                         final double parameter,
                         final long seed)
            throws InvalidNoiseParameterException;

}
