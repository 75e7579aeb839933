package org.janelia.noise.model;

import java.util.Random;

/**
 * Additive zero mean gaussian noise, sigma expressed in 8-bit units.
 */
public class GaussianNoise
        extends AbstractBandNoiseModel {

    public GaussianNoise() {
        super("gaussian");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double sigma,
                                  final Random random) {
        final double scaledSigma = sigma * band.getEightBitScale();
        final float[] values = band.getValues();
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (values[i] + random.nextGaussian() * scaledSigma);
        }
        return values;
    }

    @Override
    protected void validateParameter(final double sigma)
            throws InvalidNoiseParameterException {
        validateParameterRange(sigma, 0, Double.MAX_VALUE);
    }

}
