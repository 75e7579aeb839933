package org.janelia.noise.model;

import java.util.Random;

/**
 * Multiplicative noise: each sample v becomes v * (1 + n) with n drawn from N(0, variance).
 * Constant bands are returned unchanged.
 */
public class SpeckleNoise
        extends AbstractBandNoiseModel {

    public SpeckleNoise() {
        super("speckle");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double variance,
                                  final Random random) {
        final float[] values = band.getValues();
        if (band.isConstant()) {
            return values;
        }

        final double standardDeviation = Math.sqrt(variance);
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (values[i] * (1.0 + random.nextGaussian() * standardDeviation));
        }
        return values;
    }

    @Override
    protected void validateParameter(final double variance)
            throws InvalidNoiseParameterException {
        validateParameterRange(variance, 0, Double.MAX_VALUE);
    }

}
