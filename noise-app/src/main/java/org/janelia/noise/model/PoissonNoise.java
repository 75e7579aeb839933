package org.janelia.noise.model;

import java.util.Random;

/**
 * Shot noise.
 *
 * Samples are normalized to [0, 1] over the band's range, divided by the scale to get the
 * expected photon count, replaced by a poisson draw and mapped back.  Larger scales mean
 * fewer photons and therefore more noise.  Constant bands are returned unchanged.
 */
public class PoissonNoise
        extends AbstractBandNoiseModel {

    /** Expected counts above this use a normal approximation. */
    private static final double NORMAL_APPROXIMATION_THRESHOLD = 30.0;

    public PoissonNoise() {
        super("poisson");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double scale,
                                  final Random random) {

        final float[] values = band.getValues();
        if (band.isConstant()) {
            return values;
        }

        final double min = band.getMin();
        final double range = band.getRange();
        for (int i = 0; i < values.length; i++) {
            final double normalized = (values[i] - min) / range;
            final long count = nextPoisson(normalized / scale, random);
            values[i] = (float) (min + (count * scale * range));
        }
        return values;
    }

    @Override
    protected void validateParameter(final double scale)
            throws InvalidNoiseParameterException {
        validateParameterRange(scale, Double.MIN_NORMAL, Double.MAX_VALUE);
    }

    static long nextPoisson(final double lambda,
                            final Random random) {
        final long count;
        if (lambda <= 0.0) {
            count = 0;
        } else if (lambda > NORMAL_APPROXIMATION_THRESHOLD) {
            count = Math.max(0, Math.round(lambda + Math.sqrt(lambda) * random.nextGaussian()));
        } else {
            // Knuth
            final double limit = Math.exp(-lambda);
            long k = 0;
            double p = random.nextDouble();
            while (p > limit) {
                k++;
                p *= random.nextDouble();
            }
            count = k;
        }
        return count;
    }

}
