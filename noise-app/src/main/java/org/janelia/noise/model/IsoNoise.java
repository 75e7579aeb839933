package org.janelia.noise.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.noise.image.CanonicalImage;

/**
 * High ISO sensor noise with separate luminance and chrominance components.
 *
 * For an ISO level p the luminance sigma is 5 + 10 (p - 1) and the chrominance sigma is
 * 2 + 3 (p - 1), both in 8-bit units.  When an image has at least three bands, the first
 * three are treated as RGB: they are converted to BT.601 YCbCr, noise is added to each
 * component and the result is converted back.  Any other band receives gaussian noise with
 * the luminance sigma.
 */
public class IsoNoise
        extends AbstractBandNoiseModel {

    public IsoNoise() {
        super("iso_noise");
    }

    public static double getLuminanceSigma(final double isoLevel) {
        return 5.0 + 10.0 * (isoLevel - 1.0);
    }

    public static double getChrominanceSigma(final double isoLevel) {
        return 2.0 + 3.0 * (isoLevel - 1.0);
    }

    @Override
    public CanonicalImage apply(final CanonicalImage image,
                                final double isoLevel,
                                final long seed)
            throws InvalidNoiseParameterException {

        validateParameter(isoLevel);

        final int numberOfBands = image.getBandCount();
        final List<float[]> noisyBands = new ArrayList<>(numberOfBands);
        int firstIndependentBand = 0;

        if (numberOfBands >= 3) {
            final Band red = buildBand(image, 0);
            final Band green = buildBand(image, 1);
            final Band blue = buildBand(image, 2);
            addColourNoise(red, green, blue, isoLevel, seed);
            noisyBands.add(red.getValues());
            noisyBands.add(green.getValues());
            noisyBands.add(blue.getValues());
            firstIndependentBand = 3;
        }

        for (int b = firstIndependentBand; b < numberOfBands; b++) {
            noisyBands.add(applyToBand(buildBand(image, b), isoLevel, RandomStreams.forBand(seed, b)));
        }

        return image.withBandValues(noisyBands);
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double isoLevel,
                                  final Random random) {
        final double sigma = getLuminanceSigma(isoLevel) * band.getEightBitScale();
        final float[] values = band.getValues();
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (values[i] + random.nextGaussian() * sigma);
        }
        return values;
    }

    @Override
    protected void validateParameter(final double isoLevel)
            throws InvalidNoiseParameterException {
        validateParameterRange(isoLevel, 1, 100);
    }

    private static Band buildBand(final CanonicalImage image,
                                  final int band) {
        return new Band(image.getBandValues(band), image.getWidth(), image.getHeight(), image.getDataType());
    }

    private static void addColourNoise(final Band red,
                                       final Band green,
                                       final Band blue,
                                       final double isoLevel,
                                       final long seed) {

        // one scale for all three components
        final double min = Math.min(red.getMin(), Math.min(green.getMin(), blue.getMin()));
        final double max = Math.max(red.getMax(), Math.max(green.getMax(), blue.getMax()));
        final double range = (max > min) ? (max - min) : red.getDataType().getMaxValue();
        final double scale = range / 255.0;

        final double luminanceSigma = getLuminanceSigma(isoLevel) * scale;
        final double chrominanceSigma = getChrominanceSigma(isoLevel) * scale;

        final Random luminanceRandom = RandomStreams.forBand(seed, 0);
        final Random blueDifferenceRandom = RandomStreams.forBand(seed, 1);
        final Random redDifferenceRandom = RandomStreams.forBand(seed, 2);

        final float[] r = red.getValues();
        final float[] g = green.getValues();
        final float[] b = blue.getValues();

        for (int i = 0; i < r.length; i++) {

            final double y = 0.299 * r[i] + 0.587 * g[i] + 0.114 * b[i];
            final double cb = (b[i] - y) * 0.564 + blueDifferenceRandom.nextGaussian() * chrominanceSigma;
            final double cr = (r[i] - y) * 0.713 + redDifferenceRandom.nextGaussian() * chrominanceSigma;
            final double noisyY = y + luminanceRandom.nextGaussian() * luminanceSigma;

            r[i] = (float) (noisyY + 1.403 * cr);
            g[i] = (float) (noisyY - 0.344 * cb - 0.714 * cr);
            b[i] = (float) (noisyY + 1.773 * cb);
        }
    }

}
