package org.janelia.noise.model;

import ij.process.FloatProcessor;

import java.util.Arrays;
import java.util.Random;

/**
 * Horizontal linear motion blur.
 *
 * Each band is convolved with a normalized 1 x k line kernel using ImageJ,
 * where k is the kernel size rounded to the nearest odd integer.
 * Edge pixels are replicated beyond the image border.
 */
public class MotionBlur
        extends AbstractBandNoiseModel {

    public MotionBlur() {
        super("motion_blur");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double kernelSize,
                                  final Random random) {

        final int k = getOddKernelSize(kernelSize);
        if (k == 1) {
            return band.getValues();
        }

        final float[] kernel = new float[k];
        Arrays.fill(kernel, 1.0f / k);

        final FloatProcessor fp = new FloatProcessor(band.getWidth(), band.getHeight(), band.getValues());
        fp.convolve(kernel, k, 1);

        return (float[]) fp.getPixels();
    }

    @Override
    protected void validateParameter(final double kernelSize)
            throws InvalidNoiseParameterException {
        validateParameterRange(kernelSize, 1, 1001);
    }

    /**
     * @return the odd integer nearest to the specified size (at least 1).
     */
    public static int getOddKernelSize(final double kernelSize) {
        final int k = 2 * (int) Math.round((kernelSize - 1.0) / 2.0) + 1;
        return Math.max(1, k);
    }

}
