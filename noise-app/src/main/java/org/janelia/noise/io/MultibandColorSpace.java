package org.janelia.noise.io;

import java.awt.color.ColorSpace;
import java.util.Arrays;

/**
 * Colour space for images with an arbitrary number of spectral bands.
 *
 * Only used to describe band count and sample range to Java2D and Image I/O writers,
 * conversions report the mean band value as a gray level.
 */
public class MultibandColorSpace
        extends ColorSpace {

    private static final ColorSpace SRGB = ColorSpace.getInstance(ColorSpace.CS_sRGB);

    public MultibandColorSpace(final int numberOfBands) {
        super(getColorSpaceType(numberOfBands), numberOfBands);
    }

    @Override
    public float[] toRGB(final float[] colorvalue) {
        float sum = 0f;
        for (final float value : colorvalue) {
            sum += value;
        }
        final float gray = sum / colorvalue.length;
        return new float[] { gray, gray, gray };
    }

    @Override
    public float[] fromRGB(final float[] rgbvalue) {
        final float gray = (rgbvalue[0] + rgbvalue[1] + rgbvalue[2]) / 3f;
        final float[] values = new float[getNumComponents()];
        Arrays.fill(values, gray);
        return values;
    }

    @Override
    public float[] toCIEXYZ(final float[] colorvalue) {
        return SRGB.toCIEXYZ(toRGB(colorvalue));
    }

    @Override
    public float[] fromCIEXYZ(final float[] colorvalue) {
        return fromRGB(SRGB.fromCIEXYZ(colorvalue));
    }

    private static int getColorSpaceType(final int numberOfBands) {
        final int type;
        if (numberOfBands < 2) {
            type = ColorSpace.TYPE_GRAY;
        } else if (numberOfBands <= 15) {
            type = ColorSpace.TYPE_2CLR + (numberOfBands - 2);
        } else {
            type = ColorSpace.TYPE_FCLR;
        }
        return type;
    }

}
