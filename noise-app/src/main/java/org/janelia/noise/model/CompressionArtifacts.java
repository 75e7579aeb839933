package org.janelia.noise.model;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Random;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;
import org.janelia.noise.io.CanonicalRasters;
import org.janelia.noise.io.StandardImageCodec;

/**
 * JPEG compression artifacts at a quality between 1 and 100 (lower quality means more degradation).
 *
 * Three band 8-bit images go through a colour JPEG encode and decode.  All other images are
 * degraded band by band through gray-scale JPEG, with bands wider than 8 bits rescaled to 8 bits
 * over their observed range and back.  The per band path approximates real sensor compression
 * and discards cross band correlation.  Constant bands are returned unchanged.
 */
public class CompressionArtifacts
        extends AbstractBandNoiseModel {

    public CompressionArtifacts() {
        super("compression");
    }

    @Override
    public CanonicalImage apply(final CanonicalImage image,
                                final double quality,
                                final long seed)
            throws InvalidNoiseParameterException {

        final CanonicalImage result;
        if ((image.getDataType() == DataType.UINT8) && (image.getBandCount() == 3)) {
            validateParameter(quality);
            final BufferedImage decoded = jpegRoundTrip(CanonicalRasters.toBufferedImage(image), quality);
            result = CanonicalRasters.toCanonicalImage(decoded, "in-memory colour JPEG");
        } else {
            result = super.apply(image, quality, seed);
        }
        return result;
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double quality,
                                  final Random random) {

        final float[] values = band.getValues();
        if (band.isConstant()) {
            return values;
        }

        final boolean isEightBit = band.getDataType() == DataType.UINT8;
        final double min = isEightBit ? 0.0 : band.getMin();
        final double range = isEightBit ? 255.0 : band.getRange();

        final byte[] eightBitPixels = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            final double scaled = Float.isNaN(values[i]) ? 0.0 : (values[i] - min) * 255.0 / range;
            eightBitPixels[i] = (byte) (int) Math.max(0, Math.min(255, Math.round(scaled)));
        }

        final CanonicalImage eightBitImage = CanonicalImage.fromSingleBand(
                new ByteProcessor(band.getWidth(), band.getHeight(), eightBitPixels, null));
        final BufferedImage decoded = jpegRoundTrip(CanonicalRasters.toBufferedImage(eightBitImage), quality);
        final ImageProcessor decodedBand = CanonicalRasters.toCanonicalImage(decoded, "in-memory gray JPEG").getBand(0);

        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (min + decodedBand.get(i) * range / 255.0);
        }
        return values;
    }

    @Override
    protected void validateParameter(final double quality)
            throws InvalidNoiseParameterException {
        validateParameterRange(quality, 1, 100);
    }

    private static BufferedImage jpegRoundTrip(final BufferedImage image,
                                               final double quality) {
        try {
            return StandardImageCodec.jpegRoundTrip(image, (float) (quality / 100.0));
        } catch (final IOException e) {
            throw new IllegalStateException("failed to encode and decode in-memory JPEG at quality " + quality, e);
        }
    }

}
