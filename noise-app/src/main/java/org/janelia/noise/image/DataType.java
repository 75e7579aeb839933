package org.janelia.noise.image;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.awt.image.DataBuffer;

/**
 * Sample types supported for {@link CanonicalImage} bands.
 * Each type maps onto exactly one ImageJ processor class and one {@link DataBuffer} type.
 */
public enum DataType {

    UINT8(255.0, DataBuffer.TYPE_BYTE),
    UINT16(65535.0, DataBuffer.TYPE_USHORT),
    FLOAT32(1.0, DataBuffer.TYPE_FLOAT);

    private final double maxValue;
    private final int dataBufferType;

    DataType(final double maxValue,
             final int dataBufferType) {
        this.maxValue = maxValue;
        this.dataBufferType = dataBufferType;
    }

    /**
     * @return smallest legal sample value (always 0).
     */
    public double getMinValue() {
        return 0.0;
    }

    /**
     * @return theoretical maximum sample value for this type (not the observed maximum of any image).
     */
    public double getMaxValue() {
        return maxValue;
    }

    public int getDataBufferType() {
        return dataBufferType;
    }

    public boolean isIntegral() {
        return this != FLOAT32;
    }

    /**
     * @return the specified value clipped to this type's legal range
     *         (and rounded to the nearest integer for integral types).
     */
    public float toLegalValue(final double value) {
        final double clipped;
        if (Double.isNaN(value)) {
            clipped = 0.0;
        } else if (value < 0.0) {
            clipped = 0.0;
        } else if (value > maxValue) {
            clipped = maxValue;
        } else {
            clipped = value;
        }
        return isIntegral() ? (float) Math.rint(clipped) : (float) clipped;
    }

    /**
     * @return new processor of this type with the specified values clipped to the legal range.
     *
     * @throws IllegalArgumentException
     *   if the number of values does not match the dimensions.
     */
    public ImageProcessor createProcessor(final int width,
                                          final int height,
                                          final float[] values)
            throws IllegalArgumentException {

        final int n = width * height;
        if (values.length != n) {
            throw new IllegalArgumentException("expected " + n + " values for " + width + "x" + height +
                                               " band but found " + values.length);
        }

        final ImageProcessor ip;
        switch (this) {
            case UINT8:
                final byte[] bytePixels = new byte[n];
                for (int i = 0; i < n; i++) {
                    bytePixels[i] = (byte) (int) toLegalValue(values[i]);
                }
                ip = new ByteProcessor(width, height, bytePixels, null);
                break;
            case UINT16:
                final short[] shortPixels = new short[n];
                for (int i = 0; i < n; i++) {
                    shortPixels[i] = (short) (int) toLegalValue(values[i]);
                }
                ip = new ShortProcessor(width, height, shortPixels, null);
                break;
            default:
                final float[] floatPixels = new float[n];
                for (int i = 0; i < n; i++) {
                    floatPixels[i] = toLegalValue(values[i]);
                }
                ip = new FloatProcessor(width, height, floatPixels, null);
                break;
        }
        return ip;
    }

    /**
     * @return type of the specified processor.
     *
     * @throws IllegalArgumentException
     *   if the processor holds packed colour pixels.
     */
    public static DataType forProcessor(final ImageProcessor ip)
            throws IllegalArgumentException {
        final DataType dataType;
        if (ip instanceof ByteProcessor) {
            dataType = UINT8;
        } else if (ip instanceof ShortProcessor) {
            dataType = UINT16;
        } else if (ip instanceof FloatProcessor) {
            dataType = FLOAT32;
        } else {
            throw new IllegalArgumentException("unsupported processor type " + ip.getClass().getName() +
                                               ", split colour images into separate bands");
        }
        return dataType;
    }

}
