package org.janelia.noise.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;

/**
 * Base for models that degrade each band independently.
 *
 * Every band is copied into a float buffer, handed to {@link #applyToBand} with its own
 * random stream, and the result is clipped (and rounded) back into the image's data type.
 */
public abstract class AbstractBandNoiseModel
        implements NoiseModel {

    private final String noiseTypeName;

    protected AbstractBandNoiseModel(final String noiseTypeName) {
        this.noiseTypeName = noiseTypeName;
    }

    public String getNoiseTypeName() {
        return noiseTypeName;
    }

    @Override
    public CanonicalImage apply(final CanonicalImage image,
                                final double parameter,
                                final long seed)
            throws InvalidNoiseParameterException {

        validateParameter(parameter);

        final DataType dataType = image.getDataType();
        final List<float[]> noisyBands = new ArrayList<>(image.getBandCount());
        for (int b = 0; b < image.getBandCount(); b++) {
            final Band band = new Band(image.getBandValues(b), image.getWidth(), image.getHeight(), dataType);
            noisyBands.add(applyToBand(band, parameter, RandomStreams.forBand(seed, b)));
        }

        return image.withBandValues(noisyBands);
    }

    /**
     * @param  band       copy of the band's samples (may be modified and returned).
     * @param  parameter  validated model parameter.
     * @param  random     random stream for this band.
     *
     * @return degraded samples (clipping is handled by the caller).
     */
    protected abstract float[] applyToBand(final Band band,
                                           final double parameter,
                                           final Random random);

    /**
     * @throws InvalidNoiseParameterException
     *   if the parameter is not finite.
     */
    protected void validateParameter(final double parameter)
            throws InvalidNoiseParameterException {
        validateParameterRange(parameter, -Double.MAX_VALUE, Double.MAX_VALUE);
    }

    /**
     * @throws InvalidNoiseParameterException
     *   if the parameter is not finite or lies outside [min, max].
     */
    protected void validateParameterRange(final double parameter,
                                          final double min,
                                          final double max)
            throws InvalidNoiseParameterException {
        if (Double.isNaN(parameter) || Double.isInfinite(parameter)) {
            throw new InvalidNoiseParameterException(noiseTypeName, parameter, "parameter must be finite");
        }
        if ((parameter < min) || (parameter > max)) {
            throw new InvalidNoiseParameterException(noiseTypeName, parameter,
                                                     "parameter must be between " + min + " and " + max);
        }
    }

    /**
     * Working copy of one band along with its observed value range.
     */
    protected static class Band {

        private final float[] values;
        private final int width;
        private final int height;
        private final DataType dataType;
        private final double min;
        private final double max;

        public Band(final float[] values,
                    final int width,
                    final int height,
                    final DataType dataType) {
            this.values = values;
            this.width = width;
            this.height = height;
            this.dataType = dataType;

            double minValue = Double.MAX_VALUE;
            double maxValue = -Double.MAX_VALUE;
            for (final float value : values) {
                if (! Float.isNaN(value)) {
                    minValue = Math.min(minValue, value);
                    maxValue = Math.max(maxValue, value);
                }
            }
            if (minValue > maxValue) {
                // every sample is NaN
                minValue = 0.0;
                maxValue = 0.0;
            }
            this.min = minValue;
            this.max = maxValue;
        }

        public float[] getValues() {
            return values;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }

        public DataType getDataType() {
            return dataType;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }

        public double getRange() {
            return max - min;
        }

        public boolean isConstant() {
            return max == min;
        }

        /**
         * @return factor that converts an amplitude in 8-bit units into this band's units
         *         (the band's dynamic range / 255, or the data type's full scale / 255 for constant bands).
         */
        public double getEightBitScale() {
            final double range = isConstant() ? dataType.getMaxValue() : getRange();
            return range / 255.0;
        }
    }

}
