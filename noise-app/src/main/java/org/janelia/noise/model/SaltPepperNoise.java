package org.janelia.noise.model;

import java.util.Random;

/**
 * Replaces samples with the data type's maximum (salt) or minimum (pepper).
 * Each sample is replaced with the specified probability, half of the replacements being salt.
 */
public class SaltPepperNoise
        extends AbstractBandNoiseModel {

    public SaltPepperNoise() {
        super("salt_pepper");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double probability,
                                  final Random random) {
        final float salt = (float) band.getDataType().getMaxValue();
        final float pepper = (float) band.getDataType().getMinValue();
        final double saltProbability = probability / 2.0;
        final float[] values = band.getValues();
        for (int i = 0; i < values.length; i++) {
            final double r = random.nextDouble();
            if (r < saltProbability) {
                values[i] = salt;
            } else if (r < probability) {
                values[i] = pepper;
            }
        }
        return values;
    }

    @Override
    protected void validateParameter(final double probability)
            throws InvalidNoiseParameterException {
        validateParameterRange(probability, 0, 1);
    }

}
