package org.janelia.noise.model;

import java.util.Random;

/**
 * Deterministic haze: blends every sample towards the data type's maximum (the airlight),
 * v' = v * (1 - h) + max * h.
 */
public class AtmosphericHaze
        extends AbstractBandNoiseModel {

    public AtmosphericHaze() {
        super("atmospheric");
    }

    @Override
    protected float[] applyToBand(final Band band,
                                  final double hazeIntensity,
                                  final Random random) {
        final double airlight = band.getDataType().getMaxValue();
        final double transmission = 1.0 - hazeIntensity;
        final double hazeOffset = airlight * hazeIntensity;
        final float[] values = band.getValues();
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (values[i] * transmission + hazeOffset);
        }
        return values;
    }

    @Override
    protected void validateParameter(final double hazeIntensity)
            throws InvalidNoiseParameterException {
        validateParameterRange(hazeIntensity, 0, 1);
    }

}
