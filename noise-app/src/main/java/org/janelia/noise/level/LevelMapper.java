package org.janelia.noise.level;

import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseModelSpec;
import org.janelia.noise.model.NoiseType;

/**
 * Maps integer degradation levels onto noise model parameters.
 *
 * Level 1 always maps to the least degrading end of a model's configured range and the
 * highest level to the most degrading end.  For inverse models (where a larger parameter
 * means less degradation) the range is traversed from its maximum down to its minimum.
 */
public class LevelMapper {

    private final NoiseConfiguration configuration;

    public LevelMapper(final NoiseConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @return parameter for the specified level using the configured default number of levels.
     *
     * @throws InvalidLevelException
     *   if the level is out of range.
     */
    public double mapLevel(final NoiseType type,
                           final int level)
            throws InvalidLevelException {
        return mapLevel(type, level, configuration.getDefaultLevels());
    }

    /**
     * @return parameter for the specified level.
     *
     * @throws InvalidLevelException
     *   if the level is out of range or maxLevel is less than 1.
     */
    public double mapLevel(final NoiseType type,
                           final int level,
                           final int maxLevel)
            throws InvalidLevelException {

        final NoiseModelSpec spec = configuration.getSpec(type);
        final double start;
        final double end;
        if (type.isInverse()) {
            start = spec.getMaxParameter();
            end = spec.getMinParameter();
        } else {
            start = spec.getMinParameter();
            end = spec.getMaxParameter();
        }

        return interpolate(start, end, level, maxLevel);
    }

    /**
     * @return parameters for levels 1 through the configured default number of levels.
     */
    public double[] mapAllLevels(final NoiseType type) {
        final int maxLevel = configuration.getDefaultLevels();
        final double[] parameters = new double[maxLevel];
        for (int level = 1; level <= maxLevel; level++) {
            parameters[level - 1] = mapLevel(type, level, maxLevel);
        }
        return parameters;
    }

    /**
     * @return start + (end - start) * (level - 1) / (maxLevel - 1), or start when maxLevel is 1.
     *
     * @throws InvalidLevelException
     *   if the level is out of range or maxLevel is less than 1.
     */
    public static double interpolate(final double start,
                                     final double end,
                                     final int level,
                                     final int maxLevel)
            throws InvalidLevelException {

        if ((maxLevel < 1) || (level < 1) || (level > maxLevel)) {
            throw new InvalidLevelException(level, maxLevel);
        }

        final double parameter;
        if (maxLevel == 1) {
            parameter = start;
        } else if (level == maxLevel) {
            parameter = end;
        } else {
            parameter = start + (end - start) * (level - 1) / (maxLevel - 1);
        }
        return parameter;
    }

}
