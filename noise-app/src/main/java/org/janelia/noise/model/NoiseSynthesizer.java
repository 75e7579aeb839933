package org.janelia.noise.model;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.level.InvalidLevelException;
import org.janelia.noise.level.LevelMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies configured noise models to canonical images.
 *
 * Instances hold no mutable state, so one synthesizer can serve any number of worker threads.
 */
public class NoiseSynthesizer {

    private final NoiseConfiguration configuration;
    private final LevelMapper levelMapper;

    public NoiseSynthesizer(final NoiseConfiguration configuration) {
        this.configuration = configuration;
        this.levelMapper = new LevelMapper(configuration);
    }

    public NoiseConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Maps the specified level to a parameter and applies the corresponding noise.
     *
     * @return new degraded image (the specified image is not modified).
     *
     * @throws InvalidLevelException
     *   if the level is out of range.
     *
     * @throws InvalidNoiseParameterException
     *   if the mapped parameter is not valid for the model.
     */
    public CanonicalImage apply(final CanonicalImage image,
                                final NoiseType type,
                                final int level,
                                final int maxLevel,
                                final long seed)
            throws InvalidLevelException, InvalidNoiseParameterException {

        final double parameter = levelMapper.mapLevel(type, level, maxLevel);

        LOG.debug("apply: mapped {} level {} of {} to {} {}",
                  type, level, maxLevel, configuration.getSpec(type).getParameterName(), parameter);

        return applyParameter(image, type, parameter, seed);
    }

    /**
     * Applies noise with an explicit parameter value.
     *
     * @return new degraded image (the specified image is not modified).
     *
     * @throws InvalidNoiseParameterException
     *   if the parameter lies outside the configured range for the specified type.
     */
    public CanonicalImage applyParameter(final CanonicalImage image,
                                         final NoiseType type,
                                         final double parameter,
                                         final long seed)
            throws InvalidNoiseParameterException {

        final NoiseModelSpec spec = configuration.getSpec(type);
        if (! spec.isInRange(parameter)) {
            throw new InvalidNoiseParameterException(type.getName(), parameter,
                                                     spec.getParameterName() + " must be between " +
                                                     spec.getMinParameter() + " and " + spec.getMaxParameter());
        }

        final CanonicalImage noisyImage = type.getModel().apply(image, parameter, seed);

        LOG.debug("applyParameter: applied {} with {} {} to {}", type, spec.getParameterName(), parameter, image);

        return noisyImage;
    }

    private static final Logger LOG = LoggerFactory.getLogger(NoiseSynthesizer.class);
}
