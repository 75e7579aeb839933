package org.janelia.noise.model;

import java.util.Locale;

/**
 * The supported noise families along with their built-in configuration defaults.
 */
public enum NoiseType {

    GAUSSIAN("gaussian", new GaussianNoise(), false,
             "Gaussian noise (sensor thermal noise)", "sigma", 5, 50),
    SALT_PEPPER("salt_pepper", new SaltPepperNoise(), false,
                "Salt and pepper noise (defective pixels)", "probability", 0.001, 0.01),
    POISSON("poisson", new PoissonNoise(), false,
            "Poisson noise (shot noise)", "scale", 0.1, 1.0),
    SPECKLE("speckle", new SpeckleNoise(), false,
            "Speckle noise (multiplicative)", "variance", 0.05, 0.5),
    MOTION_BLUR("motion_blur", new MotionBlur(), false,
                "Motion blur (camera movement)", "kernel_size", 3, 21),
    ATMOSPHERIC("atmospheric", new AtmosphericHaze(), false,
                "Atmospheric effects (haze, vapour)", "haze_intensity", 0.1, 1.0),
    COMPRESSION("compression", new CompressionArtifacts(), true,
                "JPEG compression artifacts", "quality", 50, 95),
    ISO_NOISE("iso_noise", new IsoNoise(), false,
              "High ISO sensor noise", "iso_level", 1, 10);

    private final String configName;
    private final NoiseModel model;
    private final boolean inverse;
    private final NoiseModelSpec defaultSpec;

    NoiseType(final String name,
              final NoiseModel model,
              final boolean inverse,
              final String description,
              final String parameterName,
              final double minParameter,
              final double maxParameter) {
        this.configName = name;
        this.model = model;
        this.inverse = inverse;
        this.defaultSpec = new NoiseModelSpec(description, parameterName, minParameter, maxParameter);
    }

    /**
     * @return configuration name of this type (e.g. "salt_pepper").
     */
    public String getName() {
        return configName;
    }

    public NoiseModel getModel() {
        return model;
    }

    /**
     * @return true if a larger parameter means less degradation for this type.
     */
    public boolean isInverse() {
        return inverse;
    }

    public NoiseModelSpec getDefaultSpec() {
        return defaultSpec;
    }

    @Override
    public String toString() {
        return configName;
    }

    /**
     * @return type with the specified configuration name (case insensitive).
     *
     * @throws IllegalArgumentException
     *   if no type has the specified name.
     */
    public static NoiseType fromName(final String name)
            throws IllegalArgumentException {
        if (name != null) {
            final String lowerCaseName = name.trim().toLowerCase(Locale.US);
            for (final NoiseType type : values()) {
                if (type.configName.equals(lowerCaseName)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("unknown noise type '" + name + "'");
    }

}
