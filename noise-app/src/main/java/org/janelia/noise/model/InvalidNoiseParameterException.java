package org.janelia.noise.model;

/**
 * Thrown when a noise parameter lies outside the valid range for its model.
 */
public class InvalidNoiseParameterException
        extends IllegalArgumentException {

    private final String noiseTypeName;
    private final double parameter;

    public InvalidNoiseParameterException(final String noiseTypeName,
                                          final double parameter,
                                          final String message) {
        super("invalid parameter " + parameter + " for " + noiseTypeName + " noise: " + message);
        this.noiseTypeName = noiseTypeName;
        this.parameter = parameter;
    }

    public String getNoiseTypeName() {
        return noiseTypeName;
    }

    public double getParameter() {
        return parameter;
    }
}
