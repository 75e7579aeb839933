package org.janelia.noise.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

import org.janelia.noise.json.JsonUtils;

/**
 * Configured description, parameter name and valid parameter range for one noise type.
 */
public class NoiseModelSpec
        implements Serializable {

    private final String description;

    @JsonProperty("parameter_name")
    private final String parameterName;

    @JsonProperty("parameter_range")
    private final double[] parameterRange;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private NoiseModelSpec() {
        this.description = null;
        this.parameterName = null;
        this.parameterRange = null;
    }

    public NoiseModelSpec(final String description,
                          final String parameterName,
                          final double minParameter,
                          final double maxParameter) {
        this.description = description;
        this.parameterName = parameterName;
        this.parameterRange = new double[] { minParameter, maxParameter };
    }

    public String getDescription() {
        return description;
    }

    public String getParameterName() {
        return parameterName;
    }

    public double getMinParameter() {
        return parameterRange[0];
    }

    public double getMaxParameter() {
        return parameterRange[1];
    }

    /**
     * @return true if the specified parameter lies within this spec's range
     *         (allowing for rounding error in level mapped values).
     */
    public boolean isInRange(final double parameter) {
        final double tolerance = 1e-9 * Math.max(1.0, Math.abs(getMaxParameter() - getMinParameter()));
        return (! Double.isNaN(parameter)) &&
               (parameter >= getMinParameter() - tolerance) &&
               (parameter <= getMaxParameter() + tolerance);
    }

    /**
     * @throws IllegalArgumentException
     *   if this spec is missing its parameter name or has an invalid range.
     */
    public void validate(final String noiseTypeName)
            throws IllegalArgumentException {
        if (parameterName == null) {
            throw new IllegalArgumentException("parameter_name is not defined for " + noiseTypeName);
        }
        if ((parameterRange == null) || (parameterRange.length != 2)) {
            throw new IllegalArgumentException("parameter_range for " + noiseTypeName +
                                               " must contain exactly two values");
        }
        if (! (parameterRange[0] <= parameterRange[1])) {
            throw new IllegalArgumentException("parameter_range minimum must not exceed maximum for " +
                                               noiseTypeName);
        }
    }

    /**
     * @return description of the range in the form "sigma: 5.0-50.0".
     */
    public String getRangeDescription() {
        return parameterName + ": " + getMinParameter() + "-" + getMaxParameter();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static final JsonUtils.Helper<NoiseModelSpec> JSON_HELPER =
            new JsonUtils.Helper<>(NoiseModelSpec.class);
}
