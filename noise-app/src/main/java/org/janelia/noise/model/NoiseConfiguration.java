package org.janelia.noise.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.noise.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the parameter ranges for each noise type and the default number of degradation levels.
 *
 * Instances are passed explicitly to the components that need them.  Types missing from a
 * parsed configuration keep their built-in defaults.
 */
public class NoiseConfiguration
        implements Serializable {

    public static final int DEFAULT_LEVELS = 10;

    public static class GenerationParameters
            implements Serializable {

        @JsonProperty("default_levels")
        private final Integer defaultLevels;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private GenerationParameters() {
            this.defaultLevels = null;
        }

        public GenerationParameters(final Integer defaultLevels) {
            this.defaultLevels = defaultLevels;
        }

        public Integer getDefaultLevels() {
            return defaultLevels;
        }
    }

    @JsonProperty("noise_types")
    private final Map<String, NoiseModelSpec> noiseTypes;

    @JsonProperty("generation_parameters")
    private final GenerationParameters generationParameters;

    /**
     * Constructs a configuration with the built-in defaults.
     */
    public NoiseConfiguration() {
        this.noiseTypes = new LinkedHashMap<>();
        for (final NoiseType type : NoiseType.values()) {
            this.noiseTypes.put(type.getName(), type.getDefaultSpec());
        }
        this.generationParameters = new GenerationParameters(DEFAULT_LEVELS);
    }

    public NoiseConfiguration(final Map<String, NoiseModelSpec> noiseTypes,
                              final int defaultLevels) {
        this.noiseTypes = new LinkedHashMap<>(noiseTypes);
        this.generationParameters = new GenerationParameters(defaultLevels);
    }

    /**
     * @return the configured spec for the specified type (or its built-in default if none is configured).
     */
    public NoiseModelSpec getSpec(final NoiseType type) {
        final NoiseModelSpec spec = (noiseTypes == null) ? null : noiseTypes.get(type.getName());
        return spec == null ? type.getDefaultSpec() : spec;
    }

    public int getDefaultLevels() {
        final Integer levels = (generationParameters == null) ? null : generationParameters.getDefaultLevels();
        return levels == null ? DEFAULT_LEVELS : levels;
    }

    /**
     * @throws IllegalArgumentException
     *   if any configured spec is invalid or the default level count is less than 1.
     */
    public void validate()
            throws IllegalArgumentException {
        if (noiseTypes != null) {
            for (final Map.Entry<String, NoiseModelSpec> entry : noiseTypes.entrySet()) {
                NoiseType.fromName(entry.getKey());
                if (entry.getValue() == null) {
                    throw new IllegalArgumentException("no spec defined for " + entry.getKey());
                }
                entry.getValue().validate(entry.getKey());
            }
        }
        if (getDefaultLevels() < 1) {
            throw new IllegalArgumentException("default_levels must be at least 1");
        }
    }

    /**
     * @return a JSON representation of this configuration.
     */
    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * @param  reader  reader to parse.
     *
     * @return a validated configuration populated by parsing the specified json reader's stream.
     *
     * @throws IllegalArgumentException
     *   if the stream cannot be parsed or the parsed configuration is invalid.
     */
    public static NoiseConfiguration fromJson(final Reader reader)
            throws IllegalArgumentException {
        final NoiseConfiguration configuration = JSON_HELPER.fromJson(reader);
        configuration.validate();
        return configuration;
    }

    /**
     * @return a configuration parsed from the specified file
     *         (or the built-in defaults if that file cannot be parsed for any reason).
     */
    public static NoiseConfiguration loadConfiguredInstance(final File configFile) {

        NoiseConfiguration configuration = new NoiseConfiguration();

        if (configFile == null) {
            LOG.info("loadConfiguredInstance: no configuration file specified, using built-in defaults");
        } else if (configFile.exists()) {
            try (final Reader reader = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
                configuration = fromJson(reader);

                LOG.info("loadConfiguredInstance: loaded {} noise type specs from {}",
                         configuration.noiseTypes == null ? 0 : configuration.noiseTypes.size(), configFile);

            } catch (final IOException | IllegalArgumentException e) {
                LOG.warn("loadConfiguredInstance: failed to load configuration from " + configFile +
                         ", using built-in defaults", e);
            }

        } else {
            LOG.warn("loadConfiguredInstance: failed to find {}, using built-in defaults", configFile);
        }

        return configuration;
    }

    private static final Logger LOG = LoggerFactory.getLogger(NoiseConfiguration.class);

    private static final JsonUtils.Helper<NoiseConfiguration> JSON_HELPER =
            new JsonUtils.Helper<>(NoiseConfiguration.class);
}
