package org.janelia.noise.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseType;

/**
 * Parameters for selecting noise types, levels and configuration shared by the batch clients.
 */
public class NoiseSelectionParameters
        implements Serializable {

    @Parameter(
            names = "--noiseType",
            description = "Noise type to include (e.g. gaussian, salt_pepper).  Omit to include all types.",
            variableArity = true)
    public List<String> noiseTypeNames;

    @Parameter(
            names = "--levels",
            description = "Number of degradation levels per noise type (default is the configured default_levels)")
    public Integer levels;

    @Parameter(
            names = "--noiseConfig",
            description = "JSON file with noise type parameter ranges (omit to use built-in defaults)")
    public String noiseConfigPath;

    public NoiseSelectionParameters() {
        this.noiseTypeNames = null;
        this.levels = null;
        this.noiseConfigPath = null;
    }

    /**
     * @return selected noise types in declaration order.
     *
     * @throws IllegalArgumentException
     *   if any of the selected names is unknown.
     */
    public List<NoiseType> getNoiseTypes()
            throws IllegalArgumentException {
        final List<NoiseType> types;
        if ((noiseTypeNames == null) || noiseTypeNames.isEmpty()) {
            types = Arrays.asList(NoiseType.values());
        } else {
            types = new ArrayList<>();
            for (final NoiseType type : NoiseType.values()) {
                if (containsName(type)) {
                    types.add(type);
                }
            }
            for (final String name : noiseTypeNames) {
                NoiseType.fromName(name);
            }
        }
        return types;
    }

    /**
     * @return configuration loaded from the specified file or built-in defaults.
     */
    public NoiseConfiguration getConfiguration() {
        return NoiseConfiguration.loadConfiguredInstance(noiseConfigPath == null ? null : new File(noiseConfigPath));
    }

    /**
     * @return the explicitly specified number of levels or the configured default.
     *
     * @throws IllegalArgumentException
     *   if the specified number of levels is less than 1.
     */
    public int getLevels(final NoiseConfiguration configuration)
            throws IllegalArgumentException {
        final int levelCount = (levels == null) ? configuration.getDefaultLevels() : levels;
        if (levelCount < 1) {
            throw new IllegalArgumentException("--levels must be at least 1");
        }
        return levelCount;
    }

    private boolean containsName(final NoiseType type) {
        for (final String name : noiseTypeNames) {
            if (type.getName().equalsIgnoreCase(name.trim())) {
                return true;
            }
        }
        return false;
    }

}
