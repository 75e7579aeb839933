package org.janelia.noise.level;

/**
 * Thrown when a degradation level lies outside [1, maxLevel] or when maxLevel itself is invalid.
 */
public class InvalidLevelException
        extends IllegalArgumentException {

    public InvalidLevelException(final int level,
                                 final int maxLevel) {
        super("level " + level + " is invalid for maxLevel " + maxLevel +
              ", levels must be between 1 and a maxLevel of at least 1");
    }
}
