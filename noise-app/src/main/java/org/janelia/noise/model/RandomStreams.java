package org.janelia.noise.model;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Derives independent, reproducible random number streams from a caller supplied seed.
 *
 * Streams only depend on the seed and the band (or key) they are derived for,
 * so results never depend on thread scheduling or on how many other streams were created.
 */
public class RandomStreams {

    /**
     * @return new generator for the specified band of an image processed with the specified seed.
     */
    public static Random forBand(final long seed,
                                 final int band) {
        return new Random(mix(seed, band));
    }

    /**
     * @return seed derived from a base seed and an ordered list of keys
     *         (e.g. image name, noise type and level).
     */
    public static long deriveSeed(final long baseSeed,
                                  final Object... keys) {
        long seed = baseSeed;
        for (final Object key : keys) {
            seed = mix(seed, hash(String.valueOf(key)));
        }
        return seed;
    }

    /**
     * Combines two values with a SplitMix64 finalizer.
     */
    public static long mix(final long seed,
                           final long value) {
        long z = seed + 0x9E3779B97F4A7C15L * (value + 1);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    // 64-bit FNV-1a
    private static long hash(final String key) {
        long hash = 0xCBF29CE484222325L;
        for (final byte b : key.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= 0x100000001B3L;
        }
        return hash;
    }

}
