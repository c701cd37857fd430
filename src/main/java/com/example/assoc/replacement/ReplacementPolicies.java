package com.example.assoc.replacement;

import com.example.assoc.core.CacheConfigurationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds replacement policies from their configured names.
 */
public final class ReplacementPolicies {

    public static final long DEFAULT_SEED = 42L;

    /** Every name {@link #create(String)} accepts. */
    public static final List<String> NAMES = Collections.unmodifiableList(
        Arrays.asList("lru", "mru", "fifo", "random", "second-chance"));

    private ReplacementPolicies() {
    }

    public static ReplacementPolicy create(String name) {
        return create(name, DEFAULT_SEED);
    }

    public static ReplacementPolicy create(String name, long seed) {
        if (name == null) {
            throw new CacheConfigurationException("Replacement policy name must not be null");
        }
        switch (name.trim().toLowerCase()) {
            case "lru":
                return new LruReplacementPolicy();
            case "mru":
                return new MruReplacementPolicy();
            case "fifo":
                return new FifoReplacementPolicy();
            case "random":
                return new RandomReplacementPolicy(seed);
            case "second-chance":
                return new SecondChanceReplacementPolicy();
            default:
                throw new CacheConfigurationException("Unknown replacement policy: " + name);
        }
    }
}
