package com.hashring.util;

import java.util.Locale;

/**
 * Resolves hash functions by their configuration name.
 */
public final class HashFunctions {

    public static final String FNV1A = "fnv1a";
    public static final String FNV1 = "fnv1";
    public static final String MURMUR3 = "murmur3";

    private HashFunctions() {
        // Utility class
    }

    /**
     * Look up a hash function by name ({@code fnv1a}, {@code fnv1} or {@code murmur3}).
     *
     * @param name case-insensitive hash name
     * @return a new hash function instance
     * @throws IllegalArgumentException if the name is unknown
     */
    public static HashFunction forName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Hash function name must not be empty");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case FNV1A:
                return new Fnv1a32();
            case FNV1:
                return new Fnv1_32();
            case MURMUR3:
                return new MurmurHash3();
            default:
                throw new IllegalArgumentException("Unknown hash function: " + name);
        }
    }
}
