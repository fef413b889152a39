package com.hashring.util;

import java.nio.charset.StandardCharsets;

/**
 * Hash strategy used to place virtual nodes and keys on the ring.
 * The returned int is read as an unsigned 32-bit value.
 * Implementations must be deterministic and safe to call from many threads.
 */
@FunctionalInterface
public interface HashFunction {

    /**
     * Hash the given bytes.
     *
     * @param data the bytes to hash
     * @return 32-bit hash, to be interpreted as unsigned
     */
    int hash(byte[] data);

    /**
     * Hash the UTF-8 bytes of a string to a ring position in [0, 2^32).
     *
     * @param key the string to hash
     * @return unsigned ring position
     */
    default long position(String key) {
        return Integer.toUnsignedLong(hash(key.getBytes(StandardCharsets.UTF_8)));
    }
}
