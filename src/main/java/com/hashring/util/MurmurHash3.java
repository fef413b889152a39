package com.hashring.util;

/**
 * MurmurHash3 x86 32-bit implementation.
 * Fast, non-cryptographic hash with excellent distribution.
 * Usable as a ring hash in place of the FNV default.
 */
public final class MurmurHash3 implements HashFunction {

    private static final int C1 = 0xcc9e2d51;
    private static final int C2 = 0x1b873593;
    public static final int DEFAULT_SEED = 0x9747b28c;

    private final int seed;

    public MurmurHash3() {
        this(DEFAULT_SEED);
    }

    /**
     * @param seed the seed value used for every hash computed by this instance
     */
    public MurmurHash3(int seed) {
        this.seed = seed;
    }

    @Override
    public int hash(byte[] data) {
        return hash32(data, 0, data.length, seed);
    }

    /**
     * Generate a 32-bit hash from a byte array with custom seed.
     *
     * @param data the data to hash
     * @param seed the seed value
     * @return 32-bit hash value
     */
    public static int hash32(byte[] data, int seed) {
        return hash32(data, 0, data.length, seed);
    }

    /**
     * Generate a 32-bit hash from a portion of a byte array.
     *
     * @param data   the data to hash
     * @param offset starting position in the array
     * @param length number of bytes to hash
     * @param seed   the seed value
     * @return 32-bit hash value
     */
    public static int hash32(byte[] data, int offset, int length, int seed) {
        int h1 = seed;
        int nblocks = length / 4;

        // Body
        for (int i = 0; i < nblocks; i++) {
            int k1 = getIntLittleEndian(data, offset + (i * 4));

            k1 *= C1;
            k1 = Integer.rotateLeft(k1, 15);
            k1 *= C2;

            h1 ^= k1;
            h1 = Integer.rotateLeft(h1, 13);
            h1 = h1 * 5 + 0xe6546b64;
        }

        // Tail
        int tailIdx = offset + (nblocks * 4);
        int k1 = 0;

        switch (length & 3) {
            case 3: k1 ^= (data[tailIdx + 2] & 0xff) << 16;
            case 2: k1 ^= (data[tailIdx + 1] & 0xff) << 8;
            case 1: k1 ^= (data[tailIdx] & 0xff);
                    k1 *= C1;
                    k1 = Integer.rotateLeft(k1, 15);
                    k1 *= C2;
                    h1 ^= k1;
        }

        // Finalization
        h1 ^= length;
        return fmix32(h1);
    }

    private static int fmix32(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private static int getIntLittleEndian(byte[] data, int offset) {
        return (data[offset] & 0xff)
             | ((data[offset + 1] & 0xff) << 8)
             | ((data[offset + 2] & 0xff) << 16)
             | ((data[offset + 3] & 0xff) << 24);
    }

    @Override
    public String toString() {
        return "murmur3";
    }
}
