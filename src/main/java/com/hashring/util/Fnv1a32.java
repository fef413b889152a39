package com.hashring.util;

/**
 * 32-bit FNV-1a hash. Default ring hash: fast, non-cryptographic, order-sensitive.
 */
public final class Fnv1a32 implements HashFunction {

    static final int OFFSET_BASIS = 0x811c9dc5;
    static final int PRIME = 0x01000193;

    @Override
    public int hash(byte[] data) {
        int h = OFFSET_BASIS;
        for (byte b : data) {
            h ^= (b & 0xff);
            h *= PRIME;
        }
        return h;
    }

    @Override
    public String toString() {
        return "fnv1a";
    }
}
