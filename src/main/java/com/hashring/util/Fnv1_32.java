package com.hashring.util;

/**
 * 32-bit FNV-1 hash (multiply before xor).
 * Keys that differ only in their last bytes land close together with this variant,
 * so prefer {@link Fnv1a32} unless positions must match an existing FNV-1 ring.
 */
public final class Fnv1_32 implements HashFunction {

    @Override
    public int hash(byte[] data) {
        int h = Fnv1a32.OFFSET_BASIS;
        for (byte b : data) {
            h *= Fnv1a32.PRIME;
            h ^= (b & 0xff);
        }
        return h;
    }

    @Override
    public String toString() {
        return "fnv1";
    }
}
