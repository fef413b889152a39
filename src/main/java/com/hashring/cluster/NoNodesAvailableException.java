package com.hashring.cluster;

/**
 * Thrown when a key lookup is made against a ring that has no nodes.
 */
public class NoNodesAvailableException extends RuntimeException {

    private final String key;

    public NoNodesAvailableException(String key) {
        super("No nodes available on the ring for key: " + key);
        this.key = key;
    }

    /**
     * The key whose lookup failed.
     */
    public String getKey() {
        return key;
    }
}
