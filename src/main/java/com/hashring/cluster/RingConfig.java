package com.hashring.cluster;

import com.hashring.util.Fnv1a32;
import com.hashring.util.HashFunction;
import com.hashring.util.HashFunctions;

import java.util.Objects;

/**
 * Configuration for a consistent hash ring.
 */
public class RingConfig {

    public static final int DEFAULT_REPLICAS = 20;
    public static final String DEFAULT_NAME = "default";

    static final String REPLICAS_ENV = "HASHRING_REPLICAS";
    static final String REPLICAS_PROPERTY = "hashring.replicas";
    static final String HASH_ENV = "HASHRING_HASH";
    static final String HASH_PROPERTY = "hashring.hash";

    private String name = DEFAULT_NAME;
    private int replicas = DEFAULT_REPLICAS;
    private HashFunction hashFunction = new Fnv1a32();

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a config from the environment, falling back to system properties.
     * {@code HASHRING_REPLICAS} / {@code hashring.replicas} set the replica count,
     * {@code HASHRING_HASH} / {@code hashring.hash} name the hash function.
     *
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static RingConfig fromEnvironment() {
        RingConfig config = new RingConfig();

        String replicas = lookup(REPLICAS_ENV, REPLICAS_PROPERTY);
        if (replicas != null) {
            try {
                config.setReplicas(Integer.parseInt(replicas.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid replica count: " + replicas, e);
            }
        }

        String hash = lookup(HASH_ENV, HASH_PROPERTY);
        if (hash != null) {
            config.setHashFunction(HashFunctions.forName(hash));
        }
        return config;
    }

    private static String lookup(String envName, String propertyName) {
        String value = System.getenv(envName);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propertyName);
        }
        return (value == null || value.isEmpty()) ? null : value;
    }

    public String getName() {
        return name;
    }

    /**
     * Name of the ring, used in log lines and as the {@code ring} tag on its gauges.
     */
    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.name = name;
    }

    public int getReplicas() {
        return replicas;
    }

    public void setReplicas(int replicas) {
        if (replicas <= 0) {
            throw new IllegalArgumentException("replicas must be positive, got: " + replicas);
        }
        this.replicas = replicas;
    }

    public HashFunction getHashFunction() {
        return hashFunction;
    }

    public void setHashFunction(HashFunction hashFunction) {
        this.hashFunction = Objects.requireNonNull(hashFunction, "hashFunction");
    }

    @Override
    public String toString() {
        return "RingConfig{" +
               "name='" + name + '\'' +
               ", replicas=" + replicas +
               ", hashFunction=" + hashFunction +
               '}';
    }

    /**
     * Builder for RingConfig.
     */
    public static class Builder {
        private final RingConfig config = new RingConfig();

        public Builder name(String name) {
            config.setName(name);
            return this;
        }

        public Builder replicas(int replicas) {
            config.setReplicas(replicas);
            return this;
        }

        public Builder hashFunction(HashFunction hashFunction) {
            config.setHashFunction(hashFunction);
            return this;
        }

        public Builder hashFunction(String name) {
            config.setHashFunction(HashFunctions.forName(name));
            return this;
        }

        public RingConfig build() {
            return config;
        }
    }
}
