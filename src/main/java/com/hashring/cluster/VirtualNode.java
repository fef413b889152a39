package com.hashring.cluster;

import java.util.Objects;

/**
 * Represents a virtual node in the consistent hash ring.
 * Multiple virtual nodes map to a single real node for better distribution.
 */
public class VirtualNode {

    private final String node;
    private final int replicaIndex;
    private final long position;

    /**
     * Create a virtual node.
     *
     * @param node         the node identifier this virtual node represents
     * @param replicaIndex the index of this virtual node (0 to R-1)
     * @param position     the unsigned 32-bit position on the ring
     */
    public VirtualNode(String node, int replicaIndex, long position) {
        this.node = Objects.requireNonNull(node, "node");
        this.replicaIndex = replicaIndex;
        this.position = position;
    }

    /**
     * The string hashed to place a replica: the replica index followed by the node identifier.
     */
    public static String hashKey(String node, int replicaIndex) {
        return replicaIndex + node;
    }

    public String getNode() {
        return node;
    }

    public int getReplicaIndex() {
        return replicaIndex;
    }

    public long getPosition() {
        return position;
    }

    public String getHashKey() {
        return hashKey(node, replicaIndex);
    }

    /**
     * Check if this virtual node belongs to the given node.
     */
    public boolean belongsTo(String other) {
        return node.equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VirtualNode that = (VirtualNode) o;
        return replicaIndex == that.replicaIndex &&
               position == that.position &&
               node.equals(that.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, replicaIndex, position);
    }

    @Override
    public String toString() {
        return "VirtualNode{" +
               "node='" + node + '\'' +
               ", replicaIndex=" + replicaIndex +
               ", position=" + position +
               '}';
    }
}
