package com.hashring.cluster;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps string keys to a dynamic set of named nodes.
 * Adding or removing a node only remaps keys adjacent to that node's positions.
 * All implementations must be thread-safe.
 */
public interface HashRing {

    /**
     * Add a node to the ring. Adding a node that is already a member is a no-op.
     *
     * @param node the node identifier
     */
    void add(String node);

    /**
     * Remove a node from the ring. Removing a node that is not a member is a no-op.
     *
     * @param node the node identifier
     */
    void delete(String node);

    /**
     * Get the node owning a key: the owner of the first position at or after the key's hash,
     * wrapping to the smallest position.
     *
     * @param key the key to look up
     * @return the owning node identifier
     * @throws NoNodesAvailableException if the ring is empty
     */
    String get(String key);

    /**
     * Get up to {@code count} distinct nodes for a key, walking clockwise from its owner.
     *
     * @param key   the key to look up
     * @param count maximum number of nodes to return
     * @return distinct nodes in ring order, the owner first
     * @throws NoNodesAvailableException if the ring is empty
     */
    List<String> getNodes(String key, int count);

    /**
     * Snapshot of the current members, taken at a single point in time.
     *
     * @return unmodifiable set of node identifiers
     */
    Set<String> members();

    boolean contains(String node);

    /**
     * Number of member nodes.
     */
    int size();

    /**
     * Number of occupied ring positions.
     */
    int virtualNodeCount();

    boolean isEmpty();

    /**
     * Share of the ring space owned by each member, in percent.
     */
    Map<String, Double> getDistribution();

    /**
     * Remove all nodes from the ring.
     */
    void clear();
}
