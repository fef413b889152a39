package com.hashring.cluster;

import com.hashring.util.HashFunction;
import com.hashring.util.RingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Consistent hash ring implementation with virtual nodes.
 * Provides O(log n) key-to-node lookups and minimal key redistribution
 * when nodes are added or removed.
 * <p>
 * Membership, the position map and the sorted position index form one state,
 * guarded as a unit by a single read/write lock. Lookups share the read lock;
 * mutations hold the write lock for the whole update.
 */
public class ConsistentHashRing implements HashRing {

    private static final Logger logger = LoggerFactory.getLogger(ConsistentHashRing.class);

    private static final double RING_SIZE = 4294967296.0; // 2^32

    private final String name;
    private final int replicas;
    private final HashFunction hashFunction;
    private final RingMetrics metrics;

    // Track member nodes
    private final Set<String> members;

    // The hash ring: position -> virtual node
    private final TreeMap<Long, VirtualNode> positionToNode;

    // Entries that lost a position to a later colliding node, most recent first
    private final Map<Long, Deque<VirtualNode>> shadowed;

    // Ascending key set of positionToNode, rebuilt on every mutation
    private long[] positions;

    private final ReadWriteLock lock;

    /**
     * Create a ring with default replicas and hash function.
     */
    public ConsistentHashRing() {
        this(RingConfig.builder().build());
    }

    /**
     * Create a ring from a configuration. Later changes to the config do not affect the ring.
     *
     * @param config ring configuration
     */
    public ConsistentHashRing(RingConfig config) {
        this(config, new RingMetrics());
    }

    /**
     * Create a ring reporting to the given metrics.
     *
     * @param config  ring configuration
     * @param metrics metrics to record operations into
     */
    public ConsistentHashRing(RingConfig config, RingMetrics metrics) {
        Objects.requireNonNull(config, "config");
        if (config.getReplicas() <= 0) {
            throw new IllegalArgumentException("replicas must be positive, got: " + config.getReplicas());
        }
        this.name = Objects.requireNonNull(config.getName(), "name");
        this.replicas = config.getReplicas();
        this.hashFunction = Objects.requireNonNull(config.getHashFunction(), "hashFunction");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.members = new HashSet<>();
        this.positionToNode = new TreeMap<>();
        this.shadowed = new HashMap<>();
        this.positions = new long[0];
        this.lock = new ReentrantReadWriteLock();

        metrics.bindRing(name, this, ConsistentHashRing::size, ConsistentHashRing::virtualNodeCount);
    }

    /**
     * Create a ring pre-seeded with nodes.
     *
     * @param config ring configuration
     * @param nodes  initial members
     * @return the populated ring
     */
    public static ConsistentHashRing withNodes(RingConfig config, Collection<String> nodes) {
        ConsistentHashRing ring = new ConsistentHashRing(config);
        for (String node : nodes) {
            ring.add(node);
        }
        return ring;
    }

    @Override
    public void add(String node) {
        Objects.requireNonNull(node, "node");
        // Hash outside the lock so a failing hash function leaves the ring untouched
        List<VirtualNode> vnodes = virtualNodesOf(node);
        long start = System.nanoTime();

        lock.writeLock().lock();
        try {
            if (members.contains(node)) {
                // Replica positions are deterministic, so the ring already holds exactly these entries
                logger.debug("Node {} already in ring", node);
                return;
            }

            for (VirtualNode vnode : vnodes) {
                VirtualNode previous = positionToNode.put(vnode.getPosition(), vnode);
                if (previous != null && !previous.belongsTo(node)) {
                    shadowed.computeIfAbsent(vnode.getPosition(), p -> new ArrayDeque<>()).push(previous);
                    logger.debug("Position {} of node {} shadows node {}",
                        vnode.getPosition(), node, previous.getNode());
                }
            }
            members.add(node);
            rebuildPositions();

            logger.info("Added node {} to ring {} with {} virtual nodes", node, name, replicas);
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordAdd(System.nanoTime() - start);
    }

    @Override
    public void delete(String node) {
        Objects.requireNonNull(node, "node");
        List<VirtualNode> vnodes = virtualNodesOf(node);
        long start = System.nanoTime();

        lock.writeLock().lock();
        try {
            if (!members.remove(node)) {
                logger.debug("Node {} not in ring", node);
                return;
            }

            for (VirtualNode vnode : vnodes) {
                releasePosition(vnode.getPosition(), node);
            }
            rebuildPositions();

            logger.info("Removed node {} from ring {}", node, name);
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordDelete(System.nanoTime() - start);
    }

    @Override
    public String get(String key) {
        Objects.requireNonNull(key, "key");
        long hash = hashFunction.position(key);

        lock.readLock().lock();
        try {
            if (positions.length == 0) {
                metrics.recordLookupFailure();
                throw new NoNodesAvailableException(key);
            }
            metrics.recordGet();
            return positionToNode.get(positions[successorIndex(hash)]).getNode();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> getNodes(String key, int count) {
        Objects.requireNonNull(key, "key");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        long hash = hashFunction.position(key);

        lock.readLock().lock();
        try {
            if (positions.length == 0) {
                metrics.recordLookupFailure();
                throw new NoNodesAvailableException(key);
            }
            metrics.recordGet();

            int wanted = Math.min(count, members.size());
            Set<String> result = new LinkedHashSet<>();
            int start = successorIndex(hash);

            // Walk clockwise, wrapping past the highest position
            for (int i = 0; i < positions.length && result.size() < wanted; i++) {
                long position = positions[(start + i) % positions.length];
                result.add(positionToNode.get(position).getNode());
            }
            return new ArrayList<>(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> members() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new HashSet<>(members));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String node) {
        lock.readLock().lock();
        try {
            return members.contains(node);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return members.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int virtualNodeCount() {
        lock.readLock().lock();
        try {
            return positions.length;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Each node owns the arc from its predecessor position (exclusive) to its own position (inclusive).
     * The first position also owns the wrap-around arc past the last one.
     */
    @Override
    public Map<String, Double> getDistribution() {
        lock.readLock().lock();
        try {
            Map<String, Double> distribution = new HashMap<>();
            for (String node : members) {
                distribution.put(node, 0.0);
            }
            if (positions.length == 0) {
                return distribution;
            }

            long previous = positions[positions.length - 1] - (1L << 32);
            for (long position : positions) {
                String owner = positionToNode.get(position).getNode();
                double share = ((position - previous) * 100.0) / RING_SIZE;
                distribution.merge(owner, share, Double::sum);
                previous = position;
            }
            return distribution;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            members.clear();
            positionToNode.clear();
            shadowed.clear();
            positions = new long[0];
            logger.info("Cleared hash ring {}", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getReplicas() {
        return replicas;
    }

    public HashFunction getHashFunction() {
        return hashFunction;
    }

    /**
     * Get statistics about the hash ring.
     */
    public String getStats() {
        Map<String, Double> dist = getDistribution();
        StringBuilder sb = new StringBuilder();
        sb.append("HashRing Stats (").append(name).append("):\n");
        sb.append("  Nodes: ").append(dist.size()).append("\n");
        sb.append("  Virtual nodes: ").append(virtualNodeCount()).append("\n");
        sb.append("  Distribution:\n");
        for (Map.Entry<String, Double> entry : new TreeMap<>(dist).entrySet()) {
            sb.append("    ").append(entry.getKey())
              .append(": ").append(String.format("%.2f%%", entry.getValue()))
              .append("\n");
        }
        return sb.toString();
    }

    private List<VirtualNode> virtualNodesOf(String node) {
        List<VirtualNode> vnodes = new ArrayList<>(replicas);
        for (int i = 0; i < replicas; i++) {
            vnodes.add(new VirtualNode(node, i, hashFunction.position(VirtualNode.hashKey(node, i))));
        }
        return vnodes;
    }

    /**
     * Drop a node's claim on a position. If the node owned it, the most recently
     * shadowed entry of another node takes the position back.
     * Caller holds the write lock.
     */
    private void releasePosition(long position, String node) {
        Deque<VirtualNode> losers = shadowed.get(position);
        if (losers != null) {
            losers.removeIf(vnode -> vnode.belongsTo(node));
        }

        VirtualNode current = positionToNode.get(position);
        if (current != null && current.belongsTo(node)) {
            VirtualNode heir = (losers == null) ? null : losers.poll();
            if (heir == null) {
                positionToNode.remove(position);
            } else {
                positionToNode.put(position, heir);
                logger.debug("Position {} returned to node {}", position, heir.getNode());
            }
        }

        if (losers != null && losers.isEmpty()) {
            shadowed.remove(position);
        }
    }

    // Caller holds the write lock
    private void rebuildPositions() {
        long[] rebuilt = new long[positionToNode.size()];
        int i = 0;
        for (Long position : positionToNode.keySet()) {
            rebuilt[i++] = position;
        }
        positions = rebuilt;
    }

    /**
     * Index of the first position at or after the hash, wrapping to 0 past the end.
     * Caller holds a lock.
     */
    private int successorIndex(long hash) {
        int index = Arrays.binarySearch(positions, hash);
        if (index >= 0) {
            return index;
        }
        int insertionPoint = -index - 1;
        return insertionPoint == positions.length ? 0 : insertionPoint;
    }
}
