package com.qqsuccubus.chash.core.ring;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.UnsignedLong;
import com.qqsuccubus.chash.core.error.EmptyRingException;
import com.qqsuccubus.chash.core.error.RingBuildException;
import com.qqsuccubus.chash.core.hash.Hashers;
import com.qqsuccubus.chash.core.hash.KeyEncoder;
import com.qqsuccubus.chash.core.hash.RingHasher;
import com.qqsuccubus.chash.core.model.Node;
import com.qqsuccubus.chash.core.model.VirtualNode;
import lombok.Builder;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable consistent hash ring built from a fixed node set.
 * <p>
 * <b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Every node occupies {@code quantity} virtual nodes; more replicas smooth the load.</li>
 *   <li>Removing a node only reassigns the keys its own virtual nodes owned.</li>
 *   <li>Deterministic key → node mapping for a given hasher and node set.</li>
 * </ul>
 * </p>
 * <p>
 * Virtual nodes are kept in a sorted array ordered by unsigned position, then node key,
 * then replica index, so lookups are a binary search and equal positions resolve the
 * same way on every run.
 * </p>
 * <p>
 * <b>Thread-safety:</b> Immutable after construction; safe for concurrent reads.
 * Membership changes mean building a new ring.
 * </p>
 *
 * @param <K> Node key type
 * @param <V> Node payload type
 */
public final class StaticHashRing<K extends Comparable<? super K>, V> {
    private static final Logger log = LoggerFactory.getLogger(StaticHashRing.class);

    private static final double KEYSPACE_SIZE = 0x1p64;

    private final RingHasher hasher;
    private final ImmutableList<Node<K, V>> nodes;
    private final ImmutableList<VirtualNode<K, V>> ring;
    private final long[] positions; // ring[i].position, for the binary search

    private StaticHashRing(RingHasher hasher, ImmutableList<Node<K, V>> nodes, ImmutableList<VirtualNode<K, V>> ring) {
        this.hasher = hasher;
        this.nodes = nodes;
        this.ring = ring;
        this.positions = new long[ring.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = ring.get(i).getPosition();
        }
    }

    /**
     * Builds a ring with the default hasher and UTF-8 encoded keys, {@code replicas} virtual nodes each.
     *
     * @param keys     Node keys, duplicates are ignored
     * @param replicas Virtual nodes per key, must be >= 1
     * @return Immutable ring
     * @throws RingBuildException if {@code keys} is empty or {@code replicas < 1}
     */
    public static <K extends Comparable<? super K>, V> StaticHashRing<K, V> build(List<K> keys, int replicas) {
        return build(Hashers.murmur3(), keys, replicas);
    }

    /**
     * Builds a ring with an injected hasher, {@code replicas} virtual nodes per key.
     *
     * @param hasher   Hash capability used for both placement and lookup
     * @param keys     Node keys, duplicates are ignored
     * @param replicas Virtual nodes per key, must be >= 1
     * @return Immutable ring
     * @throws RingBuildException if {@code keys} is empty or {@code replicas < 1}
     */
    public static <K extends Comparable<? super K>, V> StaticHashRing<K, V> build(RingHasher hasher, List<K> keys, int replicas) {
        Objects.requireNonNull(hasher, "hasher");
        Objects.requireNonNull(keys, "keys");
        if (replicas < 1) {
            throw RingBuildException.invalidReplicaCount(keys.isEmpty() ? "<none>" : keys.get(0), replicas);
        }
        List<Node<K, V>> nodes = new ArrayList<>(keys.size());
        for (K key : keys) {
            nodes.add(Node.of(key, null, replicas));
        }
        return create(hasher, null, null, nodes);
    }

    /**
     * Creates a ring without virtual nodes. Every lookup on it fails with {@link EmptyRingException}.
     * <p>
     * Useful as the initial value of a reference that is later swapped for a built ring.
     * </p>
     */
    public static <K extends Comparable<? super K>, V> StaticHashRing<K, V> empty(RingHasher hasher) {
        return new StaticHashRing<>(Objects.requireNonNull(hasher, "hasher"), ImmutableList.of(), ImmutableList.of());
    }

    /**
     * Full construction entry point, exposed through {@code StaticHashRing.builder()}.
     *
     * @param hasher          Hash capability, defaults to {@link Hashers#murmur3()}
     * @param keyEncoder      Node key encoder, defaults to {@link KeyEncoder#utf8()}
     * @param collisionPolicy Collision handling, defaults to {@link CollisionPolicy#TIE_BREAK}
     * @param nodes           Nodes with their replica counts; later duplicates of a key are ignored
     * @return Immutable ring
     */
    @Builder
    private static <K extends Comparable<? super K>, V> StaticHashRing<K, V> create(
            RingHasher hasher,
            KeyEncoder<? super K> keyEncoder,
            CollisionPolicy collisionPolicy,
            @Singular List<Node<K, V>> nodes
    ) {
        RingHasher effectiveHasher = hasher != null ? hasher : Hashers.murmur3();
        KeyEncoder<? super K> encoder = keyEncoder != null ? keyEncoder : KeyEncoder.utf8();
        CollisionPolicy policy = collisionPolicy != null ? collisionPolicy : CollisionPolicy.TIE_BREAK;

        ImmutableList<Node<K, V>> distinct = distinctNodes(nodes);
        if (distinct.isEmpty()) {
            throw RingBuildException.emptyNodeList();
        }

        long total = 0;
        for (Node<K, V> node : distinct) {
            if (node.getQuantity() < 1) {
                throw RingBuildException.invalidReplicaCount(node.getKey(), node.getQuantity());
            }
            total += node.getQuantity();
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many virtual nodes: " + total);
        }

        List<VirtualNode<K, V>> vnodes = new ArrayList<>((int) total);
        for (Node<K, V> node : distinct) {
            byte[] keyBytes = encoder.encode(node.getKey());
            for (int i = 0; i < node.getQuantity(); i++) {
                long position = position(effectiveHasher, keyBytes, i);
                vnodes.add(new VirtualNode<>(position, node, i));
            }
        }
        vnodes.sort(ringOrder());

        int ties = 0;
        for (int i = 1; i < vnodes.size(); i++) {
            VirtualNode<K, V> previous = vnodes.get(i - 1);
            VirtualNode<K, V> current = vnodes.get(i);
            if (previous.getPosition() == current.getPosition()) {
                if (policy == CollisionPolicy.REJECT) {
                    throw RingBuildException.hashCollision(current.getPosition(), previous, current);
                }
                ties++;
            }
        }
        if (ties > 0) {
            log.debug("Broke {} position ties by (key, replica index)", ties);
        }

        log.debug("Created ring with {} vnodes from {} physical nodes", vnodes.size(), distinct.size());

        return new StaticHashRing<>(effectiveHasher, distinct, ImmutableList.copyOf(vnodes));
    }

    private static <K extends Comparable<? super K>, V> ImmutableList<Node<K, V>> distinctNodes(List<Node<K, V>> nodes) {
        Map<K, Node<K, V>> byKey = new LinkedHashMap<>();
        for (Node<K, V> node : nodes) {
            Objects.requireNonNull(node.getKey(), "node key");
            if (byKey.putIfAbsent(node.getKey(), node) != null) {
                log.debug("Ignoring duplicate node {}", node.getKey());
            }
        }
        return ImmutableList.copyOf(byKey.values());
    }

    private static long position(RingHasher hasher, byte[] keyBytes, int replicaIndex) {
        byte[] suffix = ("#" + replicaIndex).getBytes(StandardCharsets.UTF_8);
        return hasher.hash(Bytes.concat(keyBytes, suffix));
    }

    private static <K extends Comparable<? super K>, V> Comparator<VirtualNode<K, V>> ringOrder() {
        return (a, b) -> {
            int cmp = Long.compareUnsigned(a.getPosition(), b.getPosition());
            if (cmp != 0) {
                return cmp;
            }
            cmp = a.getOwner().compareTo(b.getOwner());
            if (cmp != 0) {
                return cmp;
            }
            return Integer.compare(a.getReplicaIndex(), b.getReplicaIndex());
        };
    }

    /**
     * Finds the node owning a key.
     *
     * @param key Key bytes (typically a request or record id)
     * @return Key of the successor node
     * @throws EmptyRingException if the ring has no virtual nodes
     */
    public K lookup(byte[] key) {
        return locate(key).getKey();
    }

    /**
     * Finds the node owning the UTF-8 encoding of {@code key}.
     */
    public K lookup(String key) {
        return lookup(Objects.requireNonNull(key, "key").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Finds the successor node for a given key.
     * <p>
     * The successor is the first vnode whose position is ≥ key hash (wrapping around if needed).
     * </p>
     *
     * @param key Key bytes
     * @return Owning node, including its payload
     * @throws EmptyRingException if the ring has no virtual nodes
     */
    public Node<K, V> locate(byte[] key) {
        return ring.get(successorIndex(key)).getNode();
    }

    public Node<K, V> locate(String key) {
        return locate(Objects.requireNonNull(key, "key").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Lazily walks the ring clockwise from the key's successor, yielding every real node once.
     * <p>
     * The first element equals {@link #locate(byte[])}; the following ones are the natural
     * replica placement / failover order.
     * </p>
     *
     * @param key Key bytes
     * @return Iterator over distinct nodes in preference order
     * @throws EmptyRingException if the ring has no virtual nodes
     */
    public Iterator<Node<K, V>> candidates(byte[] key) {
        return new Candidates<>(ring, nodes.size(), successorIndex(key));
    }

    /**
     * Returns up to {@code limit} distinct nodes in preference order.
     *
     * @param key   Key bytes
     * @param limit Maximum number of nodes, must be >= 0
     * @return Immutable list with {@code min(limit, nodes().size())} nodes
     */
    public List<Node<K, V>> candidates(byte[] key, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return ImmutableList.copyOf(Iterators.limit(candidates(key), limit));
    }

    private int successorIndex(byte[] key) {
        Objects.requireNonNull(key, "key");
        if (positions.length == 0) {
            throw new EmptyRingException();
        }
        long hash = hasher.hash(key);

        // lower bound in unsigned order: first position >= hash
        int low = 0;
        int high = positions.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (Long.compareUnsigned(positions[mid], hash) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }

        // Wrap around to the first vnode
        return low == positions.length ? 0 : low;
    }

    /**
     * Computes the share of the 64-bit key space owned by every node.
     * <p>
     * A vnode owns the arc from its predecessor (exclusive) to itself (inclusive).
     * </p>
     *
     * @return node key → fraction in [0, 1]; fractions sum to 1 for a non-empty ring
     */
    public Map<K, Double> ownership() {
        int n = positions.length;
        if (n == 0) {
            return ImmutableMap.of();
        }
        Map<K, Double> shares = new HashMap<>();
        for (Node<K, V> node : nodes) {
            shares.put(node.getKey(), 0.0);
        }
        if (positions[0] == positions[n - 1]) {
            // All vnodes share one position; the first one owns the whole ring
            shares.put(ring.get(0).getOwner(), 1.0);
        } else {
            for (int i = 0; i < n; i++) {
                long previous = positions[(i + n - 1) % n];
                long arc = positions[i] - previous; // modulo 2^64
                double share = UnsignedLong.fromLongBits(arc).doubleValue() / KEYSPACE_SIZE;
                shares.merge(ring.get(i).getOwner(), share, Double::sum);
            }
        }
        return Collections.unmodifiableMap(shares);
    }

    /**
     * @return Number of virtual nodes in the ring
     */
    public int size() {
        return ring.size();
    }

    public boolean isEmpty() {
        return ring.isEmpty();
    }

    /**
     * @return Distinct real nodes, in the order they were accepted
     */
    public List<Node<K, V>> nodes() {
        return nodes;
    }

    /**
     * @return Virtual nodes sorted by ring order
     */
    public List<VirtualNode<K, V>> virtualNodes() {
        return ring;
    }

    public RingHasher getHasher() {
        return hasher;
    }

    @Override
    public String toString() {
        return "StaticHashRing(nodes=" + nodes.size() + ", vnodes=" + ring.size() + ")";
    }
}
