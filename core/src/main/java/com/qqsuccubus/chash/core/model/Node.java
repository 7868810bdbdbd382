package com.qqsuccubus.chash.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable real node placed on the hash ring.
 * <p>
 * Only {@link #key} takes part in hashing and ordering. The {@link #value} is an
 * opaque payload returned with lookups (e.g. a server address).
 * </p>
 *
 * @param <K> Key type, compared when breaking hash ties
 * @param <V> Payload type
 */
@Value
@Builder(toBuilder = true)
@With
public class Node<K extends Comparable<? super K>, V> {
    /**
     * Unique identifier of this node within a ring.
     */
    K key;

    /**
     * Payload associated with the node, may be null.
     */
    V value;

    /**
     * Number of virtual nodes (replicas) this node occupies. Higher quantity = larger share of the key space.
     */
    int quantity;

    /**
     * Creates a node without payload occupying a single virtual node.
     */
    public static <K extends Comparable<? super K>, V> Node<K, V> of(K key) {
        return new Node<>(key, null, 1);
    }

    /**
     * Creates a node with a payload and an explicit replica count.
     */
    public static <K extends Comparable<? super K>, V> Node<K, V> of(K key, V value, int quantity) {
        return new Node<>(key, value, quantity);
    }
}
