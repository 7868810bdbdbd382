package com.qqsuccubus.chash.core.model;

import lombok.Value;

/**
 * One replica of a {@link Node} on the ring: (position, owner, replica index).
 * <p>
 * {@link #position} is an unsigned 64-bit value stored in a {@code long}.
 * </p>
 */
@Value
public class VirtualNode<K extends Comparable<? super K>, V> {
    long position;
    Node<K, V> node;
    int replicaIndex;

    public K getOwner() {
        return node.getKey();
    }

    @Override
    public String toString() {
        return "VirtualNode(" + Long.toUnsignedString(position) + " -> " + node.getKey() + "#" + replicaIndex + ")";
    }
}
