package com.qqsuccubus.chash.core.ring;

/**
 * What to do when two virtual nodes land on the same ring position.
 */
public enum CollisionPolicy {
    /**
     * Keep every virtual node; equal positions are ordered by (node key, replica index)
     * and the first of them answers lookups.
     */
    TIE_BREAK,

    /**
     * Fail the build with {@code RingBuildException.Reason.HASH_COLLISION}.
     */
    REJECT
}
