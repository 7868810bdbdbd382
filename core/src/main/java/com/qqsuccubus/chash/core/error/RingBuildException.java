package com.qqsuccubus.chash.core.error;

import lombok.Getter;

/**
 * Raised when a ring cannot be constructed from the supplied nodes.
 * No partially built ring is ever returned.
 */
public class RingBuildException extends HashRingException {

    public enum Reason {
        /** No nodes were supplied. */
        EMPTY_NODE_LIST,
        /** Replica count (or a node quantity) below one. */
        INVALID_REPLICA_COUNT,
        /** Two virtual nodes share a position under {@code CollisionPolicy.REJECT}. */
        HASH_COLLISION
    }

    @Getter
    private final Reason reason;

    public RingBuildException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static RingBuildException emptyNodeList() {
        return new RingBuildException(Reason.EMPTY_NODE_LIST, "Cannot build a ring without nodes");
    }

    public static RingBuildException invalidReplicaCount(Object key, int replicas) {
        return new RingBuildException(Reason.INVALID_REPLICA_COUNT,
                "Replica count must be >= 1, got " + replicas + " for node " + key);
    }

    public static RingBuildException hashCollision(long position, Object first, Object second) {
        return new RingBuildException(Reason.HASH_COLLISION,
                "Virtual nodes " + first + " and " + second + " collide at position " + Long.toUnsignedString(position));
    }
}
