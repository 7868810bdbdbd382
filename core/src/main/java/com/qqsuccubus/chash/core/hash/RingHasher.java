package com.qqsuccubus.chash.core.hash;

/**
 * Hash capability used to place virtual nodes and keys on the ring.
 * <p>
 * The returned {@code long} is interpreted as an <b>unsigned</b> 64-bit position;
 * implementations must be pure functions of the input bytes so that the same
 * node set always produces the same ring, across process restarts as well.
 * </p>
 *
 * @see Hashers
 */
@FunctionalInterface
public interface RingHasher {

    /**
     * Computes the ring position of the given bytes.
     *
     * @param data Input bytes (never mutated)
     * @return 64-bit position, compared with {@link Long#compareUnsigned(long, long)}
     */
    long hash(byte[] data);
}
