package com.qqsuccubus.chash.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable {@link RingHasher} implementations backed by Guava hash functions.
 * <p>
 * <b>Important:</b> hash function choice affects distribution quality.
 * Murmur3 is fast and well-distributed and is the default. FarmHash fingerprint is the fastest.
 * SipHash only resists crafted key sets when built with a secret key, see {@link #sipHash24(long, long)};
 * the no-arg variant uses a public key and gives reproducible positions only.
 * </p>
 */
public final class Hashers {
    private static final RingHasher MURMUR3 = of(Hashing.murmur3_128());
    private static final RingHasher SIP_HASH_24 = of(Hashing.sipHash24());
    private static final RingHasher FARM_HASH = of(Hashing.farmHashFingerprint64());

    private Hashers() {
    }

    /**
     * Murmur3 128-bit hash truncated to its lower 64 bits.
     */
    public static RingHasher murmur3() {
        return MURMUR3;
    }

    /**
     * SipHash-2-4 with Guava's fixed default key, so positions are stable between runs.
     */
    public static RingHasher sipHash24() {
        return SIP_HASH_24;
    }

    /**
     * SipHash-2-4 with a caller-supplied 128-bit key.
     * <p>
     * Keep the key secret to stop clients from choosing keys that all land on one node.
     * Every ring that must agree on placement needs the same key.
     * </p>
     *
     * @param k0 Low 64 bits of the key
     * @param k1 High 64 bits of the key
     */
    public static RingHasher sipHash24(long k0, long k1) {
        return of(Hashing.sipHash24(k0, k1));
    }

    /**
     * FarmHash Fingerprint64.
     */
    public static RingHasher farmHash() {
        return FARM_HASH;
    }

    /**
     * Adapts any Guava hash function producing at least 64 bits.
     *
     * @param function Guava hash function
     * @return hasher returning the first 64 bits of the hash code
     * @throws IllegalArgumentException if the function produces fewer than 64 bits
     */
    public static RingHasher of(HashFunction function) {
        Objects.requireNonNull(function, "function");
        if (function.bits() < Long.SIZE) {
            throw new IllegalArgumentException("hash function must produce at least 64 bits, got " + function.bits());
        }
        return data -> {
            HashCode hash = function.hashBytes(data);
            return hash.asLong(); // lower 64 bits
        };
    }

    /**
     * Resolves a hasher by its short name ({@code murmur3}, {@code siphash}, {@code farmhash}).
     *
     * @param name Case-insensitive hasher name
     * @return matching hasher
     * @throws IllegalArgumentException for unknown names
     */
    public static RingHasher byName(String name) {
        Objects.requireNonNull(name, "name");
        switch (name.toLowerCase(Locale.ROOT)) {
            case "murmur3":
                return murmur3();
            case "siphash":
                return sipHash24();
            case "farmhash":
                return farmHash();
            default:
                throw new IllegalArgumentException("Unknown hash function: " + name);
        }
    }
}
