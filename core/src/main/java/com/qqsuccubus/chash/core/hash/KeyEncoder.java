package com.qqsuccubus.chash.core.hash;

import java.nio.charset.StandardCharsets;

/**
 * Canonical byte representation of a node key.
 * <p>
 * The ring never interprets node keys; it only feeds their encoded form to the
 * {@link RingHasher}. Encoders must be deterministic: equal keys, equal bytes.
 * </p>
 *
 * @param <K> Node key type
 */
@FunctionalInterface
public interface KeyEncoder<K> {

    byte[] encode(K key);

    /**
     * UTF-8 encoding of {@link Object#toString()}. The default for {@code String} keys.
     */
    static <K> KeyEncoder<K> utf8() {
        return key -> key.toString().getBytes(StandardCharsets.UTF_8);
    }
}
