package com.qqsuccubus.chash.core.hash;

import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashersTest {

    private static final byte[] DATA = "node-1#0".getBytes(StandardCharsets.UTF_8);

    @ParameterizedTest
    @ValueSource(strings = {"murmur3", "siphash", "farmhash", "MURMUR3"})
    void testByName_IsStableAcrossCalls(String name) {
        RingHasher hasher = Hashers.byName(name);

        assertEquals(hasher.hash(DATA), hasher.hash(DATA.clone()));
        assertEquals(hasher.hash(DATA), Hashers.byName(name).hash(DATA));
    }

    @Test
    void testByName_UnknownName() {
        assertThrows(IllegalArgumentException.class, () -> Hashers.byName("crc32"));
    }

    @Test
    void testMurmur3_MatchesGuavaLowerBits() {
        long expected = Hashing.murmur3_128().hashBytes(DATA).asLong();

        assertEquals(expected, Hashers.murmur3().hash(DATA));
    }

    @Test
    void testFamiliesProduceDifferentPositions() {
        long murmur = Hashers.murmur3().hash(DATA);
        long sip = Hashers.sipHash24().hash(DATA);
        long farm = Hashers.farmHash().hash(DATA);

        assertNotEquals(murmur, sip);
        assertNotEquals(murmur, farm);
        assertNotEquals(sip, farm);
    }

    @Test
    void testSipHash24_KeyChangesPositions() {
        RingHasher keyed = Hashers.sipHash24(0x0706050403020100L, 0x0f0e0d0c0b0a0908L);

        assertEquals(Hashing.sipHash24(0x0706050403020100L, 0x0f0e0d0c0b0a0908L).hashBytes(DATA).asLong(), keyed.hash(DATA));
        assertEquals(keyed.hash(DATA), Hashers.sipHash24(0x0706050403020100L, 0x0f0e0d0c0b0a0908L).hash(DATA));
        assertNotEquals(keyed.hash(DATA), Hashers.sipHash24(1L, 2L).hash(DATA));
    }

    @Test
    void testOf_RejectsNarrowHashFunctions() {
        assertThrows(IllegalArgumentException.class, () -> Hashers.of(Hashing.crc32()));
    }

    @Test
    void testOf_AcceptsWideHashFunctions() {
        RingHasher sha = Hashers.of(Hashing.sha256());

        assertEquals(Hashing.sha256().hashBytes(DATA).asLong(), sha.hash(DATA));
    }

    @Test
    void testUtf8Encoder() {
        KeyEncoder<String> encoder = KeyEncoder.utf8();

        assertArrayEquals("żółw".getBytes(StandardCharsets.UTF_8), encoder.encode("żółw"));
    }
}
