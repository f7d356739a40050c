package io.github.cachestats.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheKey Tests")
class CacheKeyTest {

    @Test
    @DisplayName("Keys compare by content")
    void testEquality() {
        CacheKey a = CacheKey.of("block-1");
        CacheKey b = CacheKey.of("block-1".getBytes(StandardCharsets.UTF_8));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, CacheKey.of("block-2"));
    }

    @Test
    @DisplayName("Key does not alias the caller's array")
    void testDefensiveCopy() {
        byte[] bytes = {1, 2, 3};
        CacheKey key = CacheKey.of(bytes);
        bytes[0] = 9;

        assertEquals(CacheKey.of(new byte[] {1, 2, 3}), key);
        key.toByteArray()[1] = 9;
        assertEquals(CacheKey.of(new byte[] {1, 2, 3}), key);
    }

    @Test
    @DisplayName("Long words are encoded big-endian")
    void testOfLongs() {
        CacheKey key = CacheKey.ofLongs(0x0102030405060708L, -1L);

        assertEquals(16, key.size());
        assertEquals("0102030405060708ffffffffffffffff", key.toString());
    }

    @Test
    @DisplayName("Prefix check")
    void testStartsWith() {
        CacheKey key = CacheKey.ofLongs(1L, 2L, 3L);

        assertTrue(key.startsWith(CacheKey.ofLongs(1L, 2L)));
        assertTrue(key.startsWith(key));
        assertFalse(key.startsWith(CacheKey.ofLongs(2L)));
        assertFalse(CacheKey.ofLongs(1L).startsWith(key));
    }
}
