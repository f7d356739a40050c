package io.github.cachestats.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable byte-string key of a cache entry.
 *
 * <p>Equality and hashing are by content. Keys of ordinary cached data are
 * typically built with {@link #of(String)} or {@link #of(byte[])}; fixed-width
 * keys with {@link #ofLongs(long...)}.</p>
 */
public final class CacheKey {

    private final byte[] bytes;
    private final int hash;

    private CacheKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Key holding a copy of the given bytes.
     */
    public static CacheKey of(byte[] bytes) {
        return new CacheKey(bytes.clone());
    }

    /**
     * Key holding the UTF-8 encoding of {@code key}.
     */
    public static CacheKey of(String key) {
        return new CacheKey(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fixed-width key of {@code 8 * words.length} bytes, big-endian.
     */
    public static CacheKey ofLongs(long... words) {
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES * words.length);
        for (long word : words) {
            buffer.putLong(word);
        }
        return new CacheKey(buffer.array());
    }

    public int size() {
        return bytes.length;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Whether this key begins with all bytes of {@code prefix}.
     */
    public boolean startsWith(CacheKey prefix) {
        return bytes.length >= prefix.bytes.length
            && Arrays.equals(bytes, 0, prefix.bytes.length, prefix.bytes, 0, prefix.bytes.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey other)) return false;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(bytes);
    }
}
