package io.chainindex.core.protocol;

import java.util.Arrays;

/** A 32-byte transaction or block hash in internal (little-endian) byte order. */
public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Parses the byte-reversed display form used by daemons. */
    public static Hash fromHex(String hex) {
        return new Hash(Hashes.hexToHash(hex));
    }

    public byte[] bytes() { return bytes.clone(); }

    /** Display hex (byte-reversed). */
    public String hex() { return Hashes.hashToHex(bytes); }

    @Override public boolean equals(Object o) { return o instanceof Hash && Arrays.equals(bytes, ((Hash) o).bytes); }
    @Override public int hashCode() { return Arrays.hashCode(bytes); }
    @Override public int compareTo(Hash o) { return Arrays.compareUnsigned(bytes, o.bytes); }
    @Override public String toString() { return "Hash(" + hex().substring(0, 8) + "…)"; }
}
