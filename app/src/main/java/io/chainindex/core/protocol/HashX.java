package io.chainindex.core.protocol;

import java.util.Arrays;

/**
 * Address fingerprint: the first {@link #LENGTH} bytes of the SHA-256 of an output script.
 * Used as the index key for history and UTXO lookups.
 */
public final class HashX implements Comparable<HashX> {
    public static final int LENGTH = 11;

    private final byte[] bytes;

    public HashX(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("hashX must be " + LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public static HashX of(byte[] source, int offset) {
        return new HashX(Arrays.copyOfRange(source, offset, offset + LENGTH));
    }

    public static HashX fromScript(byte[] script) {
        return of(Hashes.sha256(script), 0);
    }

    public byte[] bytes() { return bytes.clone(); }

    public void copyTo(byte[] dest, int offset) {
        System.arraycopy(bytes, 0, dest, offset, LENGTH);
    }

    public String hex() { return Hashes.toHex(bytes); }

    @Override public boolean equals(Object o) { return o instanceof HashX && Arrays.equals(bytes, ((HashX) o).bytes); }
    @Override public int hashCode() { return Arrays.hashCode(bytes); }
    @Override public int compareTo(HashX o) { return Arrays.compareUnsigned(bytes, o.bytes); }
    @Override public String toString() { return "HashX(" + hex() + ")"; }
}
