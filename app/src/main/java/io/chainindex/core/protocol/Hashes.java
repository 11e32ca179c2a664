package io.chainindex.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashes() {}

    public static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] sha256(byte[] in) {
        return sha256Digest().digest(in);
    }

    public static byte[] doubleSha256(byte[] in) {
        MessageDigest md = sha256Digest();
        return md.digest(md.digest(in));
    }

    public static byte[] doubleSha256(byte[] in, int offset, int length) {
        MessageDigest md = sha256Digest();
        md.update(in, offset, length);
        return md.digest(md.digest());
    }

    /** Hash of {@code left || right}, the merkle node combiner. */
    public static byte[] doubleSha256(byte[] left, byte[] right) {
        MessageDigest md = sha256Digest();
        md.update(left);
        md.update(right);
        return md.digest(md.digest());
    }

    public static String toHex(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || (hex.length() & 1) != 0) {
            throw new IllegalArgumentException("Hex string must have even length");
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = hexDigit(hex.charAt(2 * i));
            int lo = hexDigit(hex.charAt(2 * i + 1));
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex character in " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /** Value of an ASCII hex digit, or -1 for anything else. */
    public static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    /** Display form of a hash: byte-reversed hex, as daemons print block and tx ids. */
    public static String hashToHex(byte[] hash) {
        return toHex(reversed(hash));
    }

    public static byte[] hexToHash(String hex) {
        return reversed(fromHex(hex));
    }

    public static byte[] reversed(byte[] in) {
        byte[] out = new byte[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = in[in.length - 1 - i];
        }
        return out;
    }
}
