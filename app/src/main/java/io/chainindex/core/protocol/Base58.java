package io.chainindex.core.protocol;

import java.math.BigInteger;
import java.util.Arrays;

/** Base58 and Base58Check encoding as used for legacy addresses. */
public final class Base58 {
    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);

    private Base58() {}

    public static String encode(byte[] input) {
        BigInteger value = new BigInteger(1, input);
        StringBuilder sb = new StringBuilder();
        while (value.signum() > 0) {
            BigInteger[] qr = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            value = qr[0];
        }
        for (int i = 0; i < input.length && input[i] == 0; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    public static byte[] decode(String input) {
        BigInteger value = BigInteger.ZERO;
        for (char c : input.toCharArray()) {
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid Base58 character '" + c + "'");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] bytes = value.signum() == 0 ? new byte[0] : value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        int zeros = 0;
        while (zeros < input.length() && input.charAt(zeros) == ALPHABET.charAt(0)) {
            zeros++;
        }
        byte[] out = new byte[zeros + bytes.length];
        System.arraycopy(bytes, 0, out, zeros, bytes.length);
        return out;
    }

    /** Appends the first four bytes of the double SHA-256 checksum, then encodes. */
    public static String encodeCheck(byte[] payload) {
        byte[] checksum = Hashes.doubleSha256(payload);
        byte[] full = Arrays.copyOf(payload, payload.length + 4);
        System.arraycopy(checksum, 0, full, payload.length, 4);
        return encode(full);
    }

    public static byte[] decodeCheck(String encoded) {
        byte[] full = decode(encoded);
        if (full.length < 4) {
            throw new IllegalArgumentException("Base58Check string too short");
        }
        byte[] payload = Arrays.copyOf(full, full.length - 4);
        byte[] checksum = Hashes.doubleSha256(payload);
        for (int i = 0; i < 4; i++) {
            if (checksum[i] != full[payload.length + i]) {
                throw new IllegalArgumentException("Base58Check checksum mismatch");
            }
        }
        return payload;
    }
}
