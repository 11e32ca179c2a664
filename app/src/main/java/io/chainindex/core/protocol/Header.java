package io.chainindex.core.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * The fixed 80-byte Bitcoin header prefix: {@code <I 32s 32s I I I>}. Height is not part of
 * the bytes; it is supplied by whoever knows where the header sits in the chain.
 */
public record Header(int version, byte[] prevHash, byte[] merkleRoot, long timestamp, long bits, long nonce,
                     int height) {
    public static final int SIZE = 80;

    public static Header parse(byte[] header, int height) {
        if (header.length < SIZE) {
            throw new LengthException("header of " + header.length + " bytes is shorter than " + SIZE);
        }
        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        int version = buf.getInt(0);
        byte[] prev = Arrays.copyOfRange(header, 4, 36);
        byte[] root = Arrays.copyOfRange(header, 36, 68);
        long timestamp = buf.getInt(68) & 0xFFFFFFFFL;
        long bits = buf.getInt(72) & 0xFFFFFFFFL;
        long nonce = buf.getInt(76) & 0xFFFFFFFFL;
        return new Header(version, prev, root, timestamp, bits, nonce, height);
    }

    public static byte[] prevHash(byte[] header) {
        return Arrays.copyOfRange(header, 4, 36);
    }
}
