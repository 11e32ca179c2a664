package io.chainindex.core.codec;

import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.LengthException;
import io.chainindex.core.protocol.TxDeserializer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equihash headers: a 140-byte prefix (with a 32-byte reserved field and a 32-byte nonce)
 * followed by a varint-length solution. The hash covers the whole header.
 */
public class EquihashHeaderFormat implements HeaderFormat {
    public static final int BASIC_SIZE = 140;

    @Override public int basicSize() { return BASIC_SIZE; }

    @Override public boolean isStatic() { return false; }

    @Override
    public int headerLength(byte[] rawBlock) {
        try {
            TxDeserializer d = new TxDeserializer(rawBlock, false);
            d.skip(BASIC_SIZE);
            long solution = d.readVarint();
            if (solution > Integer.MAX_VALUE) {
                throw new CodecException("equihash solution too large: " + solution);
            }
            d.skip((int) solution);
            return d.cursor();
        } catch (LengthException e) {
            throw new CodecException("Malformed equihash header", e);
        }
    }

    @Override
    public byte[] headerHash(byte[] header) {
        return Hashes.doubleSha256(header);
    }

    @Override
    public Map<String, Object> electrumHeader(byte[] header, int height) {
        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("block_height", height);
        out.put("version", buf.getInt(0));
        out.put("prev_block_hash", Hashes.hashToHex(Arrays.copyOfRange(header, 4, 36)));
        out.put("merkle_root", Hashes.hashToHex(Arrays.copyOfRange(header, 36, 68)));
        out.put("reserved", Hashes.hashToHex(Arrays.copyOfRange(header, 68, 100)));
        out.put("timestamp", buf.getInt(100) & 0xFFFFFFFFL);
        out.put("bits", buf.getInt(104) & 0xFFFFFFFFL);
        out.put("nonce", Hashes.hashToHex(Arrays.copyOfRange(header, 108, 140)));
        out.put("solution", Hashes.toHex(Arrays.copyOfRange(header, BASIC_SIZE, header.length)));
        return out;
    }
}
