package io.chainindex.core.codec;

import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Header;

import java.util.LinkedHashMap;
import java.util.Map;

/** Fixed-size headers hashed with double SHA-256 over the whole header. */
public class StaticHeaderFormat implements HeaderFormat {
    private final int size;

    public StaticHeaderFormat() {
        this(Header.SIZE);
    }

    public StaticHeaderFormat(int size) {
        this.size = size;
    }

    @Override public int basicSize() { return size; }

    @Override public boolean isStatic() { return true; }

    @Override
    public int headerLength(byte[] rawBlock) {
        if (rawBlock.length < size) {
            throw new CodecException("block of " + rawBlock.length + " bytes is shorter than its header");
        }
        return size;
    }

    @Override
    public byte[] headerHash(byte[] header) {
        return Hashes.doubleSha256(header);
    }

    @Override
    public Map<String, Object> electrumHeader(byte[] header, int height) {
        return bitcoinFields(header, height);
    }

    static Map<String, Object> bitcoinFields(byte[] header, int height) {
        Header h = Header.parse(header, height);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("block_height", height);
        out.put("version", h.version());
        out.put("prev_block_hash", Hashes.hashToHex(h.prevHash()));
        out.put("merkle_root", Hashes.hashToHex(h.merkleRoot()));
        out.put("timestamp", h.timestamp());
        out.put("bits", h.bits());
        out.put("nonce", h.nonce());
        return out;
    }
}
