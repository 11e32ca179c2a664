package io.chainindex.core.codec;

import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Header;
import io.chainindex.core.protocol.LengthException;
import io.chainindex.core.protocol.TxDeserializer;

import java.util.Arrays;
import java.util.Map;

/**
 * Merged-mining headers. When the version carries the auxpow bit the 80-byte header is
 * followed by the parent coinbase transaction, its merkle branch, the chain merkle branch
 * and the parent block header. The block hash covers only the first 80 bytes.
 */
public class AuxPowHeaderFormat implements HeaderFormat {
    public static final int VERSION_AUXPOW = 1 << 8;

    @Override public int basicSize() { return Header.SIZE; }

    @Override public boolean isStatic() { return false; }

    @Override
    public int headerLength(byte[] rawBlock) {
        try {
            TxDeserializer d = new TxDeserializer(rawBlock, false);
            int version = d.readLe32();
            if ((version & VERSION_AUXPOW) == 0) {
                d.seek(Header.SIZE);
                return Header.SIZE;
            }
            d.seek(Header.SIZE);
            d.readTx();                       // parent coinbase
            d.skip(32);                       // parent block hash
            d.skip(32 * (int) d.readVarint()); // coinbase merkle branch
            d.skip(4);
            d.skip(32 * (int) d.readVarint()); // chain merkle branch
            d.skip(4);
            d.skip(Header.SIZE);              // parent header
            return d.cursor();
        } catch (LengthException e) {
            throw new CodecException("Malformed auxpow header", e);
        }
    }

    @Override
    public byte[] headerHash(byte[] header) {
        return Hashes.doubleSha256(Arrays.copyOf(header, Header.SIZE));
    }

    @Override
    public Map<String, Object> electrumHeader(byte[] header, int height) {
        return StaticHeaderFormat.bitcoinFields(Arrays.copyOf(header, Header.SIZE), height);
    }
}
