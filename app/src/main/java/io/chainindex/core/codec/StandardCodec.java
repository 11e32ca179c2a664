package io.chainindex.core.codec;

import io.chainindex.core.protocol.Base58;
import io.chainindex.core.protocol.Block;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Header;
import io.chainindex.core.protocol.LengthException;
import io.chainindex.core.protocol.TxDeserializer;
import io.chainindex.core.protocol.TxWithHash;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** {@link ChainCodec} built from a {@link CoinSpec} and its {@link HeaderFormat}. */
public final class StandardCodec implements ChainCodec {
    public static final int OP_RETURN = 0x6a;
    private static final int OP_DUP = 0x76;
    private static final int OP_HASH160 = 0xa9;
    private static final int OP_EQUALVERIFY = 0x88;
    private static final int OP_CHECKSIG = 0xac;
    private static final int OP_EQUAL = 0x87;

    private final CoinSpec coin;
    private final HeaderFormat headers;

    public StandardCodec(CoinSpec coin) {
        this.coin = coin;
        this.headers = coin.headerFormat();
    }

    @Override public CoinSpec coin() { return coin; }

    @Override public boolean staticHeaders() { return headers.isStatic(); }

    @Override
    public long staticHeaderOffset(int height) {
        if (!headers.isStatic()) {
            throw new IllegalStateException(coin.displayName() + " does not have static headers");
        }
        return (long) height * headers.basicSize();
    }

    @Override
    public byte[] headerHash(byte[] header) {
        return headers.headerHash(header);
    }

    @Override
    public byte[] headerPrevHash(byte[] header) {
        return Header.prevHash(header);
    }

    @Override
    public byte[] blockHeader(byte[] rawBlock, int height) {
        return Arrays.copyOf(rawBlock, headers.headerLength(rawBlock));
    }

    @Override
    public Block block(byte[] rawBlock, int height) {
        int headerLength = headers.headerLength(rawBlock);
        try {
            TxDeserializer d = new TxDeserializer(rawBlock, headerLength, coin.segwit());
            List<TxWithHash> txs = d.readTxBlock();
            return new Block(rawBlock, Arrays.copyOf(rawBlock, headerLength), txs);
        } catch (LengthException e) {
            throw new CodecException("Malformed block at height " + height, e);
        }
    }

    @Override
    public byte[] genesisBlock(byte[] rawBlock) {
        byte[] header = blockHeader(rawBlock, 0);
        String hash = Hashes.hashToHex(headerHash(header));
        if (!hash.equals(coin.genesisHash())) {
            throw new CodecException("genesis block has hash " + hash + " expected " + coin.genesisHash());
        }
        return rawBlock;
    }

    @Override
    public Map<String, Object> electrumHeader(byte[] header, int height) {
        return headers.electrumHeader(header, height);
    }

    @Override
    public HashX hashXFromScript(byte[] script) {
        if (script.length > 0 && (script[0] & 0xff) == OP_RETURN) {
            return null;
        }
        return HashX.fromScript(script);
    }

    @Override
    public String addressFromScript(byte[] script) {
        if (script.length == 25
                && (script[0] & 0xff) == OP_DUP
                && (script[1] & 0xff) == OP_HASH160
                && script[2] == 20
                && (script[23] & 0xff) == OP_EQUALVERIFY
                && (script[24] & 0xff) == OP_CHECKSIG) {
            return encode(coin.p2pkhVerbyte(), script, 3);
        }
        if (script.length == 23
                && (script[0] & 0xff) == OP_HASH160
                && script[1] == 20
                && (script[22] & 0xff) == OP_EQUAL) {
            return encode(coin.p2shVerbyte(), script, 2);
        }
        return null;
    }

    @Override
    public TxDeserializer deserializer(byte[] raw) {
        return new TxDeserializer(raw, coin.segwit());
    }

    private static String encode(int verbyte, byte[] script, int offset) {
        byte[] payload = new byte[21];
        payload[0] = (byte) verbyte;
        System.arraycopy(script, offset, payload, 1, 20);
        return Base58.encodeCheck(payload);
    }
}
