package io.chainindex.core.codec;

import io.chainindex.core.protocol.Block;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.TxDeserializer;

import java.util.Map;

/**
 * Coin-specific parsing used by the indexer: header layout and hashing, transaction
 * decoding, and the mapping from output scripts to index keys.
 */
public interface ChainCodec {

    CoinSpec coin();

    /** Whether all headers have the same length, so offsets follow from the height. */
    boolean staticHeaders();

    /** Byte offset of the header at {@code height} in the headers file; static headers only. */
    long staticHeaderOffset(int height);

    byte[] headerHash(byte[] header);

    byte[] headerPrevHash(byte[] header);

    /** The raw header bytes at the start of {@code rawBlock}. */
    byte[] blockHeader(byte[] rawBlock, int height);

    Block block(byte[] rawBlock, int height);

    /** Returns {@code rawBlock} unchanged if its header hashes to the coin's genesis hash. */
    byte[] genesisBlock(byte[] rawBlock);

    Map<String, Object> electrumHeader(byte[] header, int height);

    /** Index key for an output script, or null if the output is provably unspendable. */
    HashX hashXFromScript(byte[] script);

    /** Base58Check address for standard P2PKH / P2SH scripts, otherwise null. */
    String addressFromScript(byte[] script);

    TxDeserializer deserializer(byte[] raw);
}
