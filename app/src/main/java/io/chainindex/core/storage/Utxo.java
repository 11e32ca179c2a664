package io.chainindex.core.storage;

import io.chainindex.core.protocol.Hash;

/** An unspent output as returned to queries. Mempool outputs use txNum -1 and height 0. */
public record Utxo(long txNum, int txPos, Hash txHash, int height, long value) {}
