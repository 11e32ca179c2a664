package io.chainindex.core.protocol;

/** A transaction as found in a block or the mempool, with its hash and virtual size. */
public record TxWithHash(Transaction tx, Hash hash, int vsize) {}
