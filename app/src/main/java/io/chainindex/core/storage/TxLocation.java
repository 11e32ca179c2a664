package io.chainindex.core.storage;

import io.chainindex.core.protocol.Hash;

/** A confirmed transaction's hash and height. {@code txHash} is null if not yet readable. */
public record TxLocation(Hash txHash, int height) {}
