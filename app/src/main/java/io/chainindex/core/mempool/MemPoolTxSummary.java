package io.chainindex.core.mempool;

import io.chainindex.core.protocol.Hash;

public record MemPoolTxSummary(Hash hash, long fee, boolean hasUnconfirmedInputs) {}
