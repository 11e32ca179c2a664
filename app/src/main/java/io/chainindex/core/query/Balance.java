package io.chainindex.core.query;

/** Confirmed balance and the mempool's net change to it, both in satoshis. */
public record Balance(long confirmed, long unconfirmed) {}
