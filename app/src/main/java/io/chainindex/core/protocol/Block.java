package io.chainindex.core.protocol;

import java.util.List;

/** A decoded block: its raw bytes, raw header bytes, and transactions in block order. */
public record Block(byte[] raw, byte[] header, List<TxWithHash> transactions) {
    public Block {
        transactions = List.copyOf(transactions);
    }
}
