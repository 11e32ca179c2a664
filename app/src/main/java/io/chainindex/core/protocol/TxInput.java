package io.chainindex.core.protocol;

import java.util.Arrays;

public record TxInput(byte[] prevHash, long prevIdx, byte[] script, long sequence) {
    private static final long MINUS_1 = 0xFFFFFFFFL;
    private static final byte[] ZERO = new byte[Hash.LENGTH];

    /** Coinbase-style input: no previous output is spent. */
    public boolean isGeneration() {
        return prevIdx == MINUS_1 && Arrays.equals(prevHash, ZERO);
    }

    public Prevout prevout() {
        return new Prevout(new Hash(prevHash), (int) prevIdx);
    }
}
