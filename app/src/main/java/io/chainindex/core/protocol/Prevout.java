package io.chainindex.core.protocol;

/** A reference to output {@code index} of transaction {@code txHash}. */
public record Prevout(Hash txHash, int index) {
    public Prevout {
        if (txHash == null) {
            throw new IllegalArgumentException("txHash is required");
        }
        if (index < 0 || index > 0xFFFF) {
            throw new IllegalArgumentException("Output index out of range: " + index);
        }
    }
}
