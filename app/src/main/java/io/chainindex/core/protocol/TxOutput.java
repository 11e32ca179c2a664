package io.chainindex.core.protocol;

public record TxOutput(long value, byte[] pkScript) {}
