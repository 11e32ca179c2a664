package io.chainindex.core.storage;

public record KeyValue(byte[] key, byte[] value) {}
