package io.chainindex.core.storage;

/** A UTXO found in the database together with the two keys that record it. */
public record StoredUtxo(byte[] hKey, byte[] uKey, UtxoEntry entry) {}
