package io.chainindex.core.storage;

import io.chainindex.core.protocol.HashX;

/**
 * An unspent output as cached by the block processor and as recorded in undo data:
 * owning hashX, confirming tx number and value.
 */
public record UtxoEntry(HashX hashX, long txNum, long value) {
    public static final int SIZE = HashX.LENGTH + 4 + 8;

    public void writeTo(byte[] dest, int offset) {
        hashX.copyTo(dest, offset);
        System.arraycopy(Keys.le32(txNum), 0, dest, offset + HashX.LENGTH, 4);
        System.arraycopy(Keys.le64(value), 0, dest, offset + HashX.LENGTH + 4, 8);
    }

    public static UtxoEntry readFrom(byte[] src, int offset) {
        return new UtxoEntry(HashX.of(src, offset),
                Keys.readLe32(src, offset + HashX.LENGTH),
                Keys.readLe64(src, offset + HashX.LENGTH + 4));
    }
}
