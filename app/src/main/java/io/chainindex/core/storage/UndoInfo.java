package io.chainindex.core.storage;

import java.util.ArrayList;
import java.util.List;

/** The outputs spent at one height, in the order the block's inputs spent them. */
public record UndoInfo(int height, List<UtxoEntry> spent) {

    public UndoInfo {
        spent = List.copyOf(spent);
    }

    public byte[] encode() {
        byte[] out = new byte[spent.size() * UtxoEntry.SIZE];
        for (int i = 0; i < spent.size(); i++) {
            spent.get(i).writeTo(out, i * UtxoEntry.SIZE);
        }
        return out;
    }

    public static UndoInfo decode(int height, byte[] data) {
        if (data.length % UtxoEntry.SIZE != 0) {
            throw new DbException("undo information at height " + height + " has bad length " + data.length);
        }
        List<UtxoEntry> entries = new ArrayList<>(data.length / UtxoEntry.SIZE);
        for (int off = 0; off < data.length; off += UtxoEntry.SIZE) {
            entries.add(UtxoEntry.readFrom(data, off));
        }
        return new UndoInfo(height, entries);
    }
}
