package io.chainindex.core.protocol;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cursor-based reader for the Bitcoin transaction wire format. Optionally understands
 * the segregated-witness encoding, in which case hashes exclude witness data.
 */
public class TxDeserializer {
    private final byte[] binary;
    private final boolean segwit;
    private int cursor;

    public TxDeserializer(byte[] binary, boolean segwit) {
        this(binary, 0, segwit);
    }

    public TxDeserializer(byte[] binary, int start, boolean segwit) {
        this.binary = binary;
        this.cursor = start;
        this.segwit = segwit;
    }

    public int cursor() { return cursor; }

    public void seek(int position) {
        if (position < 0 || position > binary.length) {
            throw new LengthException("cannot seek to " + position + " in " + binary.length + " bytes");
        }
        cursor = position;
    }

    public void skip(int n) {
        ensure(n);
        cursor += n;
    }

    public TxWithHash readTx() {
        return segwit ? readSegwitTx() : readLegacyTx();
    }

    /** Reads a varint transaction count followed by that many transactions. */
    public List<TxWithHash> readTxBlock() {
        long count = readVarint();
        List<TxWithHash> txs = new ArrayList<>((int) Math.min(count, 10_000));
        for (long i = 0; i < count; i++) {
            txs.add(readTx());
        }
        return txs;
    }

    private TxWithHash readLegacyTx() {
        int start = cursor;
        int version = readLe32();
        List<TxInput> inputs = readInputs();
        List<TxOutput> outputs = readOutputs();
        long locktime = readLe32() & 0xFFFFFFFFL;
        int size = cursor - start;
        Hash hash = new Hash(Hashes.doubleSha256(binary, start, size));
        return new TxWithHash(new Transaction(version, inputs, outputs, locktime), hash, size);
    }

    private TxWithHash readSegwitTx() {
        int start = cursor;
        int version = readLe32();
        int marker = peekByte();
        if (marker != 0) {
            cursor = start;
            return readLegacyTx();
        }
        cursor += 1;
        int flag = readByte();
        if (flag == 0) {
            throw new LengthException("segwit flag must be non-zero");
        }
        int ioStart = cursor;
        List<TxInput> inputs = readInputs();
        List<TxOutput> outputs = readOutputs();
        int ioEnd = cursor;
        for (int i = 0; i < inputs.size(); i++) {
            long items = readVarint();
            for (long j = 0; j < items; j++) {
                readVarBytes();
            }
        }
        int locktimeStart = cursor;
        long locktime = readLe32() & 0xFFFFFFFFL;

        MessageDigest md = Hashes.sha256Digest();
        md.update(binary, start, 4);
        md.update(binary, ioStart, ioEnd - ioStart);
        md.update(binary, locktimeStart, 4);
        Hash hash = new Hash(md.digest(md.digest()));

        int baseSize = 4 + (ioEnd - ioStart) + 4;
        int totalSize = cursor - start;
        int vsize = (3 * baseSize + totalSize) / 4;
        return new TxWithHash(new Transaction(version, inputs, outputs, locktime), hash, vsize);
    }

    private List<TxInput> readInputs() {
        long count = readVarint();
        List<TxInput> inputs = new ArrayList<>((int) Math.min(count, 1_000));
        for (long i = 0; i < count; i++) {
            byte[] prevHash = readBytes(32);
            long prevIdx = readLe32() & 0xFFFFFFFFL;
            byte[] script = readVarBytes();
            long sequence = readLe32() & 0xFFFFFFFFL;
            inputs.add(new TxInput(prevHash, prevIdx, script, sequence));
        }
        return inputs;
    }

    private List<TxOutput> readOutputs() {
        long count = readVarint();
        List<TxOutput> outputs = new ArrayList<>((int) Math.min(count, 1_000));
        for (long i = 0; i < count; i++) {
            long value = readLe64();
            outputs.add(new TxOutput(value, readVarBytes()));
        }
        return outputs;
    }

    public byte[] readBytes(int n) {
        ensure(n);
        byte[] out = Arrays.copyOfRange(binary, cursor, cursor + n);
        cursor += n;
        return out;
    }

    public byte[] readVarBytes() {
        long n = readVarint();
        if (n > Integer.MAX_VALUE) {
            throw new LengthException("var bytes length " + n + " too large");
        }
        return readBytes((int) n);
    }

    public long readVarint() {
        int n = readByte();
        if (n < 0xfd) {
            return n;
        }
        if (n == 0xfd) {
            ensure(2);
            int v = (binary[cursor] & 0xff) | (binary[cursor + 1] & 0xff) << 8;
            cursor += 2;
            return v;
        }
        if (n == 0xfe) {
            return readLe32() & 0xFFFFFFFFL;
        }
        return readLe64();
    }

    public int readByte() {
        ensure(1);
        return binary[cursor++] & 0xff;
    }

    private int peekByte() {
        ensure(1);
        return binary[cursor] & 0xff;
    }

    public int readLe32() {
        ensure(4);
        int v = (binary[cursor] & 0xff)
                | (binary[cursor + 1] & 0xff) << 8
                | (binary[cursor + 2] & 0xff) << 16
                | (binary[cursor + 3] & 0xff) << 24;
        cursor += 4;
        return v;
    }

    public long readLe64() {
        ensure(8);
        long v = 0;
        for (int i = 7; i >= 0; i--) {
            v = (v << 8) | (binary[cursor + i] & 0xff);
        }
        cursor += 8;
        return v;
    }

    private void ensure(int n) {
        if (n < 0 || n > binary.length - cursor) {
            throw new LengthException("cannot read " + n + " bytes at offset " + cursor
                    + " of " + binary.length);
        }
    }
}
