package io.chainindex.core.protocol;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * A decoded transaction. Witness data is not retained; {@link #serialize()} produces the
 * non-witness encoding whose double SHA-256 is the transaction hash.
 */
public record Transaction(int version, List<TxInput> inputs, List<TxOutput> outputs, long locktime) {

    public Transaction {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLe32(out, version);
        writeVarint(out, inputs.size());
        for (TxInput in : inputs) {
            out.writeBytes(in.prevHash());
            writeLe32(out, (int) in.prevIdx());
            writeVarBytes(out, in.script());
            writeLe32(out, (int) in.sequence());
        }
        writeVarint(out, outputs.size());
        for (TxOutput o : outputs) {
            writeLe64(out, o.value());
            writeVarBytes(out, o.pkScript());
        }
        writeLe32(out, (int) locktime);
        return out.toByteArray();
    }

    public Hash hash() {
        return new Hash(Hashes.doubleSha256(serialize()));
    }

    static void writeLe32(ByteArrayOutputStream out, int v) {
        out.write(v);
        out.write(v >>> 8);
        out.write(v >>> 16);
        out.write(v >>> 24);
    }

    static void writeLe64(ByteArrayOutputStream out, long v) {
        for (int i = 0; i < 8; i++) {
            out.write((int) (v >>> (8 * i)));
        }
    }

    public static void writeVarint(ByteArrayOutputStream out, long n) {
        if (n < 0xfd) {
            out.write((int) n);
        } else if (n <= 0xffff) {
            out.write(0xfd);
            out.write((int) n);
            out.write((int) (n >>> 8));
        } else if (n <= 0xffffffffL) {
            out.write(0xfe);
            writeLe32(out, (int) n);
        } else {
            out.write(0xff);
            writeLe64(out, n);
        }
    }

    static void writeVarBytes(ByteArrayOutputStream out, byte[] b) {
        writeVarint(out, b.length);
        out.writeBytes(b);
    }
}
