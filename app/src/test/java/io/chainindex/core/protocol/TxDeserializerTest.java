package io.chainindex.core.protocol;

import io.chainindex.core.TestChain;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TxDeserializerTest {

    private static final String GENESIS_COINBASE_HASH =
            "4a5e1e4baab89f3a32518a88c31bc87f618f76673e2cc77ab2127b7afdeda33b";

    @Test
    void readsGenesisCoinbase() {
        byte[] block = Hashes.fromHex(TestChain.REGTEST_GENESIS_HEX);
        TxDeserializer d = new TxDeserializer(block, Header.SIZE, false);
        List<TxWithHash> txs = d.readTxBlock();

        assertEquals(1, txs.size());
        TxWithHash coinbase = txs.get(0);
        assertEquals(GENESIS_COINBASE_HASH, coinbase.hash().hex());
        assertTrue(coinbase.tx().inputs().get(0).isGeneration());
        assertEquals(5_000_000_000L, coinbase.tx().outputs().get(0).value());
        assertEquals(block.length, d.cursor());
        assertEquals(block.length - Header.SIZE - 1, coinbase.vsize());
    }

    @Test
    void serializeRoundTripsTheHash() {
        Transaction tx = TestChain.spend(
                List.of(new Prevout(new Hash(Hashes.sha256(new byte[] {1})), 3)),
                List.of(TestChain.pay(1, 1000), TestChain.pay(2, 2000)));
        TxWithHash read = new TxDeserializer(tx.serialize(), false).readTx();
        assertEquals(2, read.tx().outputs().size());
        assertEquals(tx.hash(), read.hash());
        assertEquals(tx.serialize().length, read.vsize());
    }

    @Test
    void segwitHashExcludesWitness() {
        Transaction tx = TestChain.spend(
                List.of(new Prevout(new Hash(Hashes.sha256(new byte[] {2})), 0)),
                List.of(TestChain.pay(3, 5000)));
        byte[] legacy = tx.serialize();
        byte[] witness = new byte[72];
        Arrays.fill(witness, (byte) 0x30);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(legacy, 0, 4);
        out.write(0);
        out.write(1);
        out.write(legacy, 4, legacy.length - 8);
        out.write(1);
        Transaction.writeVarint(out, witness.length);
        out.writeBytes(witness);
        out.write(legacy, legacy.length - 4, 4);
        byte[] segwit = out.toByteArray();

        TxWithHash read = new TxDeserializer(segwit, true).readTx();
        assertEquals(tx.hash(), read.hash());
        assertEquals((3 * legacy.length + segwit.length) / 4, read.vsize());
        assertEquals(1, read.tx().inputs().size());
        assertEquals(5000, read.tx().outputs().get(0).value());
    }

    @Test
    void segwitReaderAcceptsLegacyEncoding() {
        Transaction tx = TestChain.coinbase(7, 0, 100, TestChain.script(9));
        TxWithHash read = new TxDeserializer(tx.serialize(), true).readTx();
        assertEquals(tx.hash(), read.hash());
    }

    @Test
    void truncatedInputRaisesLengthException() {
        byte[] raw = TestChain.coinbase(1, 0, 100, TestChain.script(1)).serialize();
        byte[] truncated = Arrays.copyOf(raw, raw.length - 3);
        assertThrows(LengthException.class, () -> new TxDeserializer(truncated, false).readTx());
    }

    @Test
    void readsAllVarintWidths() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Transaction.writeVarint(out, 0xfc);
        Transaction.writeVarint(out, 0xfd);
        Transaction.writeVarint(out, 0x10000);
        Transaction.writeVarint(out, 0x1_0000_0000L);
        TxDeserializer d = new TxDeserializer(out.toByteArray(), false);
        assertEquals(0xfc, d.readVarint());
        assertEquals(0xfd, d.readVarint());
        assertEquals(0x10000, d.readVarint());
        assertEquals(0x1_0000_0000L, d.readVarint());
    }
}
