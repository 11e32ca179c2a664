package io.chainindex.core.codec;

import io.chainindex.core.TestChain;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Header;
import io.chainindex.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class HeaderFormatTest {

    @Test
    void auxpowHeaderSpansParentData() {
        ByteBuffer base = ByteBuffer.allocate(Header.SIZE).order(ByteOrder.LITTLE_ENDIAN);
        base.putInt(AuxPowHeaderFormat.VERSION_AUXPOW | 2);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(base.array());
        out.writeBytes(TestChain.coinbase(1, 0, 100, TestChain.script(1)).serialize());
        out.writeBytes(new byte[32]);
        Transaction.writeVarint(out, 2);
        out.writeBytes(new byte[64]);
        out.writeBytes(new byte[4]);
        Transaction.writeVarint(out, 0);
        out.writeBytes(new byte[4]);
        out.writeBytes(new byte[Header.SIZE]);
        int headerLength = out.size();
        out.write(1);
        byte[] block = out.toByteArray();

        AuxPowHeaderFormat format = new AuxPowHeaderFormat();
        assertEquals(headerLength, format.headerLength(block));
        byte[] header = Arrays.copyOf(block, headerLength);
        assertArrayEquals(Hashes.doubleSha256(Arrays.copyOf(block, Header.SIZE)), format.headerHash(header));
    }

    @Test
    void plainMergedMiningHeaderIsEightyBytes() {
        byte[] block = new byte[Header.SIZE + 10];
        block[0] = 1;
        assertEquals(Header.SIZE, new AuxPowHeaderFormat().headerLength(block));
    }

    @Test
    void truncatedAuxpowIsACodecError() {
        byte[] block = new byte[Header.SIZE + 5];
        block[1] = 1;
        assertThrows(CodecException.class, () -> new AuxPowHeaderFormat().headerLength(block));
    }

    @Test
    void equihashHeaderIncludesSolution() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[EquihashHeaderFormat.BASIC_SIZE]);
        Transaction.writeVarint(out, 1344);
        out.writeBytes(new byte[1344]);
        int headerLength = out.size();
        out.write(0);
        EquihashHeaderFormat format = new EquihashHeaderFormat();
        assertEquals(headerLength, format.headerLength(out.toByteArray()));
        // the solution field includes its varint length prefix
        assertEquals(1344 + 3,
                ((String) format.electrumHeader(Arrays.copyOf(out.toByteArray(), headerLength), 5)
                        .get("solution")).length() / 2);
    }
}
