package io.chainindex.core.codec;

import io.chainindex.core.TestChain;
import io.chainindex.core.protocol.Block;
import io.chainindex.core.protocol.Hashes;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StandardCodecTest {

    private final StandardCodec codec = new StandardCodec(Coins.BITCOIN_REGTEST);

    @Test
    void acceptsTheCoinsGenesisBlock() {
        byte[] genesis = Hashes.fromHex(TestChain.REGTEST_GENESIS_HEX);
        assertSame(genesis, codec.genesisBlock(genesis));
        assertEquals(Coins.BITCOIN_REGTEST.genesisHash(),
                Hashes.hashToHex(codec.headerHash(codec.blockHeader(genesis, 0))));
    }

    @Test
    void rejectsAnotherNetworksGenesisBlock() {
        byte[] genesis = Hashes.fromHex(TestChain.REGTEST_GENESIS_HEX);
        StandardCodec mainnet = new StandardCodec(Coins.BITCOIN_MAINNET);
        CodecException e = assertThrows(CodecException.class, () -> mainnet.genesisBlock(genesis));
        assertTrue(e.getMessage().contains(Coins.BITCOIN_MAINNET.genesisHash()));
    }

    @Test
    void decodesBlocksAndElectrumHeaders() {
        TestChain chain = new TestChain();
        chain.addBlock(1);
        Block block = codec.block(chain.block(1), 1);
        assertEquals(1, block.transactions().size());
        assertArrayEquals(chain.blockHash(0), codec.headerPrevHash(block.header()));

        Map<String, Object> header = codec.electrumHeader(codec.blockHeader(chain.block(0), 0), 0);
        assertEquals(0, header.get("block_height"));
        assertEquals(1, header.get("version"));
        assertEquals(1_296_688_602L, header.get("timestamp"));
        assertEquals(0x207fffffL, header.get("bits"));
        assertEquals(2L, header.get("nonce"));
        assertEquals("0000000000000000000000000000000000000000000000000000000000000000",
                header.get("prev_block_hash"));
    }

    @Test
    void staticHeaderOffsetsFollowHeight() {
        assertTrue(codec.staticHeaders());
        assertEquals(80L * 1000, codec.staticHeaderOffset(1000));
        StandardCodec doge = new StandardCodec(Coins.DOGECOIN_MAINNET);
        assertFalse(doge.staticHeaders());
        assertThrows(IllegalStateException.class, () -> doge.staticHeaderOffset(1));
    }

    @Test
    void unspendableOutputsHaveNoHashX() {
        assertNull(codec.hashXFromScript(new byte[] {0x6a, 0x04, 1, 2, 3, 4}));
        assertEquals(TestChain.hashX(5), codec.hashXFromScript(TestChain.script(5)));
    }

    @Test
    void encodesStandardAddresses() {
        byte[] p2pkh = new byte[25];
        p2pkh[0] = 0x76;
        p2pkh[1] = (byte) 0xa9;
        p2pkh[2] = 20;
        p2pkh[23] = (byte) 0x88;
        p2pkh[24] = (byte) 0xac;
        assertEquals("1111111111111111111114oLvT2", new StandardCodec(Coins.BITCOIN_MAINNET).addressFromScript(p2pkh));
        assertNull(codec.addressFromScript(new byte[] {0x51}));
    }

    @Test
    void looksUpCoinsByNameAndNetwork() {
        assertSame(Coins.BITCOIN_MAINNET, Coins.lookup("bitcoin", null));
        assertSame(Coins.BITCOIN_TESTNET, Coins.lookup("BitcoinSegwit", "TESTNET"));
        assertSame(Coins.DOGECOIN_MAINNET, Coins.lookup("dogecoin", "mainnet"));
        assertThrows(IllegalArgumentException.class, () -> Coins.lookup("nocoin", "mainnet"));
    }
}
