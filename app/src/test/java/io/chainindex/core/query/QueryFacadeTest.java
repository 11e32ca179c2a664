package io.chainindex.core.query;

import io.chainindex.core.FakeChainSource;
import io.chainindex.core.TestChain;
import io.chainindex.core.TestIndexers;
import io.chainindex.core.node.Indexer;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Merkle;
import io.chainindex.core.protocol.Transaction;
import io.chainindex.core.storage.ChainDb;
import io.chainindex.core.storage.TxLocation;
import io.chainindex.core.storage.Utxo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.chainindex.core.TestChain.COIN;
import static io.chainindex.core.TestChain.hashX;
import static io.chainindex.core.TestChain.outpoint;
import static io.chainindex.core.TestChain.pay;
import static org.junit.jupiter.api.Assertions.*;

class QueryFacadeTest {

    @TempDir
    Path tempDir;

    private TestChain chain;
    private FakeChainSource daemon;
    private Indexer indexer;
    private QueryFacade query;
    private Transaction coinbase1;

    @BeforeEach
    void setUp() throws Exception {
        chain = new TestChain();
        coinbase1 = chain.addBlock(1);
        chain.addBlock(2);
        chain.addBlock(3);
        chain.addBlock(1);
        daemon = new FakeChainSource(chain);
        indexer = TestIndexers.serving(tempDir, daemon, 2);
        query = indexer.query();
    }

    @AfterEach
    void tearDown() {
        indexer.close();
    }

    @Test
    void historyCacheEvictsLeastRecentlyUsed() {
        List<TxLocation> first = query.limitedHistory(hashX(1));
        assertEquals(2, first.size());
        query.limitedHistory(hashX(2));
        assertSame(first, query.limitedHistory(hashX(1)));
        query.limitedHistory(hashX(3));
        assertEquals(2, query.cachedHistories());

        // hashX 2 was the least recently used, so it went
        query.invalidate(4, Set.of(hashX(2)));
        assertEquals(2, query.cachedHistories());
        query.invalidate(4, Set.of(hashX(1), hashX(3)));
        assertEquals(0, query.cachedHistories());
        assertEquals(first, query.limitedHistory(hashX(1)));
    }

    @Test
    void historyIsCappedAtTheConfiguredMaximum() {
        QueryFacade capped = new QueryFacade(indexer.db(), indexer.mempool(), daemon, 10, 1);
        assertEquals(List.of(new TxLocation(coinbase1.hash(), 1)), capped.limitedHistory(hashX(1)));
    }

    @Test
    void headersAreServedWithinTheChain() {
        assertEquals(4, query.height());
        assertArrayEquals(Arrays.copyOf(chain.block(2), 80), query.rawHeader(2));
        BadRequestException e = assertThrows(BadRequestException.class, () -> query.rawHeader(10));
        assertEquals("height 10 out of range", e.getMessage());

        Map<String, Object> header = query.electrumHeader(4);
        assertEquals(4, header.get("block_height"));
        assertEquals(Hashes.hashToHex(chain.blockHash(3)), header.get("prev_block_hash"));

        ChainDb.HeaderRange range = query.readHeaders(1, 50_000);
        assertEquals(4, range.count());
        assertEquals(4 * 80, range.raw().length);
    }

    @Test
    void headerProofsCheckHeightsAndMatchTheHeaderTree() {
        assertThrows(BadRequestException.class, () -> query.headerProof(2, 3));
        assertThrows(BadRequestException.class, () -> query.headerProof(5, 1));

        List<byte[]> hashes = new ArrayList<>();
        for (int h = 0; h <= 3; h++) {
            hashes.add(chain.blockHash(h));
        }
        Merkle.BranchAndRoot expected = new Merkle().branchAndRoot(hashes, 1);
        Merkle.BranchAndRoot proof = query.headerProof(3, 1);
        assertArrayEquals(expected.root(), proof.root());
        assertEquals(expected.branch().size(), proof.branch().size());
        for (int i = 0; i < expected.branch().size(); i++) {
            assertArrayEquals(expected.branch().get(i), proof.branch().get(i));
        }
    }

    @Test
    void broadcastRelaysAndRefreshesTheMempool() throws Exception {
        Transaction payment = TestChain.spend(List.of(outpoint(coinbase1, 0)),
                List.of(pay(4, 10 * COIN), pay(1, 39 * COIN)));
        String rawHex = Hashes.toHex(payment.serialize());

        assertEquals(payment.hash().hex(), query.broadcast(rawHex));
        assertEquals(List.of(rawHex), daemon.broadcasts());
        TestIndexers.waitFor(() -> query.mempoolSize() == 1, Duration.ofSeconds(30));

        assertEquals(10 * COIN, query.mempoolBalanceDelta(hashX(4)));
        assertEquals(Set.of(outpoint(coinbase1, 0)), query.mempoolPotentialSpends(hashX(1)));
        assertEquals(1, query.mempoolUtxos(hashX(4)).size());
        // the confirmed coinbase is spent in the mempool
        assertEquals(List.of(39 * COIN, 50 * COIN),
                query.listUnspent(hashX(1)).stream().map(Utxo::value).sorted().toList());
    }

    @Test
    void rejectedBroadcastsBecomeBadRequests() {
        daemon.rejectBroadcasts("bad-txns-inputs-missingorspent");
        BadRequestException e = assertThrows(BadRequestException.class, () -> query.broadcast("00"));
        assertTrue(e.getMessage().startsWith("the transaction was rejected by network rules."));
        assertTrue(e.getMessage().contains("bad-txns-inputs-missingorspent"));
        assertTrue(e.getMessage().endsWith("[00]"));
    }

    @Test
    void daemonPassthroughs() {
        assertEquals(4, query.daemonHeight());
        assertEquals(-1, query.estimateFee(0));
        assertEquals(0.0002, query.estimateFee(6));
        assertEquals(0.00001, query.relayFee());
    }
}
