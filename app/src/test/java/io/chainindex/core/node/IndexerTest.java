package io.chainindex.core.node;

import io.chainindex.core.FakeChainSource;
import io.chainindex.core.TestChain;
import io.chainindex.core.TestIndexers;
import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.Transaction;
import io.chainindex.core.query.Balance;
import io.chainindex.core.query.QueryFacade;
import io.chainindex.core.storage.Utxo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static io.chainindex.core.TestChain.COIN;
import static io.chainindex.core.TestChain.hashX;
import static io.chainindex.core.TestChain.outpoint;
import static io.chainindex.core.TestChain.pay;
import static io.chainindex.core.TestIndexers.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class IndexerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    Path tempDir;

    private Indexer indexer;

    @AfterEach
    void tearDown() {
        if (indexer != null) {
            indexer.close();
        }
    }

    @Test
    void syncsThenServesMempoolAndNewBlocks() throws Exception {
        TestChain chain = new TestChain();
        Transaction coinbase = chain.addBlock(1);
        chain.addBlock(2);
        chain.addBlock(2);
        FakeChainSource daemon = new FakeChainSource(chain);

        indexer = TestIndexers.serving(tempDir, daemon, 100);
        QueryFacade query = indexer.query();
        assertEquals(3, query.height());
        assertEquals(new Balance(50 * COIN, 0), query.balance(hashX(1)));
        assertEquals(new Balance(100 * COIN, 0), query.balance(hashX(2)));
        assertEquals(1, query.limitedHistory(hashX(1)).size());

        Transaction payment = TestChain.spend(List.of(outpoint(coinbase, 0)),
                List.of(pay(5, 20 * COIN), pay(1, 29 * COIN)));
        daemon.addMempoolTx(payment);
        waitFor(() -> query.mempoolSize() == 1, TIMEOUT);

        assertEquals(new Balance(50 * COIN, -21 * COIN), query.balance(hashX(1)));
        List<Utxo> unspent = query.listUnspent(hashX(1));
        assertEquals(1, unspent.size());
        assertEquals(payment.hash(), unspent.get(0).txHash());
        assertEquals(29 * COIN, unspent.get(0).value());
        assertEquals(0, unspent.get(0).height());
        assertEquals(1, query.mempoolSummaries(hashX(5)).size());
        assertEquals(COIN, query.mempoolSummaries(hashX(5)).get(0).fee());

        chain.addBlock(2, payment);
        daemon.clearMempool();
        daemon.setChain(chain);
        waitFor(() -> query.height() == 4 && query.mempoolSize() == 0, TIMEOUT);
        // the cached history of hashX 1 is dropped by the block notification
        waitFor(() -> query.limitedHistory(hashX(1)).size() == 2, TIMEOUT);
        assertEquals(new Balance(29 * COIN, 0), query.balance(hashX(1)));
        assertEquals(new Balance(20 * COIN, 0), query.balance(hashX(5)));
    }

    @Test
    void followsTheDaemonAcrossAReorg() throws Exception {
        TestChain chain = new TestChain();
        for (int h = 1; h <= 6; h++) {
            chain.addBlock(1);
        }
        chain.addBlock(8);
        chain.addBlock(8);
        FakeChainSource daemon = new FakeChainSource(chain);

        indexer = TestIndexers.serving(tempDir, daemon, 100);
        QueryFacade query = indexer.query();
        assertEquals(new Balance(100 * COIN, 0), query.balance(hashX(8)));

        TestChain fork = chain.fork(6);
        fork.addBlock(9);
        fork.addBlock(9);
        fork.addBlock(9);
        daemon.setChain(fork);

        Hash newTip = new Hash(fork.blockHash(9));
        waitFor(() -> newTip.equals(indexer.processor().tip()), TIMEOUT);
        waitFor(() -> query.balance(hashX(9)).confirmed() == 150 * COIN, TIMEOUT);
        assertEquals(0, query.balance(hashX(8)).confirmed());
        assertTrue(query.limitedHistory(hashX(8)).isEmpty());
        assertEquals(300 * COIN, query.balance(hashX(1)).confirmed());
        assertArrayEquals(Arrays.copyOf(fork.block(8), 80), query.rawHeader(8));
    }

    @Test
    void forcedReorgReplaysTheSameBlocks() throws Exception {
        TestChain chain = new TestChain();
        for (int h = 1; h <= 5; h++) {
            chain.addBlock(h);
        }
        FakeChainSource daemon = new FakeChainSource(chain);

        indexer = TestIndexers.serving(tempDir, daemon, 100);
        long flushes = indexer.db().history().flushCount();
        assertTrue(indexer.forceReorg(2));

        waitFor(() -> indexer.db().history().flushCount() > flushes + 1
                && indexer.db().dbHeight() == 5, TIMEOUT);
        assertEquals(new Hash(chain.blockHash(5)), indexer.processor().tip());
        for (int owner = 1; owner <= 5; owner++) {
            assertEquals(50 * COIN, indexer.query().balance(hashX(owner)).confirmed());
        }
    }

    @Test
    void forcedReorgDeeperThanTheChainIsRejected() throws Exception {
        TestChain chain = new TestChain();
        for (int h = 1; h <= 5; h++) {
            chain.addBlock(h);
        }
        indexer = TestIndexers.serving(tempDir, new FakeChainSource(chain), 100);
        long flushes = indexer.db().history().flushCount();

        assertThrows(IllegalArgumentException.class, () -> indexer.forceReorg(10));
        assertThrows(IllegalArgumentException.class, () -> indexer.forceReorg(6));
        assertTrue(indexer.forceReorg(5));

        waitFor(() -> indexer.db().history().flushCount() > flushes + 1
                && indexer.db().dbHeight() == 5, TIMEOUT);
        assertFalse(indexer.terminated().isDone());
        assertEquals(new Hash(chain.blockHash(5)), indexer.processor().tip());
        assertEquals(50 * COIN, indexer.query().balance(hashX(1)).confirmed());
    }
}
