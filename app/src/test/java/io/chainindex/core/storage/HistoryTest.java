package io.chainindex.core.storage;

import io.chainindex.core.TestChain;
import io.chainindex.core.protocol.HashX;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HistoryTest {

    private final HashX alice = TestChain.hashX(1);
    private final HashX bob = TestChain.hashX(2);
    private KeyValueStore.Factory stores;
    private History history;

    @BeforeEach
    void setUp() {
        stores = InMemoryKeyValueStore.factory();
        history = new History();
        history.open(stores, true, 0, false);
    }

    private List<Long> txNums(HashX hashX, Integer limit) {
        List<Long> out = new ArrayList<>();
        history.getTxNums(hashX, limit).forEach(out::add);
        return out;
    }

    @Test
    void flushWritesOneRowPerAddress() {
        history.addUnflushed(List.of(List.of(alice), List.of(alice, bob, alice), List.of(bob)), 0);
        history.flush();
        history.addUnflushed(List.of(List.of(alice)), 3);
        history.flush();

        assertEquals(List.of(0L, 1L, 3L), txNums(alice, null));
        assertEquals(List.of(1L, 2L), txNums(bob, -1));
        assertEquals(List.of(0L, 1L), txNums(alice, 2));
        assertEquals(2, history.flushCount());
        history.assertFlushed();
    }

    @Test
    void unflushedEntriesAreInvisibleAndCounted() {
        history.addUnflushed(List.of(List.of(alice)), 0);
        assertTrue(txNums(alice, null).isEmpty());
        assertTrue(history.unflushedMemsize() > 0);
        assertThrows(DbException.class, history::assertFlushed);
    }

    @Test
    void backupRemovesEntriesAtOrAboveTxCount() {
        history.addUnflushed(List.of(List.of(alice), List.of(bob)), 0);
        history.flush();
        history.addUnflushed(List.of(List.of(alice, bob), List.of(alice)), 2);
        history.flush();

        history.backup(Set.of(alice, bob), 3);

        assertEquals(List.of(0L, 2L), txNums(alice, null));
        assertEquals(List.of(1L, 2L), txNums(bob, null));
        assertEquals(3, history.flushCount());

        history.backup(Set.of(alice), 1);
        assertEquals(List.of(0L), txNums(alice, null));
    }

    @Test
    void reopeningDropsFlushesAheadOfTheUtxoState() {
        history.addUnflushed(List.of(List.of(alice)), 0);
        history.flush();
        history.addUnflushed(List.of(List.of(alice)), 1);
        history.flush();
        history.close();

        History reopened = new History();
        assertEquals(1, reopened.open(stores, false, 1, false));
        List<Long> nums = new ArrayList<>();
        reopened.getTxNums(alice, null).forEach(nums::add);
        assertEquals(List.of(0L), nums);
    }

    @Test
    void compactionMergesRowsWithoutChangingHistory() {
        long txNum = 0;
        List<Long> expected = new ArrayList<>();
        for (int flush = 0; flush < 4; flush++) {
            List<List<HashX>> txs = new ArrayList<>();
            for (int i = 0; i < 4000; i++) {
                txs.add(i % 2 == 0 ? List.of(alice) : List.of(alice, bob));
                expected.add(txNum + i);
            }
            history.addUnflushed(txs, txNum);
            history.flush();
            txNum += 4000;
        }
        assertEquals(4, history.flushCount());

        history.beginCompaction();
        while (history.compCursor() != -1) {
            history.compact(8_000_000);
        }

        // 16,000 entries need two rows of 12,500
        assertEquals(1, history.flushCount());
        assertEquals(-1, history.compFlushCount());
        assertEquals(expected, txNums(alice, null));
        assertEquals(8000, txNums(bob, null).size());
    }

    @Test
    void interruptedCompactionIsCancelledOnNormalOpen() {
        history.addUnflushed(List.of(List.of(alice)), 0);
        history.flush();
        history.beginCompaction();
        history.compact(1);
        assertNotEquals(-1, history.compCursor());
        history.close();

        History reopened = new History();
        reopened.open(stores, false, 1, false);
        assertEquals(-1, reopened.compCursor());
        assertEquals(-1, reopened.compFlushCount());
    }
}
