package io.chainindex.core.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TxCountsTest {

    @Test
    void bisectFindsTheHeightOfATxNumber() {
        TxCounts counts = new TxCounts();
        counts.append(1);
        counts.append(3);
        counts.append(3);
        counts.append(7);

        assertEquals(0, counts.bisectRight(0));
        assertEquals(1, counts.bisectRight(1));
        assertEquals(1, counts.bisectRight(2));
        assertEquals(3, counts.bisectRight(3));
        assertEquals(3, counts.bisectRight(6));
        assertEquals(4, counts.bisectRight(7));
    }

    @Test
    void growsAndPops() {
        TxCounts counts = new TxCounts();
        for (int i = 1; i <= 3000; i++) counts.append(i);
        assertEquals(3000, counts.size());
        assertEquals(3000, counts.pop());
        assertEquals(2999, counts.last());

        TxCounts decoded = TxCounts.fromLe32(counts.toLe32(0));
        assertEquals(2999, decoded.size());
        assertEquals(1500, decoded.get(1499));
        assertEquals(8, counts.toLe32(2997).length);
        assertThrows(IndexOutOfBoundsException.class, () -> decoded.get(2999));
    }
}
