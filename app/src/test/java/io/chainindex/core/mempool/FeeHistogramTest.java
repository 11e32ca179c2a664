package io.chainindex.core.mempool;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FeeHistogramTest {

    private static MemPoolTx tx(long feeRate, int size) {
        return new MemPoolTx(List.of(), List.of(), List.of(), feeRate * size, size);
    }

    @Test
    void binsGrowAndCarryTheRemainder() {
        List<FeeHistogram.Bin> bins = FeeHistogram.compact(List.of(tx(10, 600), tx(5, 600), tx(2, 600)), 1000);
        assertEquals(List.of(new FeeHistogram.Bin(5, 1200), new FeeHistogram.Bin(2, 600)), bins);
    }

    @Test
    void equalRatesShareABin() {
        List<FeeHistogram.Bin> bins = FeeHistogram.compact(List.of(tx(10, 300), tx(10, 400), tx(1, 50)), 500);
        assertEquals(List.of(new FeeHistogram.Bin(10, 700), new FeeHistogram.Bin(1, 50)), bins);
    }

    @Test
    void feeRatesRoundDown() {
        MemPoolTx odd = new MemPoolTx(List.of(), List.of(), List.of(), 999, 100);
        assertEquals(List.of(new FeeHistogram.Bin(9, 100)), FeeHistogram.compact(List.of(odd)));
    }

    @Test
    void emptyAndZeroSizeInputsGiveNoBins() {
        assertTrue(FeeHistogram.compact(List.of()).isEmpty());
        assertTrue(FeeHistogram.compact(List.of(tx(3, 0))).isEmpty());
    }

    @Test
    void largeMempoolIsCoveredByStrictlyDescendingBins() {
        Random random = new Random(42);
        List<MemPoolTx> txs = new ArrayList<>();
        long totalSize = 0;
        for (int i = 0; i < 1000; i++) {
            int size = 100 + random.nextInt(901);
            txs.add(tx(1 + random.nextInt(200), size));
            totalSize += size;
        }

        List<FeeHistogram.Bin> bins = FeeHistogram.compact(txs);

        assertTrue(bins.size() > 1);
        assertEquals(totalSize, bins.stream().mapToLong(FeeHistogram.Bin::size).sum());
        for (int i = 1; i < bins.size(); i++) {
            assertTrue(bins.get(i).feeRate() < bins.get(i - 1).feeRate(),
                    "bin " + i + " rate " + bins.get(i).feeRate() + " after " + bins.get(i - 1).feeRate());
        }
        assertTrue(bins.get(0).size() >= FeeHistogram.DEFAULT_BIN_SIZE);
    }
}
