package io.chainindex.core.mempool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compact fee histogram: bins of descending fee rate, each holding at least the current bin
 * size worth of virtual bytes. The bin size grows by a tenth after every bin.
 */
public final class FeeHistogram {
    public static final int DEFAULT_BIN_SIZE = 100_000;

    /** Fee rate in satoshis per virtual byte and the virtual size of its bin. */
    public record Bin(long feeRate, long size) {}

    private FeeHistogram() {}

    public static List<Bin> compact(Collection<MemPoolTx> txs) {
        return compact(txs, DEFAULT_BIN_SIZE);
    }

    public static List<Bin> compact(Collection<MemPoolTx> txs, double binSize) {
        Map<Long, Long> byRate = new TreeMap<>(Collections.reverseOrder());
        for (MemPoolTx tx : txs) {
            if (tx.size() > 0) {
                byRate.merge(tx.fee() / tx.size(), (long) tx.size(), Long::sum);
            }
        }
        List<Bin> compact = new ArrayList<>();
        long cumSize = 0;
        double r = 0;
        long lastRate = 0;
        for (Map.Entry<Long, Long> e : byRate.entrySet()) {
            lastRate = e.getKey();
            cumSize += e.getValue();
            if (cumSize + r > binSize) {
                compact.add(new Bin(lastRate, cumSize));
                r += cumSize - binSize;
                cumSize = 0;
                binSize *= 1.1;
            }
        }
        if (cumSize > 0) {
            compact.add(new Bin(lastRate, cumSize));
        }
        return compact;
    }
}
