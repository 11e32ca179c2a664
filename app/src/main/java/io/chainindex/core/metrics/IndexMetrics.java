package io.chainindex.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

public class IndexMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksProcessed = registry.counter("index.blocks.processed");
    private static final Counter reorgs = registry.counter("index.reorgs");
    private static final Timer blockTime = registry.timer("index.block.processing.time");
    private static final Timer flushTime = registry.timer("index.flush.time");
    private static final AtomicLong mempoolSize = registry.gauge("mempool.txs", new AtomicLong());
    private static final AtomicLong height = registry.gauge("index.height", new AtomicLong(-1));

    public static void recordBlocks(int count, Runnable processing) {
        blockTime.record(processing);
        blocksProcessed.increment(count);
    }

    public static void recordFlush(Runnable flush) {
        flushTime.record(flush);
    }

    public static void incrementReorgs() {
        reorgs.increment();
    }

    public static void setHeight(int value) {
        height.set(value);
    }

    public static void setMempoolSize(int txs) {
        mempoolSize.set(txs);
    }

    public static void countQuery(String method) {
        registry.counter("session.requests", "method", method).increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
