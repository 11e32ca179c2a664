package io.chainindex.core.mempool;

import io.chainindex.core.protocol.Prevout;
import io.chainindex.core.storage.HashXValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mempool transaction reduced to what queries need.
 *
 * @param prevouts non-generation inputs, in order
 * @param inPairs owner and value of each prevout; empty until the transaction is accepted
 * @param outPairs owner and value of each output; the owner is null for unspendable outputs
 * @param fee never negative
 * @param size virtual size
 */
public record MemPoolTx(List<Prevout> prevouts, List<HashXValue> inPairs, List<HashXValue> outPairs,
                        long fee, int size) {

    public MemPoolTx {
        prevouts = List.copyOf(prevouts);
        inPairs = List.copyOf(inPairs);
        // outputs may carry a null owner, which List.copyOf rejects
        outPairs = Collections.unmodifiableList(new ArrayList<>(outPairs));
    }

    /** This transaction with its inputs resolved and its fee computed. */
    MemPoolTx accept(List<HashXValue> resolvedInputs) {
        long in = 0;
        for (HashXValue pair : resolvedInputs) in += pair.value();
        long out = 0;
        for (HashXValue pair : outPairs) out += pair.value();
        return new MemPoolTx(prevouts, resolvedInputs, outPairs, Math.max(0, in - out), size);
    }
}
