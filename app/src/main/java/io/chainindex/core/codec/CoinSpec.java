package io.chainindex.core.codec;

/**
 * Static parameters of a coin network. The tx-count figures are only used for sync ETA
 * estimates.
 */
public record CoinSpec(
        String name,
        String net,
        String genesisHash,
        HeaderFormat headerFormat,
        boolean segwit,
        int p2pkhVerbyte,
        int p2shVerbyte,
        int reorgLimit,
        int rpcPort,
        long txCount,
        int txCountHeight,
        int txPerBlock
) {
    public String displayName() {
        return name + " " + net;
    }
}
