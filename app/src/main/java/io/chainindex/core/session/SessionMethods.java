package io.chainindex.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainindex.core.daemon.DaemonException;
import io.chainindex.core.mempool.FeeHistogram;
import io.chainindex.core.mempool.MemPoolTxSummary;
import io.chainindex.core.metrics.IndexMetrics;
import io.chainindex.core.protocol.HashX;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Merkle;
import io.chainindex.core.query.Balance;
import io.chainindex.core.query.BadRequestException;
import io.chainindex.core.query.QueryArguments;
import io.chainindex.core.query.QueryFacade;
import io.chainindex.core.storage.ChainDb;
import io.chainindex.core.storage.TxLocation;
import io.chainindex.core.storage.Utxo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Electrum protocol methods over the query facade. Parameters may be positional or named.
 */
final class SessionMethods {
    static final String SERVER_VERSION = "chain-indexer 1.0";
    static final String PROTOCOL_VERSION = "1.4";

    private interface Method {
        JsonNode call(Params params);
    }

    private final QueryFacade query;
    private final ObjectMapper mapper;
    private final Map<String, Method> methods;

    SessionMethods(QueryFacade query, ObjectMapper mapper) {
        this.query = query;
        this.mapper = mapper;
        this.methods = new HashMap<>();
        methods.put("server.version", p -> serverVersion());
        methods.put("server.ping", p -> NullNode.getInstance());
        methods.put("blockchain.headers.subscribe", p -> headersSubscribe());
        methods.put("blockchain.block.header", p -> blockHeader(
                QueryArguments.nonNegativeInteger(p.get(0, "height")),
                QueryArguments.nonNegativeInteger(p.get(1, "cp_height"), 0)));
        methods.put("blockchain.block.headers", p -> blockHeaders(
                QueryArguments.nonNegativeInteger(p.get(0, "start_height")),
                QueryArguments.nonNegativeInteger(p.get(1, "count")),
                QueryArguments.nonNegativeInteger(p.get(2, "cp_height"), 0)));
        methods.put("blockchain.scripthash.get_history",
                p -> history(QueryArguments.scriptHash(p.get(0, "scripthash"))));
        methods.put("blockchain.scripthash.get_mempool",
                p -> unconfirmedHistory(QueryArguments.scriptHash(p.get(0, "scripthash"))));
        methods.put("blockchain.scripthash.get_balance",
                p -> balance(QueryArguments.scriptHash(p.get(0, "scripthash"))));
        methods.put("blockchain.scripthash.listunspent",
                p -> listUnspent(QueryArguments.scriptHash(p.get(0, "scripthash"))));
        methods.put("blockchain.transaction.broadcast",
                p -> text(query.broadcast(QueryArguments.hexString(p.get(0, "raw_tx")))));
        methods.put("blockchain.estimatefee",
                p -> number(query.estimateFee(QueryArguments.nonNegativeInteger(p.get(0, "number")))));
        methods.put("blockchain.relayfee", p -> number(query.relayFee()));
        methods.put("mempool.get_fee_histogram", p -> feeHistogram());
    }

    /**
     * Runs {@code method}.
     *
     * @throws RpcError for unknown methods, bad arguments and daemon failures
     */
    JsonNode dispatch(String method, JsonNode params) {
        Method handler = methods.get(method);
        if (handler == null) {
            throw new RpcError(RpcError.METHOD_NOT_FOUND, "unknown method \"" + method + "\"");
        }
        IndexMetrics.countQuery(method);
        try {
            return handler.call(new Params(params));
        } catch (BadRequestException e) {
            throw new RpcError(RpcError.BAD_REQUEST, e.getMessage());
        } catch (DaemonException e) {
            throw new RpcError(RpcError.DAEMON_ERROR, "daemon error: " + e.getMessage());
        }
    }

    private JsonNode text(String value) {
        return mapper.getNodeFactory().textNode(value);
    }

    private JsonNode number(double value) {
        return mapper.getNodeFactory().numberNode(value);
    }

    private JsonNode serverVersion() {
        ArrayNode result = mapper.createArrayNode();
        result.add(SERVER_VERSION);
        result.add(PROTOCOL_VERSION);
        return result;
    }

    private JsonNode headersSubscribe() {
        int height = query.height();
        ObjectNode result = mapper.createObjectNode();
        result.put("hex", Hashes.toHex(query.rawHeader(height)));
        result.put("height", height);
        return result;
    }

    private JsonNode blockHeader(int height, int cpHeight) {
        String rawHex = Hashes.toHex(query.rawHeader(height));
        if (cpHeight == 0) {
            return text(rawHex);
        }
        ObjectNode result = mapper.createObjectNode();
        result.put("header", rawHex);
        addProof(result, query.headerProof(cpHeight, height));
        return result;
    }

    private JsonNode blockHeaders(int startHeight, int count, int cpHeight) {
        ChainDb.HeaderRange range = query.readHeaders(startHeight, count);
        ObjectNode result = mapper.createObjectNode();
        result.put("hex", Hashes.toHex(range.raw()));
        result.put("count", range.count());
        result.put("max", QueryFacade.MAX_CHUNK_SIZE);
        if (range.count() > 0 && cpHeight > 0) {
            addProof(result, query.headerProof(cpHeight, startHeight + range.count() - 1));
        }
        return result;
    }

    private static void addProof(ObjectNode result, Merkle.BranchAndRoot proof) {
        ArrayNode branch = result.putArray("branch");
        for (byte[] hash : proof.branch()) {
            branch.add(Hashes.hashToHex(hash));
        }
        result.put("root", Hashes.hashToHex(proof.root()));
    }

    private JsonNode history(HashX hashX) {
        ArrayNode result = mapper.createArrayNode();
        for (TxLocation loc : query.limitedHistory(hashX)) {
            result.addObject()
                    .put("tx_hash", loc.txHash().hex())
                    .put("height", loc.height());
        }
        result.addAll((ArrayNode) unconfirmedHistory(hashX));
        return result;
    }

    // mempool height is -1 when a transaction has unconfirmed inputs, else 0
    private JsonNode unconfirmedHistory(HashX hashX) {
        ArrayNode result = mapper.createArrayNode();
        for (MemPoolTxSummary tx : query.mempoolSummaries(hashX)) {
            result.addObject()
                    .put("tx_hash", tx.hash().hex())
                    .put("height", tx.hasUnconfirmedInputs() ? -1 : 0)
                    .put("fee", tx.fee());
        }
        return result;
    }

    private JsonNode balance(HashX hashX) {
        Balance balance = query.balance(hashX);
        return mapper.createObjectNode()
                .put("confirmed", balance.confirmed())
                .put("unconfirmed", balance.unconfirmed());
    }

    private JsonNode listUnspent(HashX hashX) {
        ArrayNode result = mapper.createArrayNode();
        for (Utxo utxo : query.listUnspent(hashX)) {
            result.addObject()
                    .put("tx_hash", utxo.txHash().hex())
                    .put("tx_pos", utxo.txPos())
                    .put("height", utxo.height())
                    .put("value", utxo.value());
        }
        return result;
    }

    private JsonNode feeHistogram() {
        ArrayNode result = mapper.createArrayNode();
        List<FeeHistogram.Bin> bins = query.feeHistogram();
        for (FeeHistogram.Bin bin : bins) {
            result.addArray().add(bin.feeRate()).add(bin.size());
        }
        return result;
    }

    /** Positional or named parameters of one request. */
    private static final class Params {
        private final JsonNode params;

        Params(JsonNode params) {
            this.params = params == null || params.isNull() ? MissingNode.getInstance() : params;
        }

        JsonNode get(int index, String name) {
            JsonNode value = params.isArray() ? params.path(index) : params.path(name);
            return value.isMissingNode() ? null : value;
        }
    }
}
