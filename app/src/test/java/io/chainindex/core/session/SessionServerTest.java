package io.chainindex.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainindex.core.FakeChainSource;
import io.chainindex.core.TestChain;
import io.chainindex.core.TestIndexers;
import io.chainindex.core.node.Indexer;
import io.chainindex.core.protocol.Hashes;
import io.chainindex.core.protocol.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import static io.chainindex.core.TestChain.COIN;
import static io.chainindex.core.TestChain.scriptHash;
import static org.junit.jupiter.api.Assertions.*;

class SessionServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TestChain chain = new TestChain();
    private Indexer indexer;
    private SessionServer server;
    private Transaction coinbase1;

    @BeforeEach
    void setUp() throws Exception {
        coinbase1 = chain.addBlock(1);
        chain.addBlock(2);
        chain.addBlock(2);
        indexer = TestIndexers.serving(tempDir, new FakeChainSource(chain), 10);
        server = new SessionServer(indexer.query(), "127.0.0.1", 0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        indexer.close();
    }

    private JsonNode call(String json) throws Exception {
        return server.handle(mapper.readTree(json));
    }

    @Test
    void reportsServerVersion() throws Exception {
        JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"server.version\",\"params\":[\"wallet\",\"1.4\"]}");
        assertEquals(1, response.get("id").intValue());
        assertEquals("chain-indexer 1.0", response.get("result").get(0).textValue());
        assertEquals("1.4", response.get("result").get(1).textValue());
    }

    @Test
    void errorsCarryProtocolCodes() throws Exception {
        JsonNode unknown = call("{\"id\":2,\"method\":\"server.shutdown\"}");
        assertEquals(RpcError.METHOD_NOT_FOUND, unknown.get("error").get("code").intValue());
        assertEquals(2, unknown.get("id").intValue());

        JsonNode badHash = call("{\"id\":3,\"method\":\"blockchain.scripthash.get_balance\",\"params\":[\"zz\"]}");
        assertEquals(RpcError.BAD_REQUEST, badHash.get("error").get("code").intValue());
        assertEquals("\"zz\" is not a valid script hash", badHash.get("error").get("message").textValue());

        JsonNode badHeight = call("{\"id\":4,\"method\":\"blockchain.block.header\",\"params\":[99]}");
        assertEquals(RpcError.BAD_REQUEST, badHeight.get("error").get("code").intValue());
        assertEquals("height 99 out of range", badHeight.get("error").get("message").textValue());

        JsonNode noMethod = call("{\"id\":5}");
        assertEquals(RpcError.INVALID_REQUEST, noMethod.get("error").get("code").intValue());
    }

    @Test
    void notificationsGetNoResponse() throws Exception {
        assertNull(call("{\"method\":\"server.ping\"}"));
        assertNull(call("{\"method\":\"server.shutdown\"}"));
    }

    @Test
    void batchesAnswerEveryRequestWithAnId() throws Exception {
        String batch = "[{\"id\":1,\"method\":\"blockchain.scripthash.get_balance\",\"params\":{\"scripthash\":\""
                + scriptHash(2) + "\"}},"
                + "{\"method\":\"server.ping\"},"
                + "{\"id\":2,\"method\":\"server.ping\"}]";
        JsonNode responses = call(batch);
        assertEquals(2, responses.size());
        assertEquals(100 * COIN, responses.get(0).get("result").get("confirmed").longValue());
        assertEquals(0, responses.get(0).get("result").get("unconfirmed").longValue());
        assertTrue(responses.get(1).get("result").isNull());

        JsonNode empty = call("[]");
        assertEquals(RpcError.INVALID_REQUEST, empty.get("error").get("code").intValue());
    }

    @Test
    void servesHeadersAndHistory() throws Exception {
        JsonNode header = call("{\"id\":1,\"method\":\"blockchain.block.header\",\"params\":[2]}");
        assertEquals(Hashes.toHex(Arrays.copyOf(chain.block(2), 80)), header.get("result").textValue());

        JsonNode proven = call("{\"id\":2,\"method\":\"blockchain.block.header\",\"params\":[1,3]}");
        assertEquals(2, proven.get("result").get("branch").size());
        assertEquals(64, proven.get("result").get("root").textValue().length());

        JsonNode headers = call("{\"id\":3,\"method\":\"blockchain.block.headers\",\"params\":[0,10]}");
        assertEquals(4, headers.get("result").get("count").intValue());
        assertEquals(2016, headers.get("result").get("max").intValue());
        assertEquals(4 * 160, headers.get("result").get("hex").textValue().length());

        JsonNode tip = call("{\"id\":4,\"method\":\"blockchain.headers.subscribe\"}");
        assertEquals(3, tip.get("result").get("height").intValue());

        JsonNode history = call("{\"id\":5,\"method\":\"blockchain.scripthash.get_history\",\"params\":[\""
                + scriptHash(1) + "\"]}");
        assertEquals(1, history.get("result").size());
        assertEquals(coinbase1.hash().hex(), history.get("result").get(0).get("tx_hash").textValue());
        assertEquals(1, history.get("result").get(0).get("height").intValue());

        JsonNode unspent = call("{\"id\":6,\"method\":\"blockchain.scripthash.listunspent\",\"params\":[\""
                + scriptHash(1) + "\"]}");
        assertEquals(50 * COIN, unspent.get("result").get(0).get("value").longValue());
        assertEquals(0, unspent.get("result").get(0).get("tx_pos").intValue());
    }

    @Test
    void answersOverTcp() throws Exception {
        server.start();
        try (Socket socket = new Socket("127.0.0.1", server.port())) {
            socket.setSoTimeout(10_000);
            OutputStream out = socket.getOutputStream();
            BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

            out.write("{\"id\":7,\"method\":\"blockchain.relayfee\"}\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            JsonNode response = mapper.readTree(in.readLine());
            assertEquals(7, response.get("id").intValue());
            assertEquals(0.00001, response.get("result").doubleValue());

            out.write("{not json\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            JsonNode parseError = mapper.readTree(in.readLine());
            assertEquals(RpcError.PARSE_ERROR, parseError.get("error").get("code").intValue());
        }
    }
}
