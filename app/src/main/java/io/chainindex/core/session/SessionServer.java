package io.chainindex.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainindex.core.query.QueryFacade;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Electrum JSON-RPC over TCP: one JSON request or batch per line, one response per line.
 * Requests are served off the event loop since queries may touch disk or the daemon.
 */
public final class SessionServer {
    private static final Logger LOG = Logger.getLogger(SessionServer.class.getName());

    static final int MAX_LINE_LENGTH = 2_000_000;
    static final int QUERY_THREADS = 8;

    private final String bindAddress;
    private final int port;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionMethods methods;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final EventExecutorGroup queryGroup = new DefaultEventExecutorGroup(QUERY_THREADS);
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private Channel serverChannel;

    public SessionServer(QueryFacade query, String bindAddress, int port) {
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.methods = new SessionMethods(query, mapper);
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });
            serverChannel = bootstrap.bind(bindAddress, port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "session server listening on " + bindAddress + ':' + port());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting session server", e);
        }
    }

    /** The bound port, which differs from the configured one when that was 0. */
    public int port() {
        return serverChannel != null ? ((InetSocketAddress) serverChannel.localAddress()).getPort() : port;
    }

    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        queryGroup.shutdownGracefully();
        LOG.info("session server stopped");
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new JsonCodec());
        pipeline.addLast(queryGroup, new RequestHandler());
    }

    /** Answers a request or a batch; notifications (no id) get no response. */
    JsonNode handle(JsonNode request) {
        if (request.isArray()) {
            if (request.isEmpty()) {
                return error(NullNode.getInstance(), RpcError.INVALID_REQUEST, "empty batch");
            }
            ArrayNode responses = mapper.createArrayNode();
            for (JsonNode item : request) {
                JsonNode response = handleSingle(item);
                if (response != null) {
                    responses.add(response);
                }
            }
            return responses.isEmpty() ? null : responses;
        }
        return handleSingle(request);
    }

    private JsonNode handleSingle(JsonNode request) {
        JsonNode id = request.path("id");
        if (!request.isObject() || !request.path("method").isTextual()) {
            return error(id.isMissingNode() ? NullNode.getInstance() : id, RpcError.INVALID_REQUEST,
                    "invalid request");
        }
        String method = request.get("method").textValue();
        try {
            JsonNode result = methods.dispatch(method, request.get("params"));
            if (id.isMissingNode()) {
                return null;
            }
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", "2.0");
            response.set("result", result);
            response.set("id", id);
            return response;
        } catch (RpcError e) {
            return id.isMissingNode() ? null : error(id, e.code(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "request " + method + " failed", e);
            return id.isMissingNode() ? null : error(id, RpcError.INTERNAL_ERROR, "internal error");
        }
    }

    private JsonNode error(JsonNode id, int code, String message) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.putObject("error").put("code", code).put("message", message);
        response.set("id", id);
        return response;
    }

    private final class RequestHandler extends SimpleChannelInboundHandler<JsonNode> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channels.add(ctx.channel());
            LOG.fine(() -> "session opened from " + ctx.channel().remoteAddress());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, JsonNode request) {
            JsonNode response = handle(request);
            if (response != null) {
                ctx.writeAndFlush(response);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause.getCause() instanceof JsonProcessingException) {
                ctx.writeAndFlush(error(NullNode.getInstance(), RpcError.PARSE_ERROR, "invalid JSON"));
                return;
            }
            LOG.log(Level.WARNING, "session channel error", cause);
            ctx.close();
        }
    }

    private final class JsonCodec extends MessageToMessageCodec<String, JsonNode> {
        @Override
        protected void encode(ChannelHandlerContext ctx, JsonNode msg, List<Object> out) throws Exception {
            out.add(mapper.writeValueAsString(msg) + "\n");
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws Exception {
            if (!msg.isBlank()) {
                out.add(mapper.readTree(msg));
            }
        }
    }
}
