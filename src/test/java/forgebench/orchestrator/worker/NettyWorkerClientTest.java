package forgebench.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import forgebench.orchestrator.model.ServiceType;
import forgebench.orchestrator.pool.Endpoint;
import forgebench.orchestrator.pool.EndpointPool;
import forgebench.orchestrator.pool.SelectionStrategy;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.*;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NettyWorkerClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static EventLoopGroup serverGroup;
    private static Channel serverChannel;
    private static int port;
    private static final FakeWorker worker = new FakeWorker();

    private NettyWorkerClient client;

    @BeforeAll
    static void startWorker() throws Exception {
        serverGroup = new NioEventLoopGroup(1);
        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath("/")
                .checkStartsWith(true)
                .build();
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(65536))
                                .addLast(new WebSocketServerProtocolHandler(wsConfig))
                                .addLast(worker);
                    }
                })
                .bind("127.0.0.1", 0).sync().channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @AfterAll
    static void stopWorker() {
        serverChannel.close().syncUninterruptibly();
        serverGroup.shutdownGracefully().syncUninterruptibly();
    }

    @BeforeEach
    void setUp() {
        worker.mode = "success";
        worker.healthStatus = "healthy";
        worker.paths.clear();
        worker.requests.clear();
        client = new NettyWorkerClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static Endpoint endpoint(String url) {
        EndpointPool pool = new EndpointPool(Map.of(ServiceType.STATIC_ANALYZER, List.of(url)),
                (e, t) -> true, SelectionStrategy.ROUND_ROBIN, Duration.ofSeconds(60), Duration.ofSeconds(1),
                Clock.systemUTC());
        return pool.endpoints(ServiceType.STATIC_ANALYZER).get(0);
    }

    @Test
    @DisplayName("Interim frames are skipped and the final result is parsed")
    void dispatchReturnsFinalReply() throws Exception {
        WorkerResponse response = client.dispatch(endpoint("ws://127.0.0.1:" + port),
                WorkerRequest.of("gpt", 4, List.of("bandit", "pylint")), Duration.ofSeconds(5));

        assertTrue(response.isSuccessful());
        assertEquals(2, response.analysisOrEmpty().findings().size());
        assertEquals(List.of("bandit", "pylint"), response.analysisOrEmpty().toolsUsed());
        assertEquals(2, response.analysisOrEmpty().severityBreakdown().get("medium"));

        assertEquals(List.of("/static-analyzer"), worker.paths);
        JsonNode sent = MAPPER.readTree(worker.requests.get(0));
        assertEquals("analysis_request", sent.get("type").asText());
        assertEquals("gpt", sent.get("targetModel").asText());
        assertEquals(4, sent.get("targetAppNumber").asInt());
    }

    @Test
    void workerErrorIsAReplyNotAnException() {
        worker.mode = "error";

        WorkerResponse response = client.dispatch(endpoint("ws://127.0.0.1:" + port),
                WorkerRequest.of("gpt", 1, List.of("bandit")), Duration.ofSeconds(5));

        assertFalse(response.isSuccessful());
        assertEquals("bandit not installed", response.failureMessage());
    }

    @Test
    void silentWorkerTimesOut() {
        worker.mode = "silent";

        WorkerDispatchException e = assertThrows(WorkerDispatchException.class,
                () -> client.dispatch(endpoint("ws://127.0.0.1:" + port),
                        WorkerRequest.of("gpt", 1, List.of("bandit")), Duration.ofMillis(300)));
        assertTrue(e.isTimeout());
    }

    @Test
    void refusedConnectionFails() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        WorkerDispatchException e = assertThrows(WorkerDispatchException.class,
                () -> client.dispatch(endpoint("ws://127.0.0.1:" + closedPort),
                        WorkerRequest.of("gpt", 1, List.of("bandit")), Duration.ofSeconds(5)));
        assertFalse(e.isTimeout());
    }

    @Test
    void probeReadsHealthStatus() throws Exception {
        Endpoint endpoint = endpoint("ws://127.0.0.1:" + port);
        assertTrue(client.probe(endpoint, Duration.ofSeconds(2)));

        worker.healthStatus = "degraded";
        assertFalse(client.probe(endpoint, Duration.ofSeconds(2)));

        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        assertFalse(client.probe(endpoint("ws://127.0.0.1:" + closedPort), Duration.ofSeconds(1)));
    }

    /**
     * Minimal analyzer: queues, reports progress, then answers.
     */
    @ChannelHandler.Sharable
    private static final class FakeWorker extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        volatile String mode;
        volatile String healthStatus;
        final List<String> paths = new CopyOnWriteArrayList<>();
        final List<String> requests = new CopyOnWriteArrayList<>();

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                String uri = ((WebSocketServerProtocolHandler.HandshakeComplete) evt).requestUri();
                if (!"/".equals(uri)) {
                    paths.add(uri);
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
            JsonNode message = MAPPER.readTree(frame.text());
            if ("health_check".equals(message.path("type").asText())) {
                ctx.writeAndFlush(new TextWebSocketFrame(
                        "{\"type\":\"health_check\",\"status\":\"" + healthStatus + "\"}"));
                return;
            }

            requests.add(frame.text());
            switch (mode) {
                case "silent" -> {
                    // never answers
                }
                case "error" -> ctx.writeAndFlush(new TextWebSocketFrame(
                        "{\"type\":\"analysis_result\",\"status\":\"error\",\"error\":\"bandit not installed\"}"));
                default -> {
                    ctx.write(new TextWebSocketFrame("{\"type\":\"request_queued\",\"position\":1}"));
                    ctx.write(new TextWebSocketFrame("{\"type\":\"progress_update\",\"progress\":50}"));
                    ctx.writeAndFlush(new TextWebSocketFrame("""
                            {"type":"analysis_result","status":"success",
                             "analysis":{"findings":[{"tool":"bandit"},{"tool":"pylint"}],
                                         "toolsUsed":["bandit","pylint"],
                                         "severityBreakdown":{"medium":2}}}"""));
                }
            }
        }
    }
}
