package forgebench.orchestrator.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import forgebench.orchestrator.pool.Endpoint;
import forgebench.orchestrator.pool.HealthProbe;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket client for analyzer workers.
 *
 * <p>
 * Each exchange opens a connection, sends one JSON text frame, skips interim
 * frames ({@code request_queued}, {@code progress_update}) and returns the
 * first other frame. The same exchange with a {@code health_check} message
 * serves as the pool's health probe.
 */
public class NettyWorkerClient implements WorkerClient, HealthProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyWorkerClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private static final Set<String> INTERIM_TYPES = Set.of("request_queued", "progress_update",
            "connection_established");
    private static final String HEALTH_CHECK = "{\"type\":\"health_check\"}";
    private static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final EventLoopGroup group;
    private final Duration connectTimeout;
    private final SslContext sslContext;

    public NettyWorkerClient(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.group = new NioEventLoopGroup();
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            group.shutdownGracefully();
            throw new IllegalStateException("Failed to initialize TLS context", e);
        }
    }

    @Override
    public WorkerResponse dispatch(Endpoint endpoint, WorkerRequest request, Duration timeout) {
        String payload;
        try {
            payload = MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize worker request", e);
        }

        URI uri = URI.create(endpoint.dispatchUrl());
        log.debug("Dispatching {} tools to {}", request.tools().size(), uri);
        String reply = exchange(uri, payload, timeout);

        try {
            return MAPPER.readValue(reply, WorkerResponse.class);
        } catch (JsonProcessingException e) {
            throw new WorkerDispatchException("Malformed reply from " + uri, e);
        }
    }

    @Override
    public boolean probe(Endpoint endpoint, Duration timeout) {
        try {
            String reply = exchange(URI.create(endpoint.url()), HEALTH_CHECK, timeout);
            JsonNode node = MAPPER.readTree(reply);
            return "healthy".equalsIgnoreCase(node.path("status").asText());
        } catch (WorkerDispatchException | JsonProcessingException e) {
            log.debug("Health probe of {} failed: {}", endpoint.url(), e.getMessage());
            return false;
        }
    }

    /**
     * Send one text frame and wait for the first non-interim reply.
     */
    String exchange(URI uri, String payload, Duration timeout) {
        CompletableFuture<String> reply = new CompletableFuture<>();
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        WebSocketClientProtocolConfig wsConfig = WebSocketClientProtocolConfig.newBuilder()
                .webSocketUri(uri)
                .maxFramePayloadLength(MAX_FRAME_BYTES)
                .handshakeTimeoutMillis(connectTimeout.toMillis())
                .build();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (secure) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(64 * 1024));
                        p.addLast(new WebSocketClientProtocolHandler(wsConfig));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                        p.addLast(new ReplyHandler(payload, reply));
                    }
                });

        Channel channel = null;
        try {
            ChannelFuture connect = bootstrap.connect(host, port);
            channel = connect.channel();
            connect.addListener(f -> {
                if (!f.isSuccess()) {
                    reply.completeExceptionally(f.cause());
                }
            });
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new WorkerDispatchException("No reply from " + uri + " within " + timeout.toSeconds() + "s", true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new WorkerDispatchException("Dispatch to " + uri + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerDispatchException("Interrupted while waiting for " + uri, e);
        } finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.info("Worker client closed");
    }

    /**
     * Sends the payload once the handshake completes and completes the
     * future with the first non-interim text frame.
     */
    private static final class ReplyHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

        private final String payload;
        private final CompletableFuture<String> reply;

        ReplyHandler(String payload, CompletableFuture<String> reply) {
            this.payload = payload;
            this.reply = reply;
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                ctx.writeAndFlush(new TextWebSocketFrame(payload));
            } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                reply.completeExceptionally(new IOException("WebSocket handshake timed out"));
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            String text = frame.text();
            String type;
            try {
                type = MAPPER.readTree(text).path("type").asText("");
            } catch (JsonProcessingException e) {
                reply.completeExceptionally(e);
                return;
            }
            if (INTERIM_TYPES.contains(type)) {
                log.trace("Skipping interim frame: {}", type);
                return;
            }
            reply.complete(text);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            reply.completeExceptionally(new IOException("Connection closed before reply"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reply.completeExceptionally(cause);
            ctx.close();
        }
    }
}
