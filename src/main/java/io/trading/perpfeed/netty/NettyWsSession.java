package io.trading.perpfeed.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.trading.perpfeed.transport.TransportException;
import io.trading.perpfeed.transport.WsSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Netty-backed websocket session.
 *
 * Inbound text frames are queued by the event loop and handed out by {@link #receive},
 * which turns an empty wait into a {@link TimeoutException} and a closed channel into a
 * {@link TransportException}.
 */
public class NettyWsSession implements WsSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyWsSession.class);

    private static final int MAX_FRAME_PAYLOAD_LENGTH = 4 * 1024 * 1024;
    private static final long CLOSE_TIMEOUT_MS = 1000;

    private final EventLoopGroup eventLoopGroup;
    private final Class<? extends SocketChannel> channelClass;
    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();

    private volatile Channel channel;
    private volatile boolean disconnected = false;

    NettyWsSession(EventLoopGroup eventLoopGroup, Class<? extends SocketChannel> channelClass) {
        this.eventLoopGroup = eventLoopGroup;
        this.channelClass = channelClass;
    }

    @Override
    public void connect(String url, Duration timeout) throws TransportException, InterruptedException {
        if (channel != null) {
            throw new IllegalStateException("Session already connected");
        }

        URI uri = URI.create(url);
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? buildSslContext() : null;

        WebSocketClientHandler handler = new WebSocketClientHandler(uri, MAX_FRAME_PAYLOAD_LENGTH, new WebSocketClientHandler.SessionInbox() {
            @Override
            public void message(String text) {
                inbox.offer(new Inbound(text, null, false));
            }

            @Override
            public void closed(Throwable cause) {
                inbox.offer(new Inbound(null, cause, true));
            }
        });

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(channelClass)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(65536));
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("Connecting to {}:{}...", host, port);
        long deadline = System.nanoTime() + timeout.toNanos();
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        this.channel = connectFuture.channel();

        if (!connectFuture.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TransportException("Timed out connecting to " + url);
        }
        if (!connectFuture.isSuccess()) {
            throw new TransportException("Failed to connect to " + url, connectFuture.cause());
        }

        try {
            long remaining = Math.max(1, deadline - System.nanoTime());
            handler.handshakeFuture().get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new TransportException("Websocket handshake with " + url + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out waiting for websocket handshake with " + url, e);
        }
        LOGGER.info("Connected to {}", url);
    }

    @Override
    public void send(String payload) throws TransportException, InterruptedException {
        Channel current = channel;
        if (current == null || !current.isActive()) {
            throw new TransportException("Cannot send message, not connected");
        }
        ChannelFuture future = current.writeAndFlush(new TextWebSocketFrame(payload));
        future.await();
        if (!future.isSuccess()) {
            throw new TransportException("Failed to send message", future.cause());
        }
    }

    @Override
    public String receive(Duration timeout) throws TransportException, TimeoutException, InterruptedException {
        Inbound next = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            throw new TimeoutException("No message within " + timeout.toMillis() + " ms");
        }
        if (next.closed()) {
            // keep the marker so later receives fail the same way
            inbox.offer(next);
            if (next.cause() != null) {
                throw new TransportException("Websocket connection failed", next.cause());
            }
            throw new TransportException("Websocket connection closed by peer");
        }
        return next.text();
    }

    @Override
    public void disconnect() {
        if (disconnected) {
            return;
        }
        disconnected = true;

        Channel current = channel;
        if (current == null) {
            return;
        }
        if (current.isActive()) {
            current.writeAndFlush(new CloseWebSocketFrame());
        }
        if (!current.close().awaitUninterruptibly(CLOSE_TIMEOUT_MS)) {
            LOGGER.warn("Channel did not close within {} ms", CLOSE_TIMEOUT_MS);
        }
        LOGGER.info("Disconnected");
    }

    private static SslContext buildSslContext() throws TransportException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .build();
        } catch (SSLException e) {
            throw new TransportException("Failed to create SSL context", e);
        }
    }

    private record Inbound(String text, Throwable cause, boolean closed) {
    }
}
