package io.trading.perpfeed.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.trading.perpfeed.transport.WsSession;
import io.trading.perpfeed.transport.WsSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Creates Netty websocket sessions sharing one event loop group.
 * Uses epoll on Linux, NIO elsewhere.
 */
public class NettyWsSessionFactory implements WsSessionFactory, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyWsSessionFactory.class);

    private final EventLoopGroup eventLoopGroup;
    private final Class<? extends SocketChannel> channelClass;

    public NettyWsSessionFactory() {
        this(1);
    }

    public NettyWsSessionFactory(int threads) {
        if (Epoll.isAvailable()) {
            this.eventLoopGroup = new EpollEventLoopGroup(threads);
            this.channelClass = EpollSocketChannel.class;
            LOGGER.info("Netty: Using native epoll transport");
        } else {
            this.eventLoopGroup = new NioEventLoopGroup(threads);
            this.channelClass = NioSocketChannel.class;
            LOGGER.info("Netty: Using NIO transport");
        }
    }

    @Override
    public WsSession create() {
        return new NettyWsSession(eventLoopGroup, channelClass);
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
