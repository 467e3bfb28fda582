package io.trading.perpfeed.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Netty handler for one websocket session.
 * Completes the handshake future, forwards text frames to the session inbox and reports
 * the channel going away.
 */
class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final CompletableFuture<Void> handshakeFuture = new CompletableFuture<>();
    private final SessionInbox inbox;

    WebSocketClientHandler(URI uri, int maxFramePayloadLength, SessionInbox inbox) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.inbox = inbox;
    }

    CompletableFuture<Void> handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("WebSocket channel inactive");
        handshakeFuture.completeExceptionally(new IllegalStateException("Channel closed before handshake completed"));
        inbox.closed(null);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("WebSocket handshake complete");
                handshakeFuture.complete(null);
            } catch (Exception e) {
                LOGGER.error("WebSocket handshake failed", e);
                handshakeFuture.completeExceptionally(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            inbox.message(textFrame.text());
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.debug("Received close frame: {} {}", close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("Unsupported frame type: {}", frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("WebSocket exception", cause);
        handshakeFuture.completeExceptionally(cause);
        inbox.closed(cause);
        ctx.close();
    }

    /**
     * Receiver of inbound traffic for one session.
     */
    interface SessionInbox {

        void message(String text);

        /**
         * @param cause failure that closed the channel, or null for an orderly close
         */
        void closed(Throwable cause);
    }
}
