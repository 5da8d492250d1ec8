/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.cdpmux.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Transport} over a Netty WebSocket client channel.
 * <p>
 * Inbound frames are handed to the listener directly on the channel's event loop,
 * so the listener sees them in wire order and must only enqueue. Frames and a
 * disconnect that happen between the handshake and {@link #start} are held and
 * replayed to the listener when it starts.
 */
public class WebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);

    public static WebSocketTransport connect(String url) {
        return connect(WebSocketOptions.of(url));
    }

    public static WebSocketTransport connect(WebSocketOptions options) {
        WebSocketTransport transport = new WebSocketTransport(options);
        transport.doConnect();
        return transport;
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static boolean isSecure(URI uri) {
        return "wss".equalsIgnoreCase(uri.getScheme());
    }

    static int portOf(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return isSecure(uri) ? 443 : 80;
    }

    private final WebSocketOptions options;
    private final Object listenerLock = new Object();

    // guarded by listenerLock
    private TransportListener listener;
    private final List<String> heldFrames = new ArrayList<>();
    private boolean closeNotified;

    private EventLoopGroup group;
    private Channel channel;
    private volatile boolean open;

    private WebSocketTransport(WebSocketOptions options) {
        this.options = options;
    }

    private void doConnect() {
        URI uri = options.getUri();
        String host = uri.getHost();
        int port = portOf(uri);
        SslContext sslContext = isSecure(uri) ? buildSslContext() : null;

        HttpHeaders headers = new DefaultHttpHeaders();
        for (Map.Entry<String, String> entry : options.getHeaders().entrySet()) {
            headers.add(entry.getKey(), entry.getValue());
        }
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, options.getMaxPayloadSize());
        WebSocketTransportHandler handler = new WebSocketTransportHandler(this, handshaker);

        group = new MultiThreadIoEventLoopGroup(1, daemonThreadFactory("cdp-ws-"), NioIoHandler.newFactory());
        long timeoutMillis = options.getConnectTimeout().toMillis();
        try {
            Bootstrap bootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
                    .handler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ChannelPipeline p = ch.pipeline();
                            if (sslContext != null) {
                                p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                            }
                            p.addLast(new HttpClientCodec());
                            p.addLast(new HttpObjectAggregator(options.getMaxPayloadSize()));
                            p.addLast(handler);
                        }
                    });
            channel = bootstrap.connect(host, port).sync().channel();
            if (!handler.getHandshakeFuture().await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new TransportException(TransportException.Type.CONNECT_FAILED,
                        "websocket handshake timed out after " + timeoutMillis + "ms: " + uri);
            }
            if (!handler.getHandshakeFuture().isSuccess()) {
                Throwable cause = handler.getHandshakeFuture().cause();
                throw new TransportException(TransportException.Type.CONNECT_FAILED,
                        "websocket handshake failed: " + cause.getMessage(), cause);
            }
            open = true;
            logger.debug("websocket connected: {}", uri);
        } catch (TransportException e) {
            abort();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "connection interrupted", e);
        } catch (Exception e) {
            abort();
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "connection failed: " + e.getMessage(), e);
        }
    }

    private SslContext buildSslContext() {
        SslContextBuilder builder = SslContextBuilder.forClient();
        if (options.isTrustAllCerts()) {
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        }
        try {
            return builder.build();
        } catch (SSLException e) {
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "SSL context creation failed", e);
        }
    }

    private void abort() {
        if (channel != null) {
            channel.close();
        }
        group.shutdownGracefully();
    }

    @Override
    public void start(TransportListener listener) {
        List<String> held;
        boolean replayClose;
        synchronized (listenerLock) {
            if (this.listener != null) {
                throw new IllegalStateException("transport already started: " + getEndpoint());
            }
            this.listener = listener;
            held = new ArrayList<>(heldFrames);
            heldFrames.clear();
            replayClose = closeNotified;
            // frames held before start go out ahead of anything the event loop delivers next
            for (String frame : held) {
                listener.onFrame(frame);
            }
        }
        if (!held.isEmpty()) {
            logger.debug("replayed {} frame(s) received before start", held.size());
        }
        if (replayClose) {
            logger.debug("websocket closed before start: {}", getEndpoint());
            listener.onClosed();
        }
    }

    @Override
    public boolean isOpen() {
        return open && channel != null && channel.isActive();
    }

    @Override
    public String getEndpoint() {
        return options.getUri().toString();
    }

    public WebSocketOptions getOptions() {
        return options;
    }

    @Override
    public void send(String frame) {
        if (!isOpen()) {
            throw new TransportException(TransportException.Type.CONNECTION_CLOSED, "websocket is not open");
        }
        channel.writeAndFlush(new TextWebSocketFrame(frame)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.error("send failed: {}", future.cause().getMessage());
                handleError(new TransportException(TransportException.Type.SEND_FAILED, "send failed", future.cause()));
            }
        });
    }

    @Override
    public void close() {
        open = false;
        if (channel != null && channel.isOpen()) {
            channel.writeAndFlush(new CloseWebSocketFrame())
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            handleDisconnect();
        }
    }

    // Internal callbacks from handler, all on the channel's event loop

    void handleFrame(String text) {
        TransportListener current;
        synchronized (listenerLock) {
            current = listener;
            if (current == null) {
                heldFrames.add(text);
                return;
            }
        }
        current.onFrame(text);
    }

    void handleDisconnect() {
        open = false;
        TransportListener current;
        synchronized (listenerLock) {
            if (closeNotified) {
                return;
            }
            closeNotified = true;
            current = listener;
        }
        if (current != null) {
            current.onClosed();
        }
        group.shutdownGracefully();
    }

    void handleError(Throwable cause) {
        TransportListener current;
        synchronized (listenerLock) {
            current = listener;
        }
        if (current != null) {
            current.onError(cause);
        } else {
            logger.debug("websocket error before start: {}", cause.getMessage());
        }
    }

}
