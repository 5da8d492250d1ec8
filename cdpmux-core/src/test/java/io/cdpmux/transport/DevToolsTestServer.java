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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import net.minidev.json.JSONValue;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Minimal DevTools-like WebSocket endpoint. Every command is answered with its own method name;
 * {@code Test.emit} first pushes a {@code Test.fired} event and {@code Test.disconnect} drops the socket.
 */
public class DevToolsTestServer implements AutoCloseable {

    public static final String PATH = "/devtools/browser/test";

    private final EventLoopGroup group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    private final List<Channel> clients = new CopyOnWriteArrayList<>();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final Channel serverChannel;

    public DevToolsTestServer() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clients.add(ch);
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler(PATH));
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
                                handle(ctx, frame.text());
                            }
                        });
                    }
                });
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
    }

    @SuppressWarnings("unchecked")
    private void handle(ChannelHandlerContext ctx, String text) {
        received.add(text);
        Map<String, Object> command = (Map<String, Object>) JSONValue.parse(text);
        String method = (String) command.get("method");
        if ("Test.disconnect".equals(method)) {
            ctx.close();
            return;
        }
        if ("Test.emit".equals(method)) {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("method", "Test.fired");
            event.put("params", Map.of("url", "https://example.com/a"));
            ctx.writeAndFlush(new TextWebSocketFrame(JSONValue.toJSONString(event)));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", command.get("id"));
        response.put("result", Map.of("method", method));
        ctx.writeAndFlush(new TextWebSocketFrame(JSONValue.toJSONString(response)));
    }

    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String getUrl() {
        return "ws://127.0.0.1:" + getPort() + PATH;
    }

    public List<String> getReceived() {
        return received;
    }

    public void dropClients() {
        for (Channel client : clients) {
            client.close();
        }
    }

    @Override
    public void close() {
        dropClients();
        serverChannel.close().syncUninterruptibly();
        group.shutdownGracefully();
    }

}
