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
package io.cdpmux.cdp;

import io.cdpmux.transport.DevToolsTestServer;
import io.cdpmux.transport.WebSocketTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CdpConnectionWebSocketTest {

    private DevToolsTestServer server;
    private CdpConnection connection;

    @BeforeEach
    void beforeEach() throws Exception {
        server = new DevToolsTestServer();
        connection = CdpConnection.connect(server.getUrl());
    }

    @AfterEach
    void afterEach() {
        connection.dispose();
        server.close();
    }

    @Test
    void testRoundTrip() {
        CdpResponse response = connection.method("Browser.getVersion").send();
        assertEquals("Browser.getVersion", response.getResultAsString("method"));
        assertEquals(server.getUrl(), connection.getEndpoint());
    }

    @Test
    void testEventBeforeResponse() throws Exception {
        CompletableFuture<CdpEvent> fired = connection.waitForEvent("Test.fired", e -> true, Duration.ofSeconds(5));
        connection.method("Test.emit").send();
        assertTrue(fired.isDone());
        assertEquals("https://example.com/a", fired.get().getAsString("url"));
    }

    @Test
    void testServerDropClosesConnection() throws Exception {
        CompletableFuture<CdpResponse> pending = connection.method("Test.disconnect").sendAsync();
        assertEquals(CloseReason.TRANSPORT_CLOSED, connection.getCloseFuture().get(5, TimeUnit.SECONDS));
        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        TargetClosedException closed = assertInstanceOf(TargetClosedException.class, e.getCause());
        assertEquals("Protocol error (Test.disconnect): Target closed. (connection closed)", closed.getMessage());
    }

    @Test
    void testSocketDroppedBeforeConnectionStartsIsNotLost() throws Exception {
        WebSocketTransport transport = WebSocketTransport.connect(server.getUrl());
        transport.send("{\"id\":1,\"method\":\"Test.disconnect\"}");
        long deadline = System.currentTimeMillis() + 5000;
        while (transport.isOpen() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        CdpConnection late = CdpConnection.create(transport, CdpOptions.builder().build());
        try {
            CompletableFuture<CdpEvent> waiting = late.waitForEvent("Test.fired", e -> true, Duration.ZERO);
            assertEquals(CloseReason.TRANSPORT_CLOSED, late.getCloseFuture().get(5, TimeUnit.SECONDS));
            ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TargetClosedException.class, e.getCause());
            ExecutionException sendFailure = assertThrows(ExecutionException.class,
                    () -> late.method("Browser.getVersion").sendAsync().get(5, TimeUnit.SECONDS));
            assertInstanceOf(TargetClosedException.class, sendFailure.getCause());
            assertEquals(1, server.getReceived().size());
        } finally {
            late.dispose();
        }
    }

    @Test
    void testDisposeClosesSocket() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> connection.dispose());
        assertTrue(connection.isClosed());
        assertFalse(connection.getTransport().isOpen());
    }

}
