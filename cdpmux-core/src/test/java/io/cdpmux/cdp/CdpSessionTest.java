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

import io.cdpmux.transport.FakeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class CdpSessionTest {

    private FakeTransport transport;
    private CdpConnection connection;
    private CdpSession session;

    @BeforeEach
    void beforeEach() {
        transport = new FakeTransport();
        connection = CdpConnection.create(transport, CdpOptions.builder().waitTimeout(5000).build());
        session = connection.attach("S1", "T1", "page");
    }

    @AfterEach
    void afterEach() {
        connection.dispose();
    }

    private static Throwable failure(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void testWaitForEventResolvesOnMatch() throws Exception {
        CompletableFuture<CdpEvent> future = session.waitForEvent("Network.requestWillBeSent",
                e -> "https://example.com/b".equals(e.getAsString("request.url")), Duration.ofSeconds(5));
        transport.emit("S1", "Network.requestWillBeSent", Map.of("request", Map.of("url", "https://example.com/a")));
        transport.emit("S1", "Network.requestWillBeSent", Map.of("request", Map.of("url", "https://example.com/b")));
        CdpEvent event = future.get(5, TimeUnit.SECONDS);
        assertEquals("https://example.com/b", event.getAsString("request.url"));
        assertEquals(0, session.getPendingWaiterCount());
    }

    @Test
    void testWaitersOnOtherSessionsNotMatched() {
        CdpSession other = connection.attach("S2", "T2", "page");
        CompletableFuture<CdpEvent> future = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofMillis(300));
        transport.emit("S2", "Page.loadEventFired", Map.of());
        assertInstanceOf(CdpTimeoutException.class, failure(future));
        assertFalse(other.isClosed());
    }

    @Test
    void testMatchedBeforeCloseKeepsEvent() throws Exception {
        CompletableFuture<CdpEvent> future = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(5));
        transport.emit("S1", "Page.loadEventFired", Map.of("timestamp", 42));
        CdpEvent event = future.get(5, TimeUnit.SECONDS);
        session.close(CloseReason.EXPLICIT_CLOSE);
        assertEquals(42, event.getAsInt("timestamp"));
        assertFalse(future.isCompletedExceptionally());
    }

    @Test
    void testWaitRejectedOnClose() {
        CompletableFuture<CdpEvent> future = session.waitForEvent("Network.responseReceived", e -> true, Duration.ofSeconds(30));
        session.close(CloseReason.EXPLICIT_CLOSE);
        TargetClosedException e = assertInstanceOf(TargetClosedException.class, failure(future));
        assertEquals(CloseReason.EXPLICIT_CLOSE, e.getCloseReason());
        assertEquals("Target closed while waiting for Network.responseReceived. (closed by client)", e.getMessage());
        assertFalse(e.getMessage().contains("Timeout"));
        assertEquals(0, session.getPendingWaiterCount());
    }

    @Test
    void testWaitTimesOut() {
        CompletableFuture<CdpEvent> future = session.waitFor("load", e -> e.is("Page.loadEventFired"), Duration.ofMillis(100));
        CdpTimeoutException e = assertInstanceOf(CdpTimeoutException.class, failure(future));
        assertEquals("Timeout of 100ms exceeded waiting for load", e.getMessage());
        assertEquals(Duration.ofMillis(100), e.getTimeout());
        assertFalse(session.isClosed());
    }

    @Test
    void testDefaultWaitTimeoutFromOptions() {
        CdpConnection quick = CdpConnection.create(new FakeTransport(), CdpOptions.builder().waitTimeout(100).build());
        try {
            CompletableFuture<CdpEvent> future = quick.getRootSession().waitForEvent(e -> false, null);
            CdpTimeoutException e = assertInstanceOf(CdpTimeoutException.class, failure(future));
            assertEquals(Duration.ofMillis(100), e.getTimeout());
        } finally {
            quick.dispose();
        }
    }

    @Test
    void testZeroTimeoutWaitsUntilClose() throws Exception {
        CompletableFuture<CdpEvent> future = session.waitForEvent(e -> false, Duration.ZERO);
        Thread.sleep(200);
        assertFalse(future.isDone());
        session.closeAsync(CloseReason.TARGET_DETACHED);
        assertEquals(CloseReason.TARGET_DETACHED,
                assertInstanceOf(TargetClosedException.class, failure(future)).getCloseReason());
    }

    @Test
    void testPredicateExceptionRejectsOnlyThatWaiter() throws Exception {
        CompletableFuture<CdpEvent> broken = session.waitForEvent(e -> {
            throw new IllegalArgumentException("bad predicate");
        }, Duration.ofSeconds(5));
        CompletableFuture<CdpEvent> healthy = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(5));
        transport.emit("S1", "Page.loadEventFired", Map.of());
        assertInstanceOf(IllegalArgumentException.class, failure(broken));
        assertNotNull(healthy.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testWaitAfterCloseFailsImmediately() {
        session.close(CloseReason.EXPLICIT_CLOSE);
        CompletableFuture<CdpEvent> future = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(5));
        assertTrue(future.isCompletedExceptionally());
        assertInstanceOf(TargetClosedException.class, failure(future));
    }

    @Test
    void testCloseTwiceFromTwoThreads() throws Exception {
        AtomicInteger notified = new AtomicInteger();
        session.onClose(reason -> notified.incrementAndGet());
        CompletableFuture<CdpResponse> command = session.method("Runtime.evaluate").sendAsync();
        CompletableFuture<CdpEvent> wait = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(30));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> closers = new ArrayList<>();
            for (CloseReason reason : List.of(CloseReason.EXPLICIT_CLOSE, CloseReason.TARGET_DETACHED)) {
                closers.add(pool.submit(() -> {
                    start.await();
                    session.close(reason);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> closer : closers) {
                closer.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        CloseReason recorded = session.getCloseReason();
        assertNotNull(recorded);
        assertEquals(1, notified.get());
        assertEquals(recorded, assertInstanceOf(TargetClosedException.class, failure(command)).getCloseReason());
        assertEquals(recorded, assertInstanceOf(TargetClosedException.class, failure(wait)).getCloseReason());
        assertEquals(recorded, session.getCloseFuture().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testSessionCloseRejectsOnlyItsOwnCommands() throws Exception {
        CdpSession other = connection.attach("S2", "T2", "page");
        CompletableFuture<CdpResponse> mine = session.method("Runtime.evaluate").sendAsync();
        CompletableFuture<CdpResponse> theirs = other.method("Runtime.evaluate").sendAsync();
        int theirsId = transport.lastId("Runtime.evaluate");

        session.close(CloseReason.EXPLICIT_CLOSE);

        assertInstanceOf(TargetClosedException.class, failure(mine));
        assertFalse(theirs.isDone());
        assertFalse(connection.isClosed());
        assertEquals(1, connection.getPendingCommandCount());
        transport.respond(theirsId, Map.of("result", Map.of("value", 1)));
        assertEquals(1, theirs.get(5, TimeUnit.SECONDS).getResultAsInt("result.value"));
    }

    @Test
    void testSessionsDescribeThemselves() {
        assertEquals("CdpSession[root]", connection.getRootSession().toString());
        assertEquals("CdpSession[S1 page:T1]", session.toString());
    }

    @Test
    void testHandlerSubscribedTwiceSeesEventOnce() throws Exception {
        List<String> seen = new ArrayList<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        Consumer<CdpEvent> handler = e -> {
            seen.add(e.getMethod());
            if (e.is("Test.done")) {
                done.complete(null);
            }
        };
        session.on("Page.loadEventFired", handler);
        session.on("Page.loadEventFired", handler);
        session.onAny(handler);

        transport.emit("S1", "Page.loadEventFired", Map.of());
        transport.emit("S1", "Test.done", Map.of());
        done.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("Page.loadEventFired", "Test.done"), seen);
    }

    @Test
    void testSendAfterCloseFailsWithoutWrite() {
        session.close(CloseReason.EXPLICIT_CLOSE);
        int written = transport.getSentFrames().size();
        CompletableFuture<CdpResponse> future = session.send("Runtime.evaluate", Map.of("expression", "1"));
        assertTrue(future.isCompletedExceptionally());
        assertEquals("Protocol error (Runtime.evaluate): Target closed. (closed by client)",
                failure(future).getMessage());
        assertEquals(written, transport.getSentFrames().size());
    }

    @Test
    void testOnCloseFiresAfterWaitersRejected() throws Exception {
        CompletableFuture<CdpResponse> command = session.method("Page.navigate").sendAsync();
        CompletableFuture<CdpEvent> wait = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(30));
        CompletableFuture<Boolean> settledFirst = new CompletableFuture<>();
        session.onClose(reason -> settledFirst.complete(command.isDone() && wait.isDone()));
        session.closeAsync(CloseReason.EXPLICIT_CLOSE);
        assertTrue(settledFirst.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testOnCloseAfterCloseFiresImmediately() {
        session.close(CloseReason.EXPLICIT_CLOSE);
        List<CloseReason> reasons = new ArrayList<>();
        session.onClose(reasons::add);
        assertEquals(List.of(CloseReason.EXPLICIT_CLOSE), reasons);
    }

    @Test
    void testEventsAfterCloseDiscarded() throws Exception {
        AtomicInteger received = new AtomicInteger();
        session.on("Page.loadEventFired", e -> received.incrementAndGet());
        session.close(CloseReason.EXPLICIT_CLOSE);
        transport.emit("S1", "Page.loadEventFired", Map.of());
        CompletableFuture<CdpEvent> marker = connection.waitForEvent("Test.marker", e -> true, Duration.ofSeconds(5));
        transport.emit("Test.marker", Map.of());
        marker.get(5, TimeUnit.SECONDS);
        assertEquals(0, received.get());
    }

    @Test
    void testHandlersInRegistrationOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        session.on("Page.frameNavigated", e -> calls.add("first"));
        session.on("Page.frameNavigated", e -> {
            throw new IllegalStateException("handler failure");
        });
        session.on("Page.frameNavigated", e -> calls.add("third"));
        session.onAny(e -> {
            calls.add("any");
            done.complete(null);
        });
        transport.emit("S1", "Page.frameNavigated", Map.of());
        done.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("first", "third", "any"), calls);
    }

    @Test
    void testOffRemovesHandler() throws Exception {
        AtomicInteger count = new AtomicInteger();
        Consumer<CdpEvent> handler = e -> count.incrementAndGet();
        session.on("Page.loadEventFired", handler);
        session.off("Page.loadEventFired", handler);
        CompletableFuture<CdpEvent> seen = session.waitForEvent("Page.loadEventFired", e -> true, Duration.ofSeconds(5));
        transport.emit("S1", "Page.loadEventFired", Map.of());
        seen.get(5, TimeUnit.SECONDS);
        assertEquals(0, count.get());
    }

    @Test
    void testCloseLeavesConnectionOpen() {
        session.close(CloseReason.EXPLICIT_CLOSE);
        assertTrue(session.isClosed());
        assertFalse(connection.isClosed());
        assertNull(connection.getSession("S1"));
    }

    @Test
    void testToString() {
        assertEquals("CdpSession[S1 page:T1]", session.toString());
        assertEquals("CdpSession[root]", connection.getRootSession().toString());
    }

}
