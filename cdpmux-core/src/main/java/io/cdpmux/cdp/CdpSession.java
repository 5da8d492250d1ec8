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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Logical channel to one target over a shared {@link CdpConnection}.
 * <p>
 * The connection owns the session's routing entry; the session keeps a handle to the connection
 * only to route its commands. Commands issued here are also tracked locally so that closing the
 * session rejects exactly the commands that belong to it. The connection's own browser-level
 * channel is a session with a null session id.
 */
public class CdpSession {

    private static final Logger logger = LoggerFactory.getLogger(CdpSession.class);

    private final CdpConnection connection;
    private final String sessionId;
    private final String targetId;
    private final String targetType;
    private final CommandRegistry commands = new CommandRegistry();
    private final EventWaiterRegistry eventWaiters = new EventWaiterRegistry();
    private final CdpEventBus eventBus = new CdpEventBus();
    private final CloseState closeState;

    CdpSession(CdpConnection connection, String sessionId, String targetId, String targetType) {
        this.connection = connection;
        this.sessionId = sessionId;
        this.targetId = targetId;
        this.targetType = targetType;
        this.closeState = new CloseState(toString());
    }

    public CdpConnection getConnection() {
        return connection;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getTargetType() {
        return targetType;
    }

    public boolean isRoot() {
        return sessionId == null;
    }

    // Commands

    public CdpMessage method(String method) {
        return new CdpMessage(this, method);
    }

    public CompletableFuture<CdpResponse> send(String method, Map<String, Object> params) {
        return method(method).params(params).sendAsync();
    }

    public CompletableFuture<CdpResponse> sendAsync(CdpMessage message) {
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand(message.getMethod(), reason));
        }
        return connection.sendAsync(message, this);
    }

    void track(CommandWaiter waiter) {
        commands.register(waiter);
        waiter.getFuture().whenComplete((response, error) -> commands.claim(waiter));
        CloseReason reason = closeState.getReason();
        if (reason != null && commands.claim(waiter)) {
            connection.forget(waiter);
            waiter.reject(TargetClosedException.forCommand(waiter.getMethod(), reason));
        }
    }

    // Events

    public void on(String method, Consumer<CdpEvent> handler) {
        eventBus.on(method, handler);
    }

    public void off(String method, Consumer<CdpEvent> handler) {
        eventBus.off(method, handler);
    }

    public void offAll(String method) {
        eventBus.offAll(method);
    }

    public void onAny(Consumer<CdpEvent> handler) {
        eventBus.onAny(handler);
    }

    public void offAny(Consumer<CdpEvent> handler) {
        eventBus.offAny(handler);
    }

    /**
     * Completes with the first event matching the predicate, or exceptionally with
     * {@link CdpTimeoutException} when the deadline passes or {@link TargetClosedException}
     * when the session closes, whichever happens first.
     *
     * @param timeout null for the configured default, zero for no deadline
     */
    public CompletableFuture<CdpEvent> waitForEvent(Predicate<CdpEvent> predicate, Duration timeout) {
        return waitFor("event", predicate, timeout);
    }

    public CompletableFuture<CdpEvent> waitForEvent(String method, Predicate<CdpEvent> predicate, Duration timeout) {
        return waitFor(method, e -> e.is(method) && predicate.test(e), timeout);
    }

    public CompletableFuture<CdpEvent> waitFor(String description, Predicate<CdpEvent> predicate, Duration timeout) {
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forWait(description, reason));
        }
        Duration effective = timeout != null ? timeout : connection.getOptions().getDefaultWaitTimeout();
        CompletableFuture<CdpEvent> future = eventWaiters.register(description, predicate, effective);
        CloseReason raced = closeState.getReason();
        if (raced != null) {
            eventWaiters.rejectAll(waiter -> TargetClosedException.forWait(waiter.getDescription(), raced));
        }
        return future;
    }

    /**
     * Runs on the receive loop.
     */
    void dispatch(CdpEvent event) {
        if (closeState.isClosed()) {
            logger.debug("discarding {} for closed {}", event.getMethod(), this);
            return;
        }
        eventWaiters.dispatch(event);
        eventBus.publish(event);
    }

    // Lifecycle

    public boolean isClosed() {
        return closeState.isClosed();
    }

    public CloseReason getCloseReason() {
        return closeState.getReason();
    }

    /**
     * Fired exactly once, after this session's waiters have been rejected.
     */
    public void onClose(Consumer<CloseReason> listener) {
        closeState.onClose(listener);
    }

    public CompletableFuture<CloseReason> getCloseFuture() {
        return closeState.getFuture();
    }

    /**
     * Marks the session closed immediately; the sweep of its waiters runs on the receive loop.
     * Idempotent: only the first reason is recorded.
     */
    public CompletableFuture<CloseReason> closeAsync(CloseReason reason) {
        if (closeState.trySet(reason)) {
            logger.debug("closing {}: {}", this, reason);
            connection.runOnReceiveLoop(this::sweep);
        }
        return closeState.getFuture();
    }

    public void close(CloseReason reason) {
        CompletableFuture<CloseReason> future = closeAsync(reason);
        if (!SyncBridge.isReceiveLoop()) {
            SyncBridge.await(future, connection.getOptions().getCloseTimeout(), "close of " + this);
        }
    }

    /**
     * Rejects this session's own waiters, then signals detachment. Runs on the receive loop.
     */
    void sweep() {
        CloseReason reason = closeState.getReason();
        for (CommandWaiter waiter : commands.claimAll()) {
            connection.forget(waiter);
            waiter.reject(TargetClosedException.forCommand(waiter.getMethod(), reason));
        }
        eventWaiters.rejectAll(waiter -> TargetClosedException.forWait(waiter.getDescription(), reason));
        connection.unroute(this);
        if (closeState.complete()) {
            logger.debug("{} closed: {}", this, reason);
        }
        eventBus.clear();
    }

    int getPendingCommandCount() {
        return commands.size();
    }

    int getPendingWaiterCount() {
        return eventWaiters.size();
    }

    @Override
    public String toString() {
        return sessionId == null ? "CdpSession[root]" : "CdpSession[" + sessionId + " " + targetType + ":" + targetId + "]";
    }

}
