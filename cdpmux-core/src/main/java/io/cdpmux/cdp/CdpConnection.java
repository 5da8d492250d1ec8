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

import io.cdpmux.transport.Transport;
import io.cdpmux.transport.TransportListener;
import io.cdpmux.transport.WebSocketTransport;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * One control connection to a DevTools endpoint, multiplexing every attached target session.
 * <p>
 * Inbound frames are processed one at a time, in transport order, on a dedicated receive loop
 * thread: a response resolves the command waiter with its id, an event goes to the session named
 * by its {@code sessionId} (or to the root session). Commands may be sent from any thread; writes
 * are serialized. Closing, whether asked for or caused by the transport going away, flips the state
 * at once and then sweeps every session and waiter on the receive loop.
 */
public class CdpConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CdpConnection.class);

    private static final ThreadLocal<CdpConnection> RECEIVE_LOOP = new ThreadLocal<>();
    private static final AtomicInteger LOOP_COUNTER = new AtomicInteger();
    private static final int MAX_DETACHED_SESSION_IDS = 1024;

    // Factory methods

    public static CdpConnection connect(String webSocketUrl) {
        return connect(webSocketUrl, CdpOptions.builder().build());
    }

    public static CdpConnection connect(String webSocketUrl, CdpOptions options) {
        Transport transport = WebSocketTransport.connect(options.toWebSocketOptions(webSocketUrl));
        return create(transport, options);
    }

    public static CdpConnection create(Transport transport, CdpOptions options) {
        CdpConnection connection = new CdpConnection(transport, options);
        transport.start(connection.new Listener());
        return connection;
    }

    /**
     * The connection whose receive loop is the current thread, or null.
     */
    static CdpConnection currentReceiveLoop() {
        return RECEIVE_LOOP.get();
    }

    private final Transport transport;
    private final CdpOptions options;
    private final AtomicInteger idGenerator = new AtomicInteger();
    private final CommandRegistry commands = new CommandRegistry();
    private final ConcurrentHashMap<String, CdpSession> sessions = new ConcurrentHashMap<>();
    // most recent detaches only, enough to cover an attach reply still in flight
    private final Set<String> detachedSessionIds = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > MAX_DETACHED_SESSION_IDS;
                }
            }));
    private final CdpSession rootSession;
    private final CloseState closeState;
    private final ExecutorService receiveLoop;
    private final Object writeLock = new Object();

    private CdpConnection(Transport transport, CdpOptions options) {
        this.transport = transport;
        this.options = options;
        this.closeState = new CloseState("CdpConnection[" + transport.getEndpoint() + "]");
        this.rootSession = new CdpSession(this, null, null, "browser");
        String threadName = "cdp-receive-" + LOOP_COUNTER.incrementAndGet();
        this.receiveLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(() -> {
                RECEIVE_LOOP.set(this);
                r.run();
            }, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    private class Listener implements TransportListener {

        @Override
        public void onFrame(String frame) {
            try {
                receiveLoop.execute(() -> handleFrame(frame));
            } catch (RejectedExecutionException e) {
                logger.debug("discarding frame received after close of {}", getEndpoint());
            }
        }

        @Override
        public void onClosed() {
            closeAsync(CloseReason.TRANSPORT_CLOSED);
        }

        @Override
        public void onError(Throwable error) {
            logger.error("transport error on {}: {}", getEndpoint(), error.getMessage());
            closeAsync(CloseReason.TRANSPORT_ERROR);
        }

    }

    // Receive loop

    @SuppressWarnings("unchecked")
    private void handleFrame(String json) {
        logger.trace("<<< {}", json);
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (Exception e) {
            logger.error("failed to parse CDP message: {}", e.getMessage());
            return;
        }
        if (!(parsed instanceof Map)) {
            logger.warn("ignoring non-object frame: {}", json);
            return;
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        try {
            if (map.get("id") != null) {
                handleResponse(new CdpResponse(map));
            } else if (map.containsKey("method")) {
                handleEvent(new CdpEvent(map));
            } else {
                logger.warn("ignoring frame with neither id nor method: {}", json);
            }
        } catch (RuntimeException e) {
            logger.error("failed to dispatch CDP message: {} - {}", e.getMessage(), abbreviate(json), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() > 200 ? json.substring(0, 200) + "..." : json;
    }

    private void handleResponse(CdpResponse response) {
        CommandWaiter waiter = commands.claim(response.getId());
        if (waiter == null) {
            logger.debug("discarding response for unknown or cancelled command id: {}", response.getId());
            return;
        }
        if (response.isError()) {
            waiter.reject(new ProtocolException(waiter.getMethod(), response));
        } else {
            waiter.resolve(response);
        }
    }

    private void handleEvent(CdpEvent event) {
        if (event.is("Target.attachedToTarget")) {
            String sessionId = event.getAsString("sessionId");
            if (sessionId != null) {
                attach(sessionId, event.getAsString("targetInfo.targetId"), event.getAsString("targetInfo.type"));
            }
        }
        String sessionId = event.getSessionId();
        CdpSession session = sessionId == null ? rootSession : sessions.get(sessionId);
        if (session == null) {
            logger.warn("discarding {} for unknown session {}", event.getMethod(), sessionId);
        } else {
            session.dispatch(event);
        }
        if (event.is("Target.detachedFromTarget")) {
            String detachedId = event.getAsString("sessionId");
            CdpSession detached = detachedId == null ? null : sessions.get(detachedId);
            if (detached != null) {
                detached.closeAsync(CloseReason.TARGET_DETACHED);
            }
        }
    }

    void runOnReceiveLoop(Runnable task) {
        if (RECEIVE_LOOP.get() == this) {
            task.run();
            return;
        }
        try {
            receiveLoop.execute(task);
        } catch (RejectedExecutionException e) {
            // loop already gone, nothing left to race with
            task.run();
        }
    }

    public boolean isReceiveLoop() {
        return RECEIVE_LOOP.get() == this;
    }

    // Sessions

    /**
     * Registers a target session, or returns the one already registered under that id.
     * A session that already detached, or any session once the connection is closed, comes back closed.
     */
    public CdpSession attach(String sessionId, String targetId, String targetType) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        CloseReason closed = closeState.getReason();
        if (closed != null) {
            return closedSession(sessionId, targetId, targetType, closed);
        }
        if (detachedSessionIds.contains(sessionId)) {
            return closedSession(sessionId, targetId, targetType, CloseReason.TARGET_DETACHED);
        }
        CdpSession session = sessions.computeIfAbsent(sessionId, id -> {
            logger.debug("attached session {} to {} {}", id, targetType, targetId);
            return new CdpSession(this, id, targetId, targetType);
        });
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            session.closeAsync(reason);
        }
        return session;
    }

    private CdpSession closedSession(String sessionId, String targetId, String targetType, CloseReason reason) {
        CdpSession stale = new CdpSession(this, sessionId, targetId, targetType);
        stale.closeAsync(reason);
        return stale;
    }

    void unroute(CdpSession session) {
        if (session.isRoot()) {
            return;
        }
        sessions.remove(session.getSessionId(), session);
        if (!closeState.isClosed()) {
            detachedSessionIds.add(session.getSessionId());
        }
    }

    public CdpSession getRootSession() {
        return rootSession;
    }

    public CdpSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public Collection<CdpSession> getSessions() {
        return new ArrayList<>(sessions.values());
    }

    // Commands

    /**
     * Browser-level command, not bound to any target session.
     */
    public CdpMessage method(String method) {
        return rootSession.method(method);
    }

    /**
     * @param sessionId null for the browser-level channel
     */
    public CompletableFuture<CdpResponse> send(String sessionId, String method, Map<String, Object> params) {
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand(method, reason));
        }
        if (sessionId == null) {
            return rootSession.send(method, params);
        }
        CdpSession session = sessions.get(sessionId);
        if (session != null) {
            return session.send(method, params);
        }
        if (detachedSessionIds.contains(sessionId)) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand(method, CloseReason.TARGET_DETACHED));
        }
        return CompletableFuture.failedFuture(new IllegalArgumentException("unknown session: " + sessionId));
    }

    CompletableFuture<CdpResponse> sendAsync(CdpMessage message, CdpSession session) {
        String method = message.getMethod();
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand(method, reason));
        }
        CommandWaiter waiter = new CommandWaiter(idGenerator.incrementAndGet(), method);
        commands.register(waiter);
        session.track(waiter);
        CloseReason raced = closeState.getReason();
        if (raced != null && commands.claim(waiter)) {
            waiter.reject(TargetClosedException.forCommand(method, raced));
        }
        if (waiter.getFuture().isDone()) {
            return waiter.getFuture();
        }
        if (message.getTimeout() != null) {
            waiter.setDeadline(CdpExecutors.timer().schedule(() -> {
                if (commands.claim(waiter)) {
                    logger.debug("CDP request {} ({}) timed out", waiter.getId(), method);
                    waiter.reject(new CdpTimeoutException(message.getTimeout(), method));
                }
            }, message.getTimeout().toMillis(), TimeUnit.MILLISECONDS));
        }
        String json = message.toJson(waiter.getId());
        try {
            synchronized (writeLock) {
                logger.trace(">>> {}", json);
                transport.send(json);
            }
        } catch (RuntimeException e) {
            logger.error("failed to write {} to {}: {}", message, getEndpoint(), e.getMessage());
            closeAsync(CloseReason.TRANSPORT_ERROR);
            if (commands.claim(waiter)) {
                waiter.reject(TargetClosedException.forCommand(method, closeState.getReason()));
            }
        }
        return waiter.getFuture();
    }

    void forget(CommandWaiter waiter) {
        commands.claim(waiter);
    }

    // Browser-level events

    public void on(String method, Consumer<CdpEvent> handler) {
        rootSession.on(method, handler);
    }

    public void off(String method, Consumer<CdpEvent> handler) {
        rootSession.off(method, handler);
    }

    public void onAny(Consumer<CdpEvent> handler) {
        rootSession.onAny(handler);
    }

    public CompletableFuture<CdpEvent> waitForEvent(String method, Predicate<CdpEvent> predicate, Duration timeout) {
        return rootSession.waitForEvent(method, predicate, timeout);
    }

    // Lifecycle

    public boolean isClosed() {
        return closeState.isClosed();
    }

    public CloseReason getCloseReason() {
        return closeState.getReason();
    }

    /**
     * Fired exactly once, after every session and command has been swept.
     */
    public void onClose(Consumer<CloseReason> listener) {
        closeState.onClose(listener);
    }

    public CompletableFuture<CloseReason> getCloseFuture() {
        return closeState.getFuture();
    }

    /**
     * Marks the connection closed at once, so every later send fails without writing, then sweeps on
     * the receive loop after the frames already queued. Idempotent: the first reason wins.
     */
    public CompletableFuture<CloseReason> closeAsync(CloseReason reason) {
        if (closeState.trySet(reason)) {
            if (reason.isTransportFault()) {
                logger.debug("connection to {} lost: {}", getEndpoint(), reason);
            } else {
                logger.debug("closing connection to {}: {}", getEndpoint(), reason);
            }
            runOnReceiveLoop(this::sweep);
        }
        return closeState.getFuture();
    }

    /**
     * Synchronous close: returns once the sweep has completed.
     */
    public void dispose() {
        CompletableFuture<CloseReason> future = closeAsync(CloseReason.EXPLICIT_CLOSE);
        if (SyncBridge.isReceiveLoop()) {
            // on our own loop the sweep already ran inline, on another loop blocking would stall it
            return;
        }
        SyncBridge.await(future, options.getCloseTimeout(), "close of " + getEndpoint());
    }

    @Override
    public void close() {
        dispose();
    }

    private void sweep() {
        CloseReason reason = closeState.getReason();
        for (CdpSession session : sessions.values()) {
            session.closeAsync(reason);
        }
        rootSession.closeAsync(reason);
        detachedSessionIds.clear();
        for (CommandWaiter waiter : commands.claimAll()) {
            waiter.reject(TargetClosedException.forCommand(waiter.getMethod(), reason));
        }
        try {
            transport.close();
        } catch (Exception e) {
            logger.warn("error closing transport {}: {}", getEndpoint(), e.getMessage());
        }
        closeState.complete();
        receiveLoop.shutdown();
        logger.debug("connection to {} closed: {}", getEndpoint(), reason);
    }

    // Accessors

    public String getEndpoint() {
        return transport.getEndpoint();
    }

    public CdpOptions getOptions() {
        return options;
    }

    public Transport getTransport() {
        return transport;
    }

    int getPendingCommandCount() {
        return commands.size();
    }

    int getDetachedSessionCount() {
        return detachedSessionIds.size();
    }

    @Override
    public String toString() {
        return closeState.toString();
    }

}
