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
package io.cdpmux.browser;

import io.cdpmux.cdp.CdpConnection;
import io.cdpmux.cdp.CdpEvent;
import io.cdpmux.cdp.CdpException;
import io.cdpmux.cdp.CdpExecutors;
import io.cdpmux.cdp.CdpMessage;
import io.cdpmux.cdp.CdpResponse;
import io.cdpmux.cdp.CdpSession;
import io.cdpmux.cdp.CloseReason;
import io.cdpmux.cdp.CloseState;
import io.cdpmux.cdp.SyncBridge;
import io.cdpmux.cdp.TargetClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A page target and its session. The page closes exactly when its session does, so every
 * command and wait issued through it is rejected before the page reports itself closed.
 */
public class Page implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Page.class);

    private final BrowserContext context;
    private final CdpSession session;
    private final String targetId;
    private final CloseState closeState;

    Page(BrowserContext context, CdpSession session, String targetId) {
        this.context = context;
        this.session = session;
        this.targetId = targetId;
        this.closeState = new CloseState("Page[" + targetId + "]");
        session.onClose(this::onSessionClosed);
    }

    private void onSessionClosed(CloseReason reason) {
        closeState.trySet(reason);
        if (closeState.complete()) {
            logger.debug("page {} closed: {}", targetId, closeState.getReason());
        }
    }

    public String getTargetId() {
        return targetId;
    }

    public CdpSession getSession() {
        return session;
    }

    public BrowserContext getBrowserContext() {
        return context;
    }

    public Browser getBrowser() {
        return context.getBrowser();
    }

    // Commands

    public CdpMessage method(String method) {
        return session.method(method);
    }

    public CompletableFuture<CdpResponse> sendAsync(String method, Map<String, Object> params) {
        return session.send(method, params);
    }

    public CdpResponse send(String method, Map<String, Object> params) {
        SyncBridge.checkNotReceiveLoop(method);
        return SyncBridge.join(sendAsync(method, params), method);
    }

    // Waits

    public CompletableFuture<CdpEvent> waitForEventAsync(String method, Predicate<CdpEvent> predicate, Duration timeout) {
        return session.waitForEvent(method, predicate, timeout);
    }

    public CdpEvent waitForEvent(String method, Predicate<CdpEvent> predicate, Duration timeout) {
        SyncBridge.checkNotReceiveLoop(method);
        return SyncBridge.join(waitForEventAsync(method, predicate, timeout), method);
    }

    public CompletableFuture<CdpEvent> waitForRequestAsync(String url, Duration timeout) {
        return waitForRequestAsync(request -> url.equals(request.getAsString("request.url")), timeout);
    }

    /**
     * Completes with the first {@code Network.requestWillBeSent} event matching the predicate.
     */
    public CompletableFuture<CdpEvent> waitForRequestAsync(Predicate<CdpEvent> predicate, Duration timeout) {
        return session.waitFor("request", e -> e.is("Network.requestWillBeSent") && predicate.test(e), timeout);
    }

    public CdpEvent waitForRequest(String url, Duration timeout) {
        SyncBridge.checkNotReceiveLoop("request " + url);
        return SyncBridge.join(waitForRequestAsync(url, timeout), "request " + url);
    }

    public CompletableFuture<CdpEvent> waitForResponseAsync(String url, Duration timeout) {
        return waitForResponseAsync(response -> url.equals(response.getAsString("response.url")), timeout);
    }

    /**
     * Completes with the first {@code Network.responseReceived} event matching the predicate.
     */
    public CompletableFuture<CdpEvent> waitForResponseAsync(Predicate<CdpEvent> predicate, Duration timeout) {
        return session.waitFor("response", e -> e.is("Network.responseReceived") && predicate.test(e), timeout);
    }

    public CdpEvent waitForResponse(String url, Duration timeout) {
        SyncBridge.checkNotReceiveLoop("response " + url);
        return SyncBridge.join(waitForResponseAsync(url, timeout), "response " + url);
    }

    public void on(String method, Consumer<CdpEvent> handler) {
        session.on(method, handler);
    }

    // Lifecycle

    public boolean isClosed() {
        return closeState.isClosed();
    }

    public CloseReason getCloseReason() {
        return closeState.getReason();
    }

    public void onClose(Consumer<CloseReason> listener) {
        closeState.onClose(listener);
    }

    public CompletableFuture<Void> closeAsync() {
        return closeAsync(false);
    }

    /**
     * Asks the browser to close the target. Completes once the target's session has detached and
     * every pending operation of the page has been rejected. With {@code runBeforeUnload} the page
     * may stay open (a beforeunload dialog can veto it), so only the request itself is awaited.
     */
    public CompletableFuture<Void> closeAsync(boolean runBeforeUnload) {
        if (closeState.isClosed()) {
            return closeState.getFuture().thenApply(r -> null);
        }
        CdpConnection connection = session.getConnection();
        if (runBeforeUnload) {
            return session.method("Page.close").sendAsync()
                    .thenApplyAsync(r -> null, CdpExecutors.close());
        }
        return connection.method("Target.closeTarget")
                .param("targetId", targetId)
                .sendAsync()
                .handle((response, error) -> {
                    Throwable cause = error == null ? null : SyncBridge.unwrap(error);
                    if (cause != null && !(cause instanceof TargetClosedException)) {
                        throw SyncBridge.unwrap(cause);
                    }
                    return null;
                })
                .thenCompose(ignored -> closeState.getFuture())
                .thenApplyAsync(r -> null, CdpExecutors.close());
    }

    /**
     * Closes the page and returns only when it is closed. If the browser does not confirm within
     * the close timeout, or this runs on a receive loop, the session is closed locally instead.
     */
    public void dispose() {
        if (closeState.isCompleted()) {
            return;
        }
        if (!SyncBridge.isReceiveLoop()) {
            Duration timeout = session.getConnection().getOptions().getCloseTimeout();
            try {
                SyncBridge.await(closeAsync(), timeout, "close of page " + targetId);
                return;
            } catch (CdpException e) {
                logger.warn("page {} did not close cleanly, closing locally: {}", targetId, e.getMessage());
            }
        }
        closeLocally(CloseReason.EXPLICIT_CLOSE);
    }

    @Override
    public void close() {
        dispose();
    }

    /**
     * Flips the page closed at once and sweeps its session without waiting for the browser.
     */
    void closeLocally(CloseReason reason) {
        closeState.trySet(reason);
        session.closeAsync(reason);
    }

    boolean isCloseCompleted() {
        return closeState.isCompleted();
    }

    @Override
    public String toString() {
        return closeState.toString();
    }

}
