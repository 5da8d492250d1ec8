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
import io.cdpmux.cdp.CdpException;
import io.cdpmux.cdp.CdpExecutors;
import io.cdpmux.cdp.CdpOptions;
import io.cdpmux.cdp.CloseReason;
import io.cdpmux.cdp.CloseState;
import io.cdpmux.cdp.SyncBridge;
import io.cdpmux.cdp.TargetClosedException;
import io.cdpmux.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Top of the close cascade: a browser reached over one {@link CdpConnection}.
 * <p>
 * However the connection ends, by {@link #closeAsync()}, {@link #disconnect()} or the transport
 * dropping, the connection first rejects every session's waiters, then the browser marks each
 * context and page closed and finally reports itself closed. Launching the browser process is
 * left to the caller, who hands over a WebSocket URL or a transport.
 */
public class Browser implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Browser.class);

    private final CdpConnection connection;
    private final CdpOptions options;
    private final BrowserContext defaultContext;
    private final Map<String, BrowserContext> contexts = new ConcurrentHashMap<>();
    private final CloseState closeState;

    // Factory methods

    public static Browser connect(String webSocketUrl) {
        return connect(webSocketUrl, CdpOptions.builder().build());
    }

    public static Browser connect(String webSocketUrl, CdpOptions options) {
        return new Browser(CdpConnection.connect(webSocketUrl, options));
    }

    public static Browser create(Transport transport, CdpOptions options) {
        return new Browser(CdpConnection.create(transport, options));
    }

    public static Browser create(CdpConnection connection) {
        return new Browser(connection);
    }

    private Browser(CdpConnection connection) {
        this.connection = connection;
        this.options = connection.getOptions();
        this.closeState = new CloseState("Browser[" + connection.getEndpoint() + "]");
        this.defaultContext = new BrowserContext(this, null);
        connection.onClose(this::onConnectionClosed);
    }

    private void onConnectionClosed(CloseReason reason) {
        if (closeState.trySet(reason)) {
            logger.debug("browser {} disconnected: {}", connection.getEndpoint(), reason);
        }
        finish();
    }

    // Contexts and pages

    public BrowserContext getDefaultContext() {
        return defaultContext;
    }

    public List<BrowserContext> browserContexts() {
        List<BrowserContext> list = new ArrayList<>();
        list.add(defaultContext);
        list.addAll(contexts.values());
        return list;
    }

    public List<Page> pages() {
        List<Page> list = new ArrayList<>();
        for (BrowserContext context : browserContexts()) {
            list.addAll(context.pages());
        }
        return list;
    }

    public CompletableFuture<Page> newPageAsync() {
        return defaultContext.newPageAsync();
    }

    public Page newPage() {
        return defaultContext.newPage();
    }

    public CompletableFuture<BrowserContext> createBrowserContextAsync() {
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand("Target.createBrowserContext", reason));
        }
        return connection.method("Target.createBrowserContext").sendAsync()
                .thenApply(response -> {
                    BrowserContext context = new BrowserContext(this, response.getResultAsString("browserContextId"));
                    contexts.put(context.getId(), context);
                    CloseReason closed = closeState.getReason();
                    if (closed != null) {
                        context.onBrowserClosed(closed);
                    }
                    return context;
                });
    }

    public BrowserContext createBrowserContext() {
        SyncBridge.checkNotReceiveLoop("new browser context");
        return SyncBridge.join(createBrowserContextAsync(), "new browser context");
    }

    void forget(BrowserContext context) {
        if (context.getId() != null) {
            contexts.remove(context.getId(), context);
        }
    }

    // Lifecycle

    public boolean isClosed() {
        return closeState.isClosed();
    }

    public CloseReason getCloseReason() {
        return closeState.getReason();
    }

    /**
     * Fired exactly once, after every context and page has been closed.
     */
    public void onDisconnected(Consumer<CloseReason> listener) {
        closeState.onClose(listener);
    }

    /**
     * Asks the browser to shut down, then closes the connection. The acknowledgement is awaited
     * for at most the browser close timeout; the browser usually drops the transport right after.
     */
    public CompletableFuture<Void> closeAsync() {
        if (!closeState.trySet(CloseReason.EXPLICIT_CLOSE)) {
            return closeState.getFuture().thenApply(r -> null);
        }
        logger.debug("closing browser {}", connection.getEndpoint());
        return connection.method("Browser.close").sendAsync()
                .handle((response, error) -> {
                    if (error != null) {
                        logger.debug("Browser.close not acknowledged: {}", SyncBridge.unwrap(error).getMessage());
                    }
                    return null;
                })
                .completeOnTimeout(null, options.getBrowserCloseTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenComposeAsync(ignored -> connection.closeAsync(CloseReason.EXPLICIT_CLOSE), CdpExecutors.close())
                .thenCompose(ignored -> finish())
                .thenApplyAsync(r -> null, CdpExecutors.close());
    }

    /**
     * Closes the connection without asking the browser to exit.
     */
    public CompletableFuture<Void> disconnect() {
        return connection.closeAsync(CloseReason.EXPLICIT_CLOSE)
                .thenCompose(ignored -> closeState.getFuture())
                .thenApplyAsync(r -> null, CdpExecutors.close());
    }

    /**
     * Closes the browser and returns only once it is closed.
     */
    public void dispose() {
        if (SyncBridge.isReceiveLoop()) {
            closeState.trySet(CloseReason.EXPLICIT_CLOSE);
            connection.closeAsync(CloseReason.EXPLICIT_CLOSE);
            finish();
            return;
        }
        try {
            SyncBridge.await(closeAsync(), options.getCloseTimeout(), "close of browser " + connection.getEndpoint());
        } catch (CdpException e) {
            logger.warn("browser {} did not close cleanly: {}", connection.getEndpoint(), e.getMessage());
            connection.closeAsync(CloseReason.EXPLICIT_CLOSE);
            finish();
        }
    }

    @Override
    public void close() {
        dispose();
    }

    private CompletableFuture<CloseReason> finish() {
        CloseReason reason = closeState.getReason();
        List<CompletableFuture<CloseReason>> closing = new ArrayList<>();
        for (BrowserContext context : browserContexts()) {
            closing.add(context.onBrowserClosed(reason));
        }
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                .thenCompose(ignored -> {
                    if (closeState.complete()) {
                        logger.debug("browser {} closed: {}", connection.getEndpoint(), closeState.getReason());
                    }
                    return closeState.getFuture();
                });
    }

    // Accessors

    public CdpConnection getConnection() {
        return connection;
    }

    public CdpOptions getOptions() {
        return options;
    }

    public String getEndpoint() {
        return connection.getEndpoint();
    }

    @Override
    public String toString() {
        return closeState.toString();
    }

}
