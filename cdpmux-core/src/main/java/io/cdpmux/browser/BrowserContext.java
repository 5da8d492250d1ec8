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
import io.cdpmux.cdp.CdpMessage;
import io.cdpmux.cdp.CdpSession;
import io.cdpmux.cdp.CloseReason;
import io.cdpmux.cdp.CloseState;
import io.cdpmux.cdp.SyncBridge;
import io.cdpmux.cdp.TargetClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * A browser context (profile) and the pages opened in it. The default context has a null id
 * and lives as long as the browser.
 */
public class BrowserContext {

    private static final Logger logger = LoggerFactory.getLogger(BrowserContext.class);

    private final Browser browser;
    private final String id;
    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final CloseState closeState;

    BrowserContext(Browser browser, String id) {
        this.browser = browser;
        this.id = id;
        this.closeState = new CloseState("BrowserContext[" + (id == null ? "default" : id) + "]");
    }

    public String getId() {
        return id;
    }

    public boolean isDefault() {
        return id == null;
    }

    public Browser getBrowser() {
        return browser;
    }

    public List<Page> pages() {
        List<Page> list = new ArrayList<>();
        for (Page page : pages.values()) {
            if (!page.isClosed()) {
                list.add(page);
            }
        }
        return list;
    }

    /**
     * Creates a blank page target, attaches a flat session to it and enables network events
     * so that request and response waits can be served.
     */
    public CompletableFuture<Page> newPageAsync() {
        CloseReason reason = closeState.getReason() != null ? closeState.getReason() : browser.getCloseReason();
        if (reason != null) {
            return CompletableFuture.failedFuture(TargetClosedException.forCommand("Target.createTarget", reason));
        }
        CdpConnection connection = browser.getConnection();
        CdpMessage create = connection.method("Target.createTarget").param("url", "about:blank");
        if (id != null) {
            create.param("browserContextId", id);
        }
        return create.sendAsync()
                .thenCompose(created -> {
                    String targetId = created.getResultAsString("targetId");
                    return connection.method("Target.attachToTarget")
                            .param("targetId", targetId)
                            .param("flatten", true)
                            .sendAsync()
                            .thenApply(attached -> {
                                CdpSession session = connection.attach(attached.getResultAsString("sessionId"), targetId, "page");
                                return register(new Page(this, session, targetId));
                            });
                })
                .thenCompose(page -> page.method("Network.enable").sendAsync().thenApply(r -> page));
    }

    public Page newPage() {
        SyncBridge.checkNotReceiveLoop("new page");
        return SyncBridge.join(newPageAsync(), "new page");
    }

    private Page register(Page page) {
        pages.put(page.getTargetId(), page);
        page.onClose(r -> pages.remove(page.getTargetId(), page));
        CloseReason reason = closeState.getReason();
        if (reason != null) {
            page.closeLocally(reason);
        }
        logger.debug("page {} opened in {}", page.getTargetId(), this);
        return page;
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

    /**
     * Disposes the context in the browser, then closes whatever pages the browser did not detach.
     *
     * @throws IllegalStateException for the default context
     */
    public CompletableFuture<Void> closeAsync() {
        if (id == null) {
            throw new IllegalStateException("the default browser context cannot be closed");
        }
        if (!closeState.trySet(CloseReason.EXPLICIT_CLOSE)) {
            return closeState.getFuture().thenApply(r -> null);
        }
        return browser.getConnection().method("Target.disposeBrowserContext")
                .param("browserContextId", id)
                .sendAsync()
                .handle((response, error) -> {
                    if (error != null) {
                        logger.debug("dispose of context {} failed: {}", id, SyncBridge.unwrap(error).getMessage());
                    }
                    return null;
                })
                .thenComposeAsync(ignored -> finish(), CdpExecutors.close())
                .thenApply(r -> null);
    }

    public void close() {
        if (SyncBridge.isReceiveLoop()) {
            closeAsync();
            return;
        }
        try {
            SyncBridge.await(closeAsync(), browser.getOptions().getCloseTimeout(), "close of context " + id);
        } catch (CdpException e) {
            logger.warn("context {} did not close cleanly, closing locally: {}", id, e.getMessage());
            finish();
        }
    }

    /**
     * The browser went away: everything in this context is closed with the browser's reason.
     */
    CompletableFuture<CloseReason> onBrowserClosed(CloseReason reason) {
        closeState.trySet(reason);
        return finish();
    }

    /**
     * Closes the pages still open, then completes once all of them have.
     */
    private CompletableFuture<CloseReason> finish() {
        CloseReason reason = closeState.getReason();
        List<CompletableFuture<?>> closing = new ArrayList<>();
        for (Page page : pages.values()) {
            if (!page.isCloseCompleted()) {
                page.closeLocally(reason);
            }
            closing.add(page.getSession().getCloseFuture());
        }
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    browser.forget(this);
                    closeState.complete();
                    return closeState.getReason();
                });
    }

    @Override
    public String toString() {
        return closeState.toString();
    }

}
