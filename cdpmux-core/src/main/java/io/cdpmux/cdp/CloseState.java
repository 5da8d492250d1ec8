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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Single-fire close guard shared by every level of the hierarchy.
 * <p>
 * Closing happens in two steps. {@link #trySet(CloseReason)} flips the state synchronously and
 * records the first reason offered; later offers are ignored. {@link #complete()} runs once the
 * level has swept its waiters and children: close listeners fire exactly once, in registration
 * order, and then {@link #getFuture()} completes.
 */
public class CloseState {

    private static final Logger logger = LoggerFactory.getLogger(CloseState.class);

    private final String name;
    private final AtomicReference<CloseReason> reason = new AtomicReference<>();
    private final CompletableFuture<CloseReason> future = new CompletableFuture<>();
    private final List<Consumer<CloseReason>> listeners = new ArrayList<>();
    private boolean notified;

    public CloseState(String name) {
        this.name = name;
    }

    /**
     * @return true if this call performed the transition
     */
    public boolean trySet(CloseReason closeReason) {
        return reason.compareAndSet(null, closeReason);
    }

    public boolean isClosed() {
        return reason.get() != null;
    }

    public boolean isCompleted() {
        return future.isDone();
    }

    public CloseReason getReason() {
        return reason.get();
    }

    public CompletableFuture<CloseReason> getFuture() {
        return future;
    }

    /**
     * Registers a listener. If the close already completed it is invoked immediately on the calling thread.
     */
    public void onClose(Consumer<CloseReason> listener) {
        synchronized (this) {
            if (!notified) {
                listeners.add(listener);
                return;
            }
        }
        fire(listener, reason.get());
    }

    /**
     * @return true if this call completed the close
     */
    public boolean complete() {
        CloseReason closeReason = reason.get();
        if (closeReason == null) {
            throw new IllegalStateException(name + " completed before a close reason was set");
        }
        List<Consumer<CloseReason>> toNotify;
        synchronized (this) {
            if (notified) {
                return false;
            }
            notified = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Consumer<CloseReason> listener : toNotify) {
            fire(listener, closeReason);
        }
        future.complete(closeReason);
        return true;
    }

    private void fire(Consumer<CloseReason> listener, CloseReason closeReason) {
        try {
            listener.accept(closeReason);
        } catch (Exception e) {
            logger.error("close listener error for {}: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        CloseReason current = reason.get();
        return name + (current == null ? "[open]" : "[" + (isCompleted() ? "closed" : "closing") + ": " + current + "]");
    }

}
