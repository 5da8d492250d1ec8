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

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocks a caller on an asynchronous completion.
 * <p>
 * The blocked thread only observes the future; the work that completes it runs on a receive loop
 * or on {@link CdpExecutors#close()}. Blocking on a receive loop would stall the very frames the
 * future waits for, so it is refused.
 */
public final class SyncBridge {

    private SyncBridge() {
    }

    public static boolean isReceiveLoop() {
        return CdpConnection.currentReceiveLoop() != null;
    }

    public static void checkNotReceiveLoop(String description) {
        CdpConnection connection = CdpConnection.currentReceiveLoop();
        if (connection != null) {
            throw new IllegalStateException("cannot block on " + description
                    + " from the receive loop of " + connection.getEndpoint() + ", use the async variant");
        }
    }

    /**
     * Wait without a deadline. Only safe for futures that a close sweep is guaranteed to terminate.
     */
    public static <T> T join(CompletableFuture<T> future, String description) {
        checkNotReceiveLoop(description);
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CdpException("cancelled while waiting for " + description, e);
        }
    }

    public static <T> T await(CompletableFuture<T> future, Duration timeout, String description) {
        checkNotReceiveLoop(description);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CdpTimeoutException(timeout, description);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CdpException("cancelled while waiting for " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CdpException("interrupted while waiting for " + description, e);
        }
    }

    public static RuntimeException unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        return new CdpException("CDP error: " + t.getMessage(), t);
    }

}
