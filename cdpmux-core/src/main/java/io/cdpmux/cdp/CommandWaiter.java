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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One in-flight command. The future is assigned at most once; whoever removes the waiter
 * from its registry is the one that resolves it.
 */
final class CommandWaiter {

    private final int id;
    private final String method;
    private final CompletableFuture<CdpResponse> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> deadline;

    CommandWaiter(int id, String method) {
        this.id = id;
        this.method = method;
    }

    int getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    CompletableFuture<CdpResponse> getFuture() {
        return future;
    }

    void setDeadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    boolean resolve(CdpResponse response) {
        cancelDeadline();
        return future.complete(response);
    }

    boolean reject(Throwable error) {
        cancelDeadline();
        return future.completeExceptionally(error);
    }

    private void cancelDeadline() {
        ScheduledFuture<?> current = deadline;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "CommandWaiter[" + id + ": " + method + "]";
    }

}
