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
import java.util.function.Predicate;

/**
 * A wait for the first event satisfying a predicate, with an optional deadline.
 */
final class EventWaiter {

    private final long id;
    private final String description;
    private final Predicate<CdpEvent> predicate;
    private final CompletableFuture<CdpEvent> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> deadline;

    EventWaiter(long id, String description, Predicate<CdpEvent> predicate) {
        this.id = id;
        this.description = description;
        this.predicate = predicate;
    }

    long getId() {
        return id;
    }

    String getDescription() {
        return description;
    }

    CompletableFuture<CdpEvent> getFuture() {
        return future;
    }

    void setDeadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    boolean test(CdpEvent event) {
        return predicate.test(event);
    }

    boolean resolve(CdpEvent event) {
        cancelDeadline();
        return future.complete(event);
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
        return "EventWaiter[" + id + ": " + description + "]";
    }

}
