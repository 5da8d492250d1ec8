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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Predicate waiters of one session, evaluated in registration order against every event.
 * Match, deadline and close race to remove a waiter; only the remover resolves it.
 */
final class EventWaiterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EventWaiterRegistry.class);

    private final AtomicLong idGenerator = new AtomicLong();
    private final ConcurrentSkipListMap<Long, EventWaiter> waiters = new ConcurrentSkipListMap<>();

    /**
     * @param timeout null or zero for no deadline
     */
    CompletableFuture<CdpEvent> register(String description, Predicate<CdpEvent> predicate, Duration timeout) {
        EventWaiter waiter = new EventWaiter(idGenerator.incrementAndGet(), description, predicate);
        waiters.put(waiter.getId(), waiter);
        if (timeout != null && !timeout.isZero()) {
            waiter.setDeadline(CdpExecutors.timer().schedule(() -> {
                if (claim(waiter)) {
                    logger.debug("{} timed out after {}ms", waiter, timeout.toMillis());
                    waiter.reject(new CdpTimeoutException(timeout, description));
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        return waiter.getFuture();
    }

    void dispatch(CdpEvent event) {
        for (EventWaiter waiter : waiters.values()) {
            boolean matched;
            try {
                matched = waiter.test(event);
            } catch (RuntimeException e) {
                if (claim(waiter)) {
                    waiter.reject(e);
                }
                continue;
            }
            if (matched && claim(waiter)) {
                waiter.resolve(event);
            }
        }
    }

    /**
     * Rejects every waiter still registered.
     */
    void rejectAll(Function<EventWaiter, Throwable> error) {
        for (EventWaiter waiter : waiters.values()) {
            if (claim(waiter)) {
                waiter.reject(error.apply(waiter));
            }
        }
    }

    int size() {
        return waiters.size();
    }

    private boolean claim(EventWaiter waiter) {
        return waiters.remove(waiter.getId(), waiter);
    }

}
