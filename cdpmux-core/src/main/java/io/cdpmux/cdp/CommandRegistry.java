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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight commands keyed by correlation id. Insertion and removal are single atomic steps,
 * so a waiter can be claimed for resolution exactly once.
 */
final class CommandRegistry {

    private final ConcurrentHashMap<Integer, CommandWaiter> waiters = new ConcurrentHashMap<>();

    void register(CommandWaiter waiter) {
        if (waiters.putIfAbsent(waiter.getId(), waiter) != null) {
            throw new IllegalStateException("command id already in flight: " + waiter.getId());
        }
    }

    CommandWaiter claim(int id) {
        return waiters.remove(id);
    }

    boolean claim(CommandWaiter waiter) {
        return waiters.remove(waiter.getId(), waiter);
    }

    /**
     * Claims every waiter present, including ones registered while the sweep runs.
     */
    List<CommandWaiter> claimAll() {
        List<CommandWaiter> claimed = new ArrayList<>();
        for (Integer id : waiters.keySet()) {
            CommandWaiter waiter = waiters.remove(id);
            if (waiter != null) {
                claimed.add(waiter);
            }
        }
        return claimed;
    }

    int size() {
        return waiters.size();
    }

}
