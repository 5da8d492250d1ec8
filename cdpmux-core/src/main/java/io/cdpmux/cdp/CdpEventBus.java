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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event subscriptions of one session, by method name or for every event.
 * Handlers run on the receive loop in frame order and must not block.
 */
final class CdpEventBus {

    private static final Logger logger = LoggerFactory.getLogger(CdpEventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<CdpEvent>>> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<CdpEvent>> anyHandlers = new CopyOnWriteArrayList<>();

    void on(String method, Consumer<CdpEvent> handler) {
        handlers.computeIfAbsent(method, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    void off(String method, Consumer<CdpEvent> handler) {
        List<Consumer<CdpEvent>> list = handlers.get(method);
        if (list != null) {
            list.remove(handler);
        }
    }

    void offAll(String method) {
        handlers.remove(method);
    }

    void onAny(Consumer<CdpEvent> handler) {
        anyHandlers.add(handler);
    }

    void offAny(Consumer<CdpEvent> handler) {
        anyHandlers.remove(handler);
    }

    void clear() {
        handlers.clear();
        anyHandlers.clear();
    }

    /**
     * Each distinct handler sees the event once, even if it subscribed by method and for every event
     * or registered twice.
     */
    void publish(CdpEvent event) {
        List<Consumer<CdpEvent>> list = handlers.get(event.getMethod());
        Set<Consumer<CdpEvent>> delivered = Collections.newSetFromMap(new IdentityHashMap<>());
        if (list != null) {
            for (Consumer<CdpEvent> handler : list) {
                if (delivered.add(handler)) {
                    deliver(handler, event);
                }
            }
        }
        for (Consumer<CdpEvent> handler : anyHandlers) {
            if (delivered.add(handler)) {
                deliver(handler, event);
            }
        }
    }

    private void deliver(Consumer<CdpEvent> handler, CdpEvent event) {
        try {
            handler.accept(event);
        } catch (Exception e) {
            logger.error("event handler error for {}: {}", event.getMethod(), e.getMessage(), e);
        }
    }

}
