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

import io.cdpmux.transport.WebSocketOptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client configuration. Timeouts are in milliseconds in the map form.
 * Supports both Builder pattern and Map constructor.
 */
public class CdpOptions {

    private final int waitTimeout;
    private final int closeTimeout;
    private final int browserCloseTimeout;
    private final int connectTimeout;
    private final int maxPayloadSize;
    private final Map<String, String> headers;

    private CdpOptions(Builder builder) {
        this.waitTimeout = builder.waitTimeout;
        this.closeTimeout = builder.closeTimeout;
        this.browserCloseTimeout = builder.browserCloseTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.maxPayloadSize = builder.maxPayloadSize;
        this.headers = builder.headers != null ? Map.copyOf(builder.headers) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public static CdpOptions fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        if (map.containsKey("waitTimeout")) {
            builder.waitTimeout(toInt(map.get("waitTimeout")));
        }
        if (map.containsKey("closeTimeout")) {
            builder.closeTimeout(toInt(map.get("closeTimeout")));
        }
        if (map.containsKey("browserCloseTimeout")) {
            builder.browserCloseTimeout(toInt(map.get("browserCloseTimeout")));
        }
        if (map.containsKey("connectTimeout")) {
            builder.connectTimeout(toInt(map.get("connectTimeout")));
        }
        if (map.containsKey("maxPayloadSize")) {
            builder.maxPayloadSize(toInt(map.get("maxPayloadSize")));
        }
        if (map.containsKey("headers")) {
            builder.headers((Map<String, String>) map.get("headers"));
        }
        return builder.build();
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    public WebSocketOptions toWebSocketOptions(String webSocketUrl) {
        return WebSocketOptions.of(webSocketUrl)
                .withMaxPayloadSize(maxPayloadSize)
                .withConnectTimeout(Duration.ofMillis(connectTimeout))
                .withHeaders(headers);
    }

    // Getters

    /**
     * Deadline of event waits that do not pass their own. Zero disables it.
     */
    public Duration getDefaultWaitTimeout() {
        return Duration.ofMillis(waitTimeout);
    }

    /**
     * Upper bound for synchronous dispose of a page, context, session or connection.
     */
    public Duration getCloseTimeout() {
        return Duration.ofMillis(closeTimeout);
    }

    /**
     * How long a browser close waits for the {@code Browser.close} acknowledgement
     * before tearing the connection down itself.
     */
    public Duration getBrowserCloseTimeout() {
        return Duration.ofMillis(browserCloseTimeout);
    }

    public Duration getConnectTimeout() {
        return Duration.ofMillis(connectTimeout);
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public static class Builder {

        private int waitTimeout = 30000;
        private int closeTimeout = 10000;
        private int browserCloseTimeout = 5000;
        private int connectTimeout = 30000;
        private int maxPayloadSize = 16 * WebSocketOptions.MEGABYTE;
        private Map<String, String> headers;

        public Builder waitTimeout(int millis) {
            this.waitTimeout = millis;
            return this;
        }

        public Builder closeTimeout(int millis) {
            this.closeTimeout = millis;
            return this;
        }

        public Builder browserCloseTimeout(int millis) {
            this.browserCloseTimeout = millis;
            return this;
        }

        public Builder connectTimeout(int millis) {
            this.connectTimeout = millis;
            return this;
        }

        public Builder maxPayloadSize(int bytes) {
            this.maxPayloadSize = bytes;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder header(String name, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(name, value);
            return this;
        }

        public CdpOptions build() {
            if (waitTimeout < 0 || closeTimeout <= 0 || browserCloseTimeout <= 0 || connectTimeout <= 0) {
                throw new IllegalArgumentException("timeouts must be positive (waitTimeout may be zero)");
            }
            return new CdpOptions(this);
        }

    }

}
