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
package io.cdpmux.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * A DevTools WebSocket endpoint plus the few knobs the handshake needs.
 * Host, port and TLS are derived from the URL by {@link WebSocketTransport}.
 */
public final class WebSocketOptions {

    public static final int MEGABYTE = 1024 * 1024;

    static final int DEFAULT_MAX_PAYLOAD_SIZE = 16 * MEGABYTE;
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final URI uri;
    private final Map<String, String> headers;
    private final int maxPayloadSize;
    private final Duration connectTimeout;
    private final boolean trustAllCerts;

    public WebSocketOptions(URI uri, Map<String, String> headers, int maxPayloadSize,
                            Duration connectTimeout, boolean trustAllCerts) {
        if (uri == null) {
            throw new IllegalArgumentException("devtools url cannot be null");
        }
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("not a websocket url: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("devtools url has no host: " + uri);
        }
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive: " + connectTimeout);
        }
        this.uri = uri;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.maxPayloadSize = maxPayloadSize;
        this.connectTimeout = connectTimeout;
        this.trustAllCerts = trustAllCerts;
    }

    /**
     * Defaults: no extra headers, 16 MB frames, 30 s connect timeout, self-signed certificates accepted.
     */
    public static WebSocketOptions of(String url) {
        if (url == null) {
            throw new IllegalArgumentException("devtools url cannot be null");
        }
        return new WebSocketOptions(URI.create(url), null, DEFAULT_MAX_PAYLOAD_SIZE, DEFAULT_CONNECT_TIMEOUT, true);
    }

    public WebSocketOptions withHeaders(Map<String, String> headers) {
        return new WebSocketOptions(uri, headers, maxPayloadSize, connectTimeout, trustAllCerts);
    }

    public WebSocketOptions withMaxPayloadSize(int maxPayloadSize) {
        return new WebSocketOptions(uri, headers, maxPayloadSize, connectTimeout, trustAllCerts);
    }

    public WebSocketOptions withConnectTimeout(Duration connectTimeout) {
        return new WebSocketOptions(uri, headers, maxPayloadSize, connectTimeout, trustAllCerts);
    }

    public WebSocketOptions withTrustAllCerts(boolean trustAllCerts) {
        return new WebSocketOptions(uri, headers, maxPayloadSize, connectTimeout, trustAllCerts);
    }

    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Largest inbound frame; screenshots and traces arrive as single frames.
     */
    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public boolean isTrustAllCerts() {
        return trustAllCerts;
    }

    @Override
    public String toString() {
        return "WebSocketOptions[" + uri + "]";
    }

}
