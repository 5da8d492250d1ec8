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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fluent builder for an outbound command on one session.
 * The correlation id is allocated by the connection when the command is written.
 */
public class CdpMessage {

    // FLAG_PROTECT_4WEB keeps forward slashes unescaped
    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private final CdpSession session;
    private final String method;
    private Map<String, Object> params;
    private Duration timeout;

    CdpMessage(CdpSession session, String method) {
        this.session = session;
        this.method = method;
    }

    public CdpMessage param(String key, Object value) {
        if (params == null) {
            params = new LinkedHashMap<>();
        }
        params.put(key, value);
        return this;
    }

    public CdpMessage params(Map<String, Object> params) {
        if (params != null) {
            if (this.params == null) {
                this.params = new LinkedHashMap<>(params);
            } else {
                this.params.putAll(params);
            }
        }
        return this;
    }

    /**
     * Bounds this one command. Without it a command only ends with a reply or a close.
     */
    public CdpMessage timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public CdpMessage timeout(long millis) {
        this.timeout = Duration.ofMillis(millis);
        return this;
    }

    /**
     * Blocking send. Must not be called from a receive loop.
     */
    public CdpResponse send() {
        SyncBridge.checkNotReceiveLoop(method);
        return SyncBridge.join(sendAsync(), method);
    }

    public CompletableFuture<CdpResponse> sendAsync() {
        return session.sendAsync(this);
    }

    // Getters

    public CdpSession getSession() {
        return session;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getSessionId() {
        return session != null ? session.getSessionId() : null;
    }

    public Map<String, Object> toMap(int id) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("method", method);
        if (params != null && !params.isEmpty()) {
            map.put("params", params);
        }
        String sessionId = getSessionId();
        if (sessionId != null) {
            map.put("sessionId", sessionId);
        }
        return map;
    }

    public String toJson(int id) {
        return JSONValue.toJSONString(toMap(id), JSON_STYLE);
    }

    @Override
    public String toString() {
        return "CdpMessage[" + method + "]";
    }

}
