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

import java.util.Map;

/**
 * An inbound reply correlated to a command by id, carrying either a result or an error payload.
 */
public class CdpResponse {

    private final int id;
    private final Map<String, Object> result;
    private final Map<String, Object> error;
    private final Map<String, Object> raw;

    @SuppressWarnings("unchecked")
    public CdpResponse(Map<String, Object> raw) {
        this.raw = raw;
        this.id = raw.containsKey("id") ? ((Number) raw.get("id")).intValue() : -1;
        this.result = (Map<String, Object>) raw.get("result");
        this.error = (Map<String, Object>) raw.get("error");
    }

    public int getId() {
        return id;
    }

    public String getSessionId() {
        return (String) raw.get("sessionId");
    }

    public boolean isError() {
        return error != null;
    }

    public Map<String, Object> getError() {
        return error;
    }

    public String getErrorMessage() {
        return error == null ? null : JsonPaths.asString(error.get("message"));
    }

    public Integer getErrorCode() {
        return error == null ? null : JsonPaths.asInt(error.get("code"));
    }

    public String getErrorData() {
        return error == null ? null : JsonPaths.asString(error.get("data"));
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public Map<String, Object> getRaw() {
        return raw;
    }

    /**
     * Value from result by dot notation or JSONPath, e.g. {@code getResult("frameTree.frame.id")}.
     */
    public <T> T getResult(String path) {
        return JsonPaths.get(result, path);
    }

    public String getResultAsString(String path) {
        return JsonPaths.asString(getResult(path));
    }

    public Integer getResultAsInt(String path) {
        return JsonPaths.asInt(getResult(path));
    }

    public Boolean getResultAsBoolean(String path) {
        return JsonPaths.asBoolean(getResult(path));
    }

    /**
     * Value from anywhere in the frame.
     */
    public <T> T get(String path) {
        return JsonPaths.get(raw, path);
    }

    @Override
    public String toString() {
        if (isError()) {
            return "CdpResponse[" + id + " ERROR: " + getErrorMessage() + "]";
        }
        return "CdpResponse[" + id + "]";
    }

}
