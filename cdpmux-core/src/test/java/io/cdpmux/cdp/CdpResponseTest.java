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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CdpResponseTest {

    @Test
    void testSuccessResponse() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 1,
                "result", Map.of("targetId", "T1")));

        assertEquals(1, response.getId());
        assertFalse(response.isError());
        assertNull(response.getError());
        assertNull(response.getErrorMessage());
        assertEquals("T1", response.getResultAsString("targetId"));
        assertEquals("CdpResponse[1]", response.toString());
    }

    @Test
    void testErrorResponse() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 2,
                "error", Map.of(
                        "code", -32602,
                        "message", "Invalid parameters",
                        "data", "Failed to deserialize params.targetId")));

        assertTrue(response.isError());
        assertEquals(-32602, response.getErrorCode());
        assertEquals("Invalid parameters", response.getErrorMessage());
        assertEquals("Failed to deserialize params.targetId", response.getErrorData());
        assertEquals("CdpResponse[2 ERROR: Invalid parameters]", response.toString());

        ProtocolException e = new ProtocolException("Target.attachToTarget", response);
        assertEquals("Protocol error (Target.attachToTarget): Invalid parameters Failed to deserialize params.targetId",
                e.getMessage());
        assertSame(response, e.getResponse());
    }

    @Test
    void testSessionScopedResponse() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", 3);
        raw.put("sessionId", "S1");
        raw.put("result", Map.of("result", Map.of("type", "number", "value", 2)));
        CdpResponse response = new CdpResponse(raw);

        assertEquals("S1", response.getSessionId());
        assertEquals("number", response.getResult("result.type"));
        assertEquals(2, response.getResultAsInt("result.value"));
    }

    @Test
    void testTypedResults() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 4,
                "result", Map.of("count", 42, "success", true)));

        assertEquals("42", response.getResultAsString("count"));
        assertEquals(42, response.getResultAsInt("count"));
        assertTrue(response.getResultAsBoolean("success"));
        assertNull(response.getResultAsInt("missing"));
    }

    @Test
    void testJsonPathWithArray() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 5,
                "result", Map.of("targetInfos", List.of(
                        Map.of("targetId", "T1", "type", "page"),
                        Map.of("targetId", "T2", "type", "service_worker")))));

        List<Map<String, Object>> infos = response.getResult("targetInfos");
        assertEquals(2, infos.size());
        assertEquals("T2", response.getResult("$.targetInfos[1].targetId"));
    }

    @Test
    void testGetFromRaw() {
        CdpResponse response = new CdpResponse(Map.of("id", 6, "result", Map.of()));
        assertEquals(6, response.<Number>get("id").intValue());
        assertNull(response.getResult("anything"));
    }

}
