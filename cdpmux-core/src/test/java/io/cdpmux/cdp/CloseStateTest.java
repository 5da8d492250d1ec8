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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CloseStateTest {

    @Test
    void testFirstReasonWins() {
        CloseState state = new CloseState("Test");
        assertFalse(state.isClosed());
        assertTrue(state.trySet(CloseReason.TRANSPORT_CLOSED));
        assertFalse(state.trySet(CloseReason.EXPLICIT_CLOSE));
        assertTrue(state.isClosed());
        assertFalse(state.isCompleted());
        assertEquals(CloseReason.TRANSPORT_CLOSED, state.getReason());
    }

    @Test
    void testListenersFireOnceInOrder() {
        CloseState state = new CloseState("Test");
        List<String> calls = new ArrayList<>();
        state.onClose(r -> calls.add("first:" + r));
        state.onClose(r -> {
            throw new RuntimeException("listener failure");
        });
        state.onClose(r -> calls.add("second:" + r));
        state.trySet(CloseReason.EXPLICIT_CLOSE);
        assertTrue(state.complete());
        assertFalse(state.complete());
        assertEquals(List.of("first:EXPLICIT_CLOSE", "second:EXPLICIT_CLOSE"), calls);
        assertTrue(state.isCompleted());
        assertEquals(CloseReason.EXPLICIT_CLOSE, state.getFuture().join());
    }

    @Test
    void testListenerAfterCompleteFiresImmediately() {
        CloseState state = new CloseState("Test");
        state.trySet(CloseReason.TARGET_DETACHED);
        state.complete();
        List<CloseReason> reasons = new ArrayList<>();
        state.onClose(reasons::add);
        assertEquals(List.of(CloseReason.TARGET_DETACHED), reasons);
    }

    @Test
    void testListenersSeeFutureIncomplete() {
        CloseState state = new CloseState("Test");
        List<Boolean> seen = new ArrayList<>();
        state.onClose(r -> seen.add(state.getFuture().isDone()));
        state.trySet(CloseReason.EXPLICIT_CLOSE);
        state.complete();
        assertEquals(List.of(false), seen);
    }

    @Test
    void testCompleteWithoutReasonThrows() {
        CloseState state = new CloseState("Test");
        assertThrows(IllegalStateException.class, state::complete);
    }

    @Test
    void testToString() {
        CloseState state = new CloseState("Page[T1]");
        assertEquals("Page[T1][open]", state.toString());
        state.trySet(CloseReason.EXPLICIT_CLOSE);
        assertEquals("Page[T1][closing: EXPLICIT_CLOSE]", state.toString());
        state.complete();
        assertEquals("Page[T1][closed: EXPLICIT_CLOSE]", state.toString());
    }

    @Test
    void testReasonDescriptions() {
        assertEquals("Target.detachedFromTarget", CloseReason.TARGET_DETACHED.getDescription());
        assertTrue(CloseReason.TRANSPORT_CLOSED.isTransportFault());
        assertTrue(CloseReason.TRANSPORT_ERROR.isTransportFault());
        assertFalse(CloseReason.EXPLICIT_CLOSE.isTransportFault());
    }

}
