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

/**
 * A command or wait was rejected because its session, connection, page or browser closed.
 */
public class TargetClosedException extends CdpException {

    private final CloseReason closeReason;

    public TargetClosedException(String message, CloseReason closeReason) {
        super(message);
        this.closeReason = closeReason;
    }

    public static TargetClosedException forCommand(String method, CloseReason reason) {
        return new TargetClosedException(
                "Protocol error (" + method + "): Target closed. (" + reason.getDescription() + ")", reason);
    }

    public static TargetClosedException forWait(String description, CloseReason reason) {
        return new TargetClosedException(
                "Target closed while waiting for " + description + ". (" + reason.getDescription() + ")", reason);
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

}
