/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.websocket;

import com.intuitivedesigns.streamwatch.core.FailureClassification;
import com.intuitivedesigns.streamwatch.core.FailureClassifier;

import java.io.IOException;
import java.net.ProtocolException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Transport-level I/O failures (dropped connections, failed handshakes) are retriable. A
 * protocol violation by the server is fatal, as is anything that is not I/O.
 */
public final class WebSocketFailureClassifier implements FailureClassifier {

    @Override
    public FailureClassification classify(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        // ProtocolException is an IOException
        if (t instanceof ProtocolException) return FailureClassification.FATAL;
        if (t instanceof IOException) return FailureClassification.RETRIABLE;
        return FailureClassification.FATAL;
    }
}
