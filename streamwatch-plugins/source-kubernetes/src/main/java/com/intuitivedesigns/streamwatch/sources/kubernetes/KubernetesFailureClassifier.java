/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import com.intuitivedesigns.streamwatch.core.FailureClassification;
import com.intuitivedesigns.streamwatch.core.FailureClassifier;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.WatcherException;

import java.io.EOFException;
import java.net.HttpURLConnection;
import java.util.Locale;

/**
 * A watch whose stream ended under it is restarted; anything else stops the source.
 *
 * <p>Retriable: an {@link EOFException} or "stream closed" anywhere in the cause chain, and
 * HTTP 410 Gone (the resource version is too old, a fresh watch resynchronizes).</p>
 */
public final class KubernetesFailureClassifier implements FailureClassifier {

    private static final int MAX_DEPTH = 32;

    @Override
    public FailureClassification classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_DEPTH) {
            if (isRetriable(current)) return FailureClassification.RETRIABLE;
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return FailureClassification.FATAL;
    }

    private static boolean isRetriable(Throwable t) {
        if (t instanceof EOFException) return true;
        if (t instanceof WatcherException && ((WatcherException) t).isHttpGone()) return true;
        if (t instanceof KubernetesClientException
                && ((KubernetesClientException) t).getCode() == HttpURLConnection.HTTP_GONE) {
            return true;
        }
        String msg = t.getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("stream closed");
    }
}
