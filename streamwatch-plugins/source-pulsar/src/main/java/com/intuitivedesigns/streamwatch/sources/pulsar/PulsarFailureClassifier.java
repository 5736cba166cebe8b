/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.pulsar;

import com.intuitivedesigns.streamwatch.core.FailureClassification;
import com.intuitivedesigns.streamwatch.core.FailureClassifier;
import org.apache.pulsar.client.api.PulsarClientException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Defers to the client's own notion of a retriable error. Anything that is not a
 * {@link PulsarClientException} is fatal.
 */
public final class PulsarFailureClassifier implements FailureClassifier {

    @Override
    public FailureClassification classify(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t instanceof PulsarClientException && PulsarClientException.isRetriableError(t)
                ? FailureClassification.RETRIABLE
                : FailureClassification.FATAL;
    }
}
