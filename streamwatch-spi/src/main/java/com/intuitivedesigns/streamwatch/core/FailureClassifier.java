/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import java.util.Objects;

/**
 * Pure function from a transport error to a {@link FailureClassification}.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureClassification classify(Throwable error);

    static FailureClassifier alwaysFatal() {
        return e -> FailureClassification.FATAL;
    }

    static FailureClassifier alwaysRetriable() {
        return e -> FailureClassification.RETRIABLE;
    }

    /**
     * Retriable when {@code error} or any of its causes is an instance of one of {@code types}.
     */
    @SafeVarargs
    static FailureClassifier retryOn(Class<? extends Throwable>... types) {
        Objects.requireNonNull(types, "types");
        return e -> {
            for (Class<? extends Throwable> type : types) {
                if (causedBy(e, type)) return FailureClassification.RETRIABLE;
            }
            return FailureClassification.FATAL;
        };
    }

    /**
     * Walks the cause chain (guarding against cycles).
     */
    static boolean causedBy(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (type.isInstance(current)) return true;
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }
}
