package com.clapgrow.outreach.common.retry;

import java.util.Objects;

/**
 * Outcome of a single attempt of a retryable operation.
 *
 * Failures carry their {@link FailureClassification}, so the retry loop never has to
 * inspect error messages or exception types.
 *
 * @param <T> value produced by a successful attempt
 */
public record AttemptResult<T>(
    boolean success,
    T value,
    String errorMessage,
    FailureClassification classification
) {

    public static <T> AttemptResult<T> success(T value) {
        return new AttemptResult<>(true, value, null, null);
    }

    public static <T> AttemptResult<T> failure(String errorMessage, FailureClassification classification) {
        Objects.requireNonNull(classification, "classification");
        return new AttemptResult<>(false, null, errorMessage, classification);
    }

    public boolean isRetryable() {
        return !success && classification.isRetryable();
    }
}
