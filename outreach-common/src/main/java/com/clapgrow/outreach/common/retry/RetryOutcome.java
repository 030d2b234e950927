package com.clapgrow.outreach.common.retry;

/**
 * Final result of {@link RetryRunner#run}: the last attempt's result and the number of
 * attempts made (at least one).
 */
public record RetryOutcome<T>(AttemptResult<T> result, int attempts) {

    public boolean isSuccess() {
        return result.success();
    }

    public T value() {
        return result.value();
    }

    public String errorMessage() {
        return result.errorMessage();
    }

    public FailureClassification classification() {
        return result.classification();
    }
}
