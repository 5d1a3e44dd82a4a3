package com.satmobile.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Raised when the document store is temporarily unavailable. Callers may retry the
 * whole operation; every write issued by the engine is an idempotent merge.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(String code, String detail, int retryAfterSeconds) {
        super(HttpStatus.SERVICE_UNAVAILABLE, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
