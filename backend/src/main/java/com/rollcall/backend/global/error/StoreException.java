package com.rollcall.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * The underlying persistence layer failed. Nothing was committed by the failing call.
 */
public class StoreException extends RetryableProblemException {

    private static final int RETRY_AFTER_SECONDS = 5;

    public StoreException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "store.unavailable", detail, RETRY_AFTER_SECONDS, cause);
    }
}
