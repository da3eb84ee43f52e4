package com.zecinsight.common;

import lombok.Getter;

/**
 * Base of the analytics error taxonomy. Carries a stable error code and the HTTP status the API layer maps it to.
 */
@Getter
public class InsightException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public InsightException(String errorCode, int httpStatus, String message) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public InsightException(String errorCode, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
