package com.zecinsight.common;

/**
 * Bad enum value, out-of-range number or missing field. Details are safe to return to the caller.
 */
public class ValidationException extends InsightException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, 400, message);
    }
}
