package com.zecinsight.common;

public class NotFoundException extends InsightException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, 404, message);
    }
}
