package com.zecinsight.common;

/**
 * Privacy or payment gating refused the request. The message must not leak wallet details.
 */
public class AccessDeniedException extends InsightException {

    public static final String CODE = "ACCESS_DENIED";

    public AccessDeniedException(String message) {
        super(CODE, 403, message);
    }
}
