package com.zecinsight.api.controller;

/**
 * Authentication happens upstream; the gateway forwards the caller's user id in this header.
 */
final class ApiHeaders {

    static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
