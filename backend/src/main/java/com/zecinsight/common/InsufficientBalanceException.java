package com.zecinsight.common;

/**
 * Withdrawal amount exceeds the owner's pending earnings.
 */
public class InsufficientBalanceException extends InsightException {

    public static final String CODE = "INSUFFICIENT_BALANCE";

    public InsufficientBalanceException(String message) {
        super(CODE, 400, message);
    }
}
