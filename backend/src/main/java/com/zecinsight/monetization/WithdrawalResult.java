package com.zecinsight.monetization;

import java.math.BigDecimal;
import java.time.Instant;

public record WithdrawalResult(
        String withdrawalId,
        String gatewayWithdrawalId,
        BigDecimal amountZec,
        String toAddress,
        int earningsConsumed,
        String status,
        Instant requestedAt
) {
}
