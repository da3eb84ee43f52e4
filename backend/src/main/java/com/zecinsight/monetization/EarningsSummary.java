package com.zecinsight.monetization;

import java.math.BigDecimal;

/**
 * Owner earnings in ZEC. available equals pending: every pending row can be withdrawn.
 */
public record EarningsSummary(
        int totalSales,
        BigDecimal totalEarnedZec,
        BigDecimal totalFeesZec,
        BigDecimal pendingZec,
        BigDecimal withdrawnZec,
        BigDecimal availableZec
) {
}
