package com.zecinsight.monetization;

import com.zecinsight.domain.WalletType;

import java.math.BigDecimal;

/**
 * Anonymized marketplace entry. Never carries the wallet address.
 */
public record MarketplaceListing(
        String walletId,
        WalletType walletType,
        String projectCategory,
        BigDecimal priceZec,
        MetricsPreview metricsPreview,
        long purchaseCount
) {

    public record MetricsPreview(int activeDays, long totalTransactions, Integer productivityScore) {
    }
}
